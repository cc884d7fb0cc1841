package com.catalogharvester.crawl.listing;

import com.catalogharvester.config.CrawlerProperties;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls item identifiers out of link targets on a listing page. The first capture group
 * of the configured pattern is the identifier (the whole match when there is no group).
 */
@Component
public class ItemIdentifierExtractor {
    private final Pattern identifierPattern;

    public ItemIdentifierExtractor(CrawlerProperties properties) {
        this.identifierPattern = Pattern.compile(properties.getStore().getIdentifierPattern());
    }

    public Set<String> extract(Document document) {
        Set<String> identifiers = new LinkedHashSet<>();
        for (Element link : document.select("a[href]")) {
            String identifier = match(link.attr("href"));
            if (identifier != null) {
                identifiers.add(identifier);
            }
        }
        return identifiers;
    }

    public String match(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        Matcher matcher = identifierPattern.matcher(href);
        if (!matcher.find()) {
            return null;
        }
        return matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group();
    }
}
