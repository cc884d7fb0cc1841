package com.catalogharvester.crawl.link;

import com.catalogharvester.crawl.model.PageType;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies a page URL as product, category or other.
 * <p>
 * Known URL sets supplied by the operator are checked first (product, then category) and win
 * over the path patterns, which are tried in order (product list, then category list).
 */
public class LinkClassifier {
    private final List<Pattern> productPatterns;
    private final List<Pattern> categoryPatterns;
    private final Set<String> knownProductUrls;
    private final Set<String> knownCategoryUrls;

    public LinkClassifier(
        List<Pattern> productPatterns,
        List<Pattern> categoryPatterns,
        Set<String> knownProductUrls,
        Set<String> knownCategoryUrls
    ) {
        this.productPatterns = List.copyOf(productPatterns);
        this.categoryPatterns = List.copyOf(categoryPatterns);
        this.knownProductUrls = knownProductUrls == null ? Set.of() : Set.copyOf(knownProductUrls);
        this.knownCategoryUrls = knownCategoryUrls == null ? Set.of() : Set.copyOf(knownCategoryUrls);
    }

    public PageType classify(String url) {
        if (url == null) {
            return PageType.OTHER;
        }
        if (knownProductUrls.contains(url)) {
            return PageType.PRODUCT;
        }
        if (knownCategoryUrls.contains(url)) {
            return PageType.CATEGORY;
        }
        String path = pathOf(url);
        for (Pattern pattern : productPatterns) {
            if (pattern.matcher(path).find()) {
                return PageType.PRODUCT;
            }
        }
        for (Pattern pattern : categoryPatterns) {
            if (pattern.matcher(path).find()) {
                return PageType.CATEGORY;
            }
        }
        return PageType.OTHER;
    }

    static String pathOf(String url) {
        try {
            String path = new URI(url.trim()).getPath();
            return path == null ? "" : path;
        } catch (URISyntaxException e) {
            return "";
        }
    }
}
