package com.catalogharvester.crawl.link;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.LinkScope;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiled, immutable pattern tables for link-following mode. All patterns are case-insensitive.
 */
public final class LinkRules {
    private final List<Pattern> productPatterns;
    private final List<Pattern> categoryPatterns;
    private final List<Pattern> blogPatterns;
    private final List<Pattern> denyPatterns;
    private final List<Pattern> imageExcludePatterns;
    private final Set<String> denyExtensions;

    public LinkRules(
        List<String> productPatterns,
        List<String> categoryPatterns,
        List<String> blogPatterns,
        List<String> denyPatterns,
        List<String> imageExcludePatterns,
        List<String> denyExtensions
    ) {
        this.productPatterns = compile(productPatterns);
        this.categoryPatterns = compile(categoryPatterns);
        this.blogPatterns = compile(blogPatterns);
        this.denyPatterns = compile(denyPatterns);
        this.imageExcludePatterns = compile(imageExcludePatterns);
        Set<String> extensions = new LinkedHashSet<>();
        if (denyExtensions != null) {
            for (String extension : denyExtensions) {
                if (extension != null && !extension.isBlank()) {
                    extensions.add(extension.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""));
                }
            }
        }
        this.denyExtensions = Set.copyOf(extensions);
    }

    public static LinkRules from(CrawlerProperties.LinkFollow config) {
        return new LinkRules(
            config.getProductPatterns(),
            config.getCategoryPatterns(),
            config.getBlogPatterns(),
            config.getDenyPatterns(),
            config.getImageExcludePatterns(),
            config.getDenyExtensions()
        );
    }

    /**
     * Patterns a link must match to be followed; empty means every internal link.
     */
    public List<Pattern> followPatterns(LinkScope scope) {
        switch (scope) {
            case CATEGORY:
                return categoryPatterns;
            case PRODUCT:
                return productPatterns;
            case BLOG:
                return blogPatterns;
            case FULL:
                List<Pattern> combined = new ArrayList<>(categoryPatterns);
                combined.addAll(productPatterns);
                return List.copyOf(combined);
            case ALL:
            default:
                return List.of();
        }
    }

    public List<Pattern> productPatterns() {
        return productPatterns;
    }

    public List<Pattern> categoryPatterns() {
        return categoryPatterns;
    }

    public List<Pattern> denyPatterns() {
        return denyPatterns;
    }

    public List<Pattern> imageExcludePatterns() {
        return imageExcludePatterns;
    }

    public Set<String> denyExtensions() {
        return denyExtensions;
    }

    private static List<Pattern> compile(List<String> patterns) {
        List<Pattern> compiled = new ArrayList<>();
        if (patterns != null) {
            for (String pattern : patterns) {
                if (pattern != null && !pattern.isBlank()) {
                    compiled.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
                }
            }
        }
        return List.copyOf(compiled);
    }
}
