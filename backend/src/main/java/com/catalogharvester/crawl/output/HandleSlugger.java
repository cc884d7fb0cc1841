package com.catalogharvester.crawl.output;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the per-record handle: the title slug (max 200 chars) or {@code item-<id>}, followed by
 * the last four characters of the identifier so that equal titles still get distinct handles.
 */
public final class HandleSlugger {
    static final int MAX_SLUG_LENGTH = 200;
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

    private HandleSlugger() {
    }

    public static String handle(String title, String itemId) {
        String id = itemId == null ? "" : itemId.trim();
        String base = slugify(title);
        if (base.isEmpty()) {
            base = "item-" + id;
        }
        if (id.isEmpty()) {
            return base;
        }
        return base + "-" + id.substring(Math.max(0, id.length() - 4));
    }

    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        String slug = text.toLowerCase(Locale.ROOT).trim();
        slug = NON_WORD.matcher(slug).replaceAll("");
        slug = SEPARATORS.matcher(slug).replaceAll("-");
        slug = slug.replaceAll("^-+|-+$", "");
        return slug.length() > MAX_SLUG_LENGTH ? slug.substring(0, MAX_SLUG_LENGTH) : slug;
    }
}
