package com.catalogharvester.crawl.compat;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a compatibility year cell into individual year tokens.
 * "2009-2015" (hyphen or en dash) gives every year in the range, "2012 Model" gives "2012",
 * any other non-empty text is kept as a literal token. A reversed range ("2015-2009") gives no years.
 */
public final class YearExpander {
    private static final Pattern RANGE = Pattern.compile("^(\\d{4})\\s*[-\\u2013]\\s*(\\d{4})");
    private static final Pattern LEADING_YEAR = Pattern.compile("^\\d{4}");

    private YearExpander() {
    }

    public static List<String> expand(String yearText) {
        if (yearText == null) {
            return List.of();
        }
        String value = yearText.trim();
        if (value.isEmpty()) {
            return List.of();
        }
        Matcher range = RANGE.matcher(value);
        if (range.find()) {
            int from = Integer.parseInt(range.group(1));
            int to = Integer.parseInt(range.group(2));
            List<String> years = new ArrayList<>();
            for (int year = from; year <= to; year++) {
                years.add(String.valueOf(year));
            }
            return years;
        }
        if (LEADING_YEAR.matcher(value).find()) {
            return List.of(value.substring(0, 4));
        }
        return List.of(value);
    }
}
