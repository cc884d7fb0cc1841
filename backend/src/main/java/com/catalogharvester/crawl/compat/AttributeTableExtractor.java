package com.catalogharvester.crawl.compat;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.CompatibilityEntry;
import com.catalogharvester.crawl.model.CompatibilityMode;
import com.catalogharvester.crawl.model.CompatibilityStatus;
import com.catalogharvester.crawl.model.CompatibilityTable;
import com.catalogharvester.crawl.page.RenderedPage;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reads the make/year compatibility table embedded in a detail page. The table has its own
 * pagination control; sampled mode reads the sub-page shown on load, exhaustive mode clicks
 * through pages 2..N.
 */
@Component
public class AttributeTableExtractor {
    private static final Logger log = LoggerFactory.getLogger(AttributeTableExtractor.class);

    static final String STOP_BUTTON_UNAVAILABLE = "button_unavailable";
    static final String STOP_EMPTY_SUB_PAGE = "empty_sub_page";

    private final CrawlerProperties.Compatibility config;

    public AttributeTableExtractor(CrawlerProperties properties) {
        this.config = properties.getCompatibility();
    }

    public CompatibilityTable extract(RenderedPage page, CompatibilityMode mode) {
        if (mode == CompatibilityMode.SKIP) {
            return CompatibilityTable.notExtracted();
        }
        Element wrapper = page.document().selectFirst(config.getWrapperSelector());
        if (wrapper == null) {
            return CompatibilityTable.absent();
        }
        int totalPages = totalPages(wrapper);
        Accumulator acc = new Accumulator();
        int firstRows = acc.addRows(parseRows(wrapper));
        log.debug("Compatibility on {}: {} sub-pages, {} rows on the first", page.url(), totalPages, firstRows);

        int visited = 1;
        boolean truncated = false;
        String stopReason = null;
        if (mode == CompatibilityMode.EXHAUSTIVE && totalPages > 1) {
            for (int pageNumber = 2; pageNumber <= totalPages; pageNumber++) {
                if (!page.activateSubPage(config.getWrapperSelector(), config.getPaginationButtonSelector(), pageNumber)) {
                    log.warn("Compatibility sub-page {}/{} unavailable on {}, keeping {} pages",
                        pageNumber, totalPages, page.url(), visited);
                    truncated = true;
                    stopReason = STOP_BUTTON_UNAVAILABLE;
                    break;
                }
                Element current = page.document().selectFirst(config.getWrapperSelector());
                int rows = current == null ? 0 : acc.addRows(parseRows(current));
                if (rows == 0) {
                    // an empty sub-page can be the real end of the data or a desynced control
                    log.warn("Compatibility sub-page {}/{} on {} has no rows (end of data or pagination desync), stopping",
                        pageNumber, totalPages, page.url());
                    truncated = true;
                    stopReason = STOP_EMPTY_SUB_PAGE;
                    break;
                }
                visited++;
                if (pageNumber % config.getProgressInterval() == 0) {
                    log.info("Compatibility sub-page {}/{}: {} makes, {} years so far",
                        pageNumber, totalPages, acc.makes.size(), acc.years.size());
                }
            }
        } else if (mode == CompatibilityMode.SAMPLED && totalPages > 1) {
            log.info("Compatibility sampled on {}: first of {} sub-pages only", page.url(), totalPages);
        }

        CompatibilityStatus status = acc.entries.isEmpty() && acc.makes.isEmpty() && acc.years.isEmpty()
            ? CompatibilityStatus.EMPTY
            : CompatibilityStatus.PRESENT;
        return new CompatibilityTable(
            status,
            new ArrayList<>(acc.entries),
            acc.makes,
            acc.years,
            totalPages,
            visited,
            truncated,
            stopReason
        );
    }

    int totalPages(Element wrapper) {
        Elements buttons = wrapper.select(config.getPaginationButtonSelector());
        if (buttons.isEmpty()) {
            return 1;
        }
        String label = buttons.get(buttons.size() - 1).text().trim();
        try {
            int parsed = Integer.parseInt(label);
            return parsed > 0 ? parsed : buttons.size();
        } catch (NumberFormatException e) {
            return buttons.size();
        }
    }

    /**
     * Raw (make, year-text) pairs from the visible sub-page. Column positions come from the header row.
     */
    List<String[]> parseRows(Element wrapper) {
        Element table = wrapper.selectFirst("table");
        if (table == null) {
            return List.of();
        }
        List<String> headers = new ArrayList<>();
        for (Element cell : table.select("thead th, thead td")) {
            headers.add(cell.text().trim().toLowerCase(Locale.ROOT));
        }
        int makeIdx = headers.indexOf("make");
        int yearIdx = headers.indexOf("year");
        Element body = table.selectFirst("tbody");
        Elements rows = (body == null ? table : body).select("tr");

        List<String[]> out = new ArrayList<>();
        for (Element row : rows) {
            Elements cells = row.select("td");
            String make = cellText(cells, makeIdx, "make");
            String year = cellText(cells, yearIdx, "year");
            if (make != null || year != null) {
                out.add(new String[] {make, year});
            }
        }
        return out;
    }

    private static String cellText(Elements cells, int index, String headerLabel) {
        if (index < 0 || index >= cells.size()) {
            return null;
        }
        String text = cells.get(index).text().trim();
        if (text.isEmpty() || text.equalsIgnoreCase(headerLabel)) {
            return null;
        }
        return text;
    }

    private static final class Accumulator {
        private final Set<CompatibilityEntry> entries = new LinkedHashSet<>();
        private final SortedSet<String> makes = new TreeSet<>();
        private final SortedSet<String> years = new TreeSet<>();

        int addRows(List<String[]> rows) {
            for (String[] row : rows) {
                String make = row[0];
                List<String> expanded = YearExpander.expand(row[1]);
                if (make != null) {
                    makes.add(make);
                }
                years.addAll(expanded);
                if (make == null) {
                    continue;
                }
                if (expanded.isEmpty()) {
                    entries.add(new CompatibilityEntry(make, null));
                } else {
                    for (String year : expanded) {
                        entries.add(new CompatibilityEntry(make, year));
                    }
                }
            }
            return rows.size();
        }
    }
}
