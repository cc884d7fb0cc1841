package com.catalogharvester.crawl.state;

import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Where one item-mode target keeps its files: the saved identifier list, the checkpoint and
 * the timestamped JSON and CSV outputs.
 */
public record RunLayout(String target, Path directory) {
    public static final String IDENTIFIERS_FILE = "product-item-ids.txt";
    public static final String CHECKPOINT_FILE = "scrape-progress.json";

    public static RunLayout forStore(String outputDir, String baseUrl, String storeName) {
        String target = siteSlug(baseUrl) + "-str-" + storeName.trim();
        return new RunLayout(target, Path.of(outputDir).resolve(target));
    }

    public Path identifiersFile() {
        return directory.resolve(IDENTIFIERS_FILE);
    }

    public Path checkpointFile() {
        return directory.resolve(CHECKPOINT_FILE);
    }

    public Path jsonOutput(String timestamp) {
        return directory.resolve("products-" + timestamp + ".json");
    }

    public Path csvOutput(String timestamp) {
        return directory.resolve("shopify-product-import-" + timestamp + ".csv");
    }

    /** "https://www.ebay.co.uk" becomes "ebay-co-uk". */
    public static String siteSlug(String urlOrDomain) {
        String value = urlOrDomain == null ? "" : urlOrDomain.trim();
        String host = value;
        if (value.startsWith("http://") || value.startsWith("https://")) {
            try {
                host = URI.create(value).getHost();
            } catch (IllegalArgumentException e) {
                host = value.replaceFirst("^https?://", "");
            }
        }
        if (host == null) {
            host = "";
        }
        host = host.toLowerCase(Locale.ROOT).replaceAll("/.*$", "");
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host.replace('.', '-').replace(':', '-');
    }
}
