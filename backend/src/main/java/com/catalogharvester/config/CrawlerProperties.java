package com.catalogharvester.config;

import com.catalogharvester.crawl.model.CompatibilityMode;
import com.catalogharvester.crawl.model.LinkScope;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private Http http = new Http();
    private Store store = new Store();
    private Detail detail = new Detail();
    private Compatibility compatibility = new Compatibility();
    private State state = new State();
    private Output output = new Output();
    private LinkFollow linkFollow = new LinkFollow();
    private Browser browser = new Browser();
    private Cli cli = new Cli();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Detail getDetail() {
        return detail;
    }

    public void setDetail(Detail detail) {
        this.detail = detail;
    }

    public Compatibility getCompatibility() {
        return compatibility;
    }

    public void setCompatibility(Compatibility compatibility) {
        this.compatibility = compatibility;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public LinkFollow getLinkFollow() {
        return linkFollow;
    }

    public void setLinkFollow(LinkFollow linkFollow) {
        this.linkFollow = linkFollow;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * How pages are requested from the catalog site. Shared by the listing walk, detail pages
     * (when no browser is configured) and link-following mode.
     */
    public static class Http {
        static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) "
                + "Chrome/131.0.0.0 Safari/537.36 catalog-harvester/0.1";

        private String userAgent = DEFAULT_USER_AGENT;
        private int perHostDelayMs = 250;
        private int maxConcurrentRequests = 2;
        private int timeoutSeconds = 30;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 5000;
        private int throttleCooldownMs = 30000;

        public String getUserAgent() {
            return userAgent;
        }

        /** A blank value keeps the browser-like default. */
        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent.trim();
        }

        public int getPerHostDelayMs() {
            return perHostDelayMs;
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(0, perHostDelayMs);
        }

        public int getMaxConcurrentRequests() {
            return maxConcurrentRequests;
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return retryMaxDelayMs;
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public int getThrottleCooldownMs() {
            return throttleCooldownMs;
        }

        /** Pause applied to a host after it answers 403 or 429. */
        public void setThrottleCooldownMs(int throttleCooldownMs) {
            this.throttleCooldownMs = Math.max(0, throttleCooldownMs);
        }
    }

    public static class Store {
        private String baseUrl = "https://www.ebay.co.uk";
        private String name = "";
        private String listingUrlTemplate = "{base}/str/{store}?_pgn={page}&_ipg={pageSize}";
        private String itemUrlTemplate = "{base}/itm/{id}";
        private String identifierPattern = "/itm/(\\d{9,15})";
        private int pageSize = 72;
        private int pageDelayMs = 3000;
        private int itemDelayMs = 3000;
        private int maxItems = 0;
        private String seedFile = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getListingUrlTemplate() {
            return listingUrlTemplate;
        }

        public void setListingUrlTemplate(String listingUrlTemplate) {
            this.listingUrlTemplate = listingUrlTemplate;
        }

        public String getItemUrlTemplate() {
            return itemUrlTemplate;
        }

        public void setItemUrlTemplate(String itemUrlTemplate) {
            this.itemUrlTemplate = itemUrlTemplate;
        }

        public String getIdentifierPattern() {
            return identifierPattern;
        }

        public void setIdentifierPattern(String identifierPattern) {
            this.identifierPattern = identifierPattern;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public int getPageDelayMs() {
            return Math.max(0, pageDelayMs);
        }

        public void setPageDelayMs(int pageDelayMs) {
            this.pageDelayMs = Math.max(0, pageDelayMs);
        }

        public int getItemDelayMs() {
            return Math.max(0, itemDelayMs);
        }

        public void setItemDelayMs(int itemDelayMs) {
            this.itemDelayMs = Math.max(0, itemDelayMs);
        }

        public int getMaxItems() {
            return maxItems;
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = maxItems;
        }

        public String getSeedFile() {
            return seedFile;
        }

        public void setSeedFile(String seedFile) {
            this.seedFile = seedFile;
        }
    }

    public static class Detail {
        private List<String> blockedTitleMarkers = new ArrayList<>(List.of("security"));
        private int blockedRetryWaitMs = 5000;
        private String defaultCurrency = "GBP";
        private String specificsRowSelector = ".ux-labels-values";
        private String specificsLabelSelector = ".ux-labels-values__labels";
        private String specificsValueSelector = ".ux-labels-values__values";
        private CompatibilityMode compatibilityMode = CompatibilityMode.SAMPLED;

        public List<String> getBlockedTitleMarkers() {
            return blockedTitleMarkers;
        }

        public void setBlockedTitleMarkers(List<String> blockedTitleMarkers) {
            this.blockedTitleMarkers = blockedTitleMarkers == null ? new ArrayList<>() : blockedTitleMarkers;
        }

        public int getBlockedRetryWaitMs() {
            return Math.max(0, blockedRetryWaitMs);
        }

        public void setBlockedRetryWaitMs(int blockedRetryWaitMs) {
            this.blockedRetryWaitMs = Math.max(0, blockedRetryWaitMs);
        }

        public String getDefaultCurrency() {
            return defaultCurrency;
        }

        public void setDefaultCurrency(String defaultCurrency) {
            this.defaultCurrency = defaultCurrency;
        }

        public String getSpecificsRowSelector() {
            return specificsRowSelector;
        }

        public void setSpecificsRowSelector(String specificsRowSelector) {
            this.specificsRowSelector = specificsRowSelector;
        }

        public String getSpecificsLabelSelector() {
            return specificsLabelSelector;
        }

        public void setSpecificsLabelSelector(String specificsLabelSelector) {
            this.specificsLabelSelector = specificsLabelSelector;
        }

        public String getSpecificsValueSelector() {
            return specificsValueSelector;
        }

        public void setSpecificsValueSelector(String specificsValueSelector) {
            this.specificsValueSelector = specificsValueSelector;
        }

        public CompatibilityMode getCompatibilityMode() {
            return compatibilityMode;
        }

        public void setCompatibilityMode(CompatibilityMode compatibilityMode) {
            this.compatibilityMode = compatibilityMode == null ? CompatibilityMode.SAMPLED : compatibilityMode;
        }
    }

    public static class Compatibility {
        private String wrapperSelector = "#d-motors-compatibility-table";
        private String paginationButtonSelector = "button.pagination__item";
        private int subPageSettleMs = 1500;
        private int progressInterval = 20;

        public String getWrapperSelector() {
            return wrapperSelector;
        }

        public void setWrapperSelector(String wrapperSelector) {
            this.wrapperSelector = wrapperSelector;
        }

        public String getPaginationButtonSelector() {
            return paginationButtonSelector;
        }

        public void setPaginationButtonSelector(String paginationButtonSelector) {
            this.paginationButtonSelector = paginationButtonSelector;
        }

        public int getSubPageSettleMs() {
            return Math.max(0, subPageSettleMs);
        }

        public void setSubPageSettleMs(int subPageSettleMs) {
            this.subPageSettleMs = Math.max(0, subPageSettleMs);
        }

        public int getProgressInterval() {
            return Math.max(1, progressInterval);
        }

        public void setProgressInterval(int progressInterval) {
            this.progressInterval = Math.max(1, progressInterval);
        }
    }

    public static class State {
        private String outputDir = "scraped-sites";
        private int checkpointInterval = 5;
        private boolean resume;

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        public int getCheckpointInterval() {
            return Math.max(1, checkpointInterval);
        }

        public void setCheckpointInterval(int checkpointInterval) {
            this.checkpointInterval = Math.max(1, checkpointInterval);
        }

        public boolean isResume() {
            return resume;
        }

        public void setResume(boolean resume) {
            this.resume = resume;
        }
    }

    public static class Output {
        private String vendor = "";
        private List<String> tagFields = new ArrayList<>(List.of(
            "Brand",
            "Technology",
            "Lighting Technology",
            "Bulb Type",
            "Light Colour",
            "Placement on Vehicle",
            "Voltage"
        ));
        private List<String> typeFields = new ArrayList<>(List.of("Type", "Bulb Type"));
        private boolean published = true;

        public String getVendor() {
            return vendor;
        }

        public void setVendor(String vendor) {
            this.vendor = vendor;
        }

        public List<String> getTagFields() {
            return tagFields;
        }

        public void setTagFields(List<String> tagFields) {
            this.tagFields = tagFields == null ? new ArrayList<>() : tagFields;
        }

        public List<String> getTypeFields() {
            return typeFields;
        }

        public void setTypeFields(List<String> typeFields) {
            this.typeFields = typeFields == null ? new ArrayList<>() : typeFields;
        }

        public boolean isPublished() {
            return published;
        }

        public void setPublished(boolean published) {
            this.published = published;
        }
    }

    public static class LinkFollow {
        private String domain = "";
        private LinkScope scope = LinkScope.ALL;
        private int maxPages = 0;
        private int concurrency = 2;
        private int delayMs = 1000;
        private int minImageWidth = 50;
        private int minImageHeight = 50;
        private String seedFile = "";
        private String knownProductFile = "";
        private String knownCategoryFile = "";
        private List<String> productPatterns = new ArrayList<>(List.of(
            "/product/", "/products/", "/p/", "/item/", "/items/", "/dp/", "/pd/"
        ));
        private List<String> categoryPatterns = new ArrayList<>(List.of(
            "/category/", "/categories/", "/cat/", "/c/", "/collections/", "/shop/", "/browse/"
        ));
        private List<String> blogPatterns = new ArrayList<>(List.of(
            "/blog/", "/news/", "/articles/", "/posts/", "/journal/"
        ));
        private List<String> denyPatterns = new ArrayList<>(List.of(
            "/cart/", "/checkout/", "/account/", "/login/", "/register/", "/my-account/", "/admin/",
            "/wp-admin/", "/wp-login/", "\\?add-to-cart=", "\\?remove_item=", "/wishlist/", "/compare/"
        ));
        private List<String> imageExcludePatterns = new ArrayList<>(List.of(
            "placeholder", "loading", "spinner", "icon", "pixel", "tracking", "spacer", "blank", "1x1",
            "transparent", "/wp-includes/", "/wp-content/plugins/", "gravatar\\.com"
        ));
        private List<String> denyExtensions = new ArrayList<>(List.of(
            "jpg", "jpeg", "png", "gif", "svg", "webp", "ico", "bmp",
            "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx",
            "mp3", "mp4", "avi", "mov", "wmv", "flv",
            "zip", "rar", "tar", "gz", "7z",
            "css", "js", "woff", "woff2", "ttf", "eot"
        ));

        public String getDomain() {
            return domain;
        }

        public void setDomain(String domain) {
            this.domain = domain;
        }

        public LinkScope getScope() {
            return scope;
        }

        public void setScope(LinkScope scope) {
            this.scope = scope == null ? LinkScope.ALL : scope;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getDelayMs() {
            return Math.max(1, delayMs);
        }

        public void setDelayMs(int delayMs) {
            this.delayMs = Math.max(1, delayMs);
        }

        public int getMinImageWidth() {
            return Math.max(0, minImageWidth);
        }

        public void setMinImageWidth(int minImageWidth) {
            this.minImageWidth = Math.max(0, minImageWidth);
        }

        public int getMinImageHeight() {
            return Math.max(0, minImageHeight);
        }

        public void setMinImageHeight(int minImageHeight) {
            this.minImageHeight = Math.max(0, minImageHeight);
        }

        public String getSeedFile() {
            return seedFile;
        }

        public void setSeedFile(String seedFile) {
            this.seedFile = seedFile;
        }

        public String getKnownProductFile() {
            return knownProductFile;
        }

        public void setKnownProductFile(String knownProductFile) {
            this.knownProductFile = knownProductFile;
        }

        public String getKnownCategoryFile() {
            return knownCategoryFile;
        }

        public void setKnownCategoryFile(String knownCategoryFile) {
            this.knownCategoryFile = knownCategoryFile;
        }

        public List<String> getProductPatterns() {
            return productPatterns;
        }

        public void setProductPatterns(List<String> productPatterns) {
            this.productPatterns = productPatterns == null ? new ArrayList<>() : productPatterns;
        }

        public List<String> getCategoryPatterns() {
            return categoryPatterns;
        }

        public void setCategoryPatterns(List<String> categoryPatterns) {
            this.categoryPatterns = categoryPatterns == null ? new ArrayList<>() : categoryPatterns;
        }

        public List<String> getBlogPatterns() {
            return blogPatterns;
        }

        public void setBlogPatterns(List<String> blogPatterns) {
            this.blogPatterns = blogPatterns == null ? new ArrayList<>() : blogPatterns;
        }

        public List<String> getDenyPatterns() {
            return denyPatterns;
        }

        public void setDenyPatterns(List<String> denyPatterns) {
            this.denyPatterns = denyPatterns == null ? new ArrayList<>() : denyPatterns;
        }

        public List<String> getImageExcludePatterns() {
            return imageExcludePatterns;
        }

        public void setImageExcludePatterns(List<String> imageExcludePatterns) {
            this.imageExcludePatterns = imageExcludePatterns == null ? new ArrayList<>() : imageExcludePatterns;
        }

        public List<String> getDenyExtensions() {
            return denyExtensions;
        }

        public void setDenyExtensions(List<String> denyExtensions) {
            this.denyExtensions = denyExtensions == null ? new ArrayList<>() : denyExtensions;
        }
    }

    public static class Browser {
        private boolean enabled;
        private boolean headless = true;
        private String remoteUrl = "";
        private int pageSettleMs = 4000;
        private int pageLoadTimeoutSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public String getRemoteUrl() {
            return remoteUrl;
        }

        public void setRemoteUrl(String remoteUrl) {
            this.remoteUrl = remoteUrl;
        }

        public int getPageSettleMs() {
            return Math.max(0, pageSettleMs);
        }

        public void setPageSettleMs(int pageSettleMs) {
            this.pageSettleMs = Math.max(0, pageSettleMs);
        }

        public int getPageLoadTimeoutSeconds() {
            return Math.max(1, pageLoadTimeoutSeconds);
        }

        public void setPageLoadTimeoutSeconds(int pageLoadTimeoutSeconds) {
            this.pageLoadTimeoutSeconds = Math.max(1, pageLoadTimeoutSeconds);
        }
    }

    public static class Cli {
        private boolean run;
        private String mode = "items";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
