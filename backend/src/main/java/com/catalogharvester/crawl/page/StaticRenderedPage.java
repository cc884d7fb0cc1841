package com.catalogharvester.crawl.page;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.function.Supplier;

public class StaticRenderedPage implements RenderedPage {
    private final String url;
    private final Document document;
    private final Supplier<RenderedPage> reloader;

    public StaticRenderedPage(String url, Document document, Supplier<RenderedPage> reloader) {
        this.url = url;
        this.document = document;
        this.reloader = reloader;
    }

    public static StaticRenderedPage of(String url, String html) {
        Document document = Jsoup.parse(html == null ? "" : html, url);
        return new StaticRenderedPage(url, document, null);
    }

    @Override
    public String url() {
        return url;
    }

    @Override
    public String title() {
        return document.title();
    }

    @Override
    public Document document() {
        return document;
    }

    @Override
    public boolean activateSubPage(String containerSelector, String buttonSelector, int pageNumber) {
        return false;
    }

    @Override
    public RenderedPage recheck() {
        return reloader == null ? this : reloader.get();
    }
}
