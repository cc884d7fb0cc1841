package com.catalogharvester.crawl.page;

import com.catalogharvester.crawl.http.PoliteHttpClient;
import com.catalogharvester.crawl.model.FetchFailureKind;
import com.catalogharvester.crawl.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

@Component
public class HttpPageSource implements PageSource {
    private final PoliteHttpClient httpClient;

    public HttpPageSource(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RenderedPage open(String url) {
        HttpFetchResult result = httpClient.get(url);
        if (result.failure() != null) {
            throw new PageFetchException(url, result.failure(), 0, result.describe());
        }
        if (!result.isSuccessful()) {
            throw new PageFetchException(url, FetchFailureKind.HTTP_STATUS, result.statusCode(), "HTTP " + result.statusCode());
        }
        String finalUrl = result.finalUrlOrRequested();
        Document document = Jsoup.parse(result.body() == null ? "" : result.body(), finalUrl);
        return new StaticRenderedPage(finalUrl, document, () -> open(url));
    }
}
