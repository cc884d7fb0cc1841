package com.catalogharvester.crawl.page;

import com.catalogharvester.config.CrawlerProperties;
import com.catalogharvester.crawl.model.FetchFailureKind;
import com.catalogharvester.crawl.util.Pauses;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Renders pages in a single shared browser. Callers must not open pages concurrently;
 * item mode is sequential so one driver is enough.
 */
public class SeleniumPageSource implements PageSource {
    private static final Logger log = LoggerFactory.getLogger(SeleniumPageSource.class);

    private final WebDriver driver;
    private final CrawlerProperties properties;

    public SeleniumPageSource(WebDriver driver, CrawlerProperties properties) {
        this.driver = driver;
        this.properties = properties;
    }

    @Override
    public synchronized RenderedPage open(String url) {
        try {
            driver.get(url);
        } catch (TimeoutException e) {
            throw new PageFetchException(url, FetchFailureKind.TIMEOUT, "page load timed out", e);
        } catch (WebDriverException e) {
            throw new PageFetchException(url, FetchFailureKind.NETWORK, e.getClass().getSimpleName() + ": " + firstLine(e.getMessage()), e);
        }
        Pauses.sleep(properties.getBrowser().getPageSettleMs());
        return new BrowserPage(url);
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private final class BrowserPage implements RenderedPage {
        private final String url;
        private Document document;

        private BrowserPage(String url) {
            this.url = url;
            this.document = snapshot();
        }

        private Document snapshot() {
            return Jsoup.parse(driver.getPageSource(), driver.getCurrentUrl());
        }

        @Override
        public String url() {
            return url;
        }

        @Override
        public String title() {
            String title = driver.getTitle();
            return title == null ? document.title() : title;
        }

        @Override
        public Document document() {
            return document;
        }

        @Override
        public boolean activateSubPage(String containerSelector, String buttonSelector, int pageNumber) {
            String label = String.valueOf(pageNumber);
            try {
                List<WebElement> buttons = driver.findElements(By.cssSelector(containerSelector + " " + buttonSelector));
                for (WebElement button : buttons) {
                    if (!label.equals(button.getText().trim())) {
                        continue;
                    }
                    if (!button.isDisplayed()) {
                        return false;
                    }
                    ((JavascriptExecutor) driver).executeScript("arguments[0].scrollIntoView({block: 'center'});", button);
                    button.click();
                    Pauses.sleep(properties.getCompatibility().getSubPageSettleMs());
                    document = snapshot();
                    return true;
                }
                return false;
            } catch (WebDriverException e) {
                log.warn("Could not activate sub-page {} on {}: {}", pageNumber, url, firstLine(e.getMessage()));
                return false;
            }
        }

        @Override
        public RenderedPage recheck() {
            document = snapshot();
            return this;
        }
    }
}
