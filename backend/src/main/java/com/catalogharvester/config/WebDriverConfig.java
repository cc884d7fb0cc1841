package com.catalogharvester.config;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;

/**
 * Browser-backed page rendering, used when detail pages need script execution
 * (sub-table pagination buttons only work in a live DOM).
 * Local runs use ChromeDriver; a configured hub URL switches to a RemoteWebDriver.
 */
@Configuration
@ConditionalOnProperty(prefix = "crawler.browser", name = "enabled", havingValue = "true")
public class WebDriverConfig {
    private static final Logger log = LoggerFactory.getLogger(WebDriverConfig.class);

    @Bean(destroyMethod = "quit")
    public WebDriver webDriver(CrawlerProperties properties) {
        CrawlerProperties.Browser browser = properties.getBrowser();
        ChromeOptions options = chromeOptions(properties);
        WebDriver driver;
        String remoteUrl = browser.getRemoteUrl();
        if (remoteUrl != null && !remoteUrl.isBlank()) {
            try {
                driver = new RemoteWebDriver(new URL(remoteUrl.trim()), options);
            } catch (MalformedURLException e) {
                throw new IllegalStateException("Invalid crawler.browser.remote-url: " + remoteUrl, e);
            }
            log.info("Using remote WebDriver at {}", remoteUrl);
        } else {
            driver = new ChromeDriver(options);
            log.info("Using local ChromeDriver (headless={})", browser.isHeadless());
        }
        driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(browser.getPageLoadTimeoutSeconds()));
        return driver;
    }

    private ChromeOptions chromeOptions(CrawlerProperties properties) {
        ChromeOptions options = new ChromeOptions();
        if (properties.getBrowser().isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments("user-agent=" + properties.getHttp().getUserAgent());
        options.addArguments("--disable-gpu");
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-extensions");
        options.addArguments("--window-size=1920,1080");
        return options;
    }
}
