package com.catalogharvester.config;

import com.catalogharvester.crawl.page.HttpPageSource;
import com.catalogharvester.crawl.page.PageSource;
import com.catalogharvester.crawl.page.SeleniumPageSource;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.openqa.selenium.WebDriver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getHttp().getMaxConcurrentRequests() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "crawlRunExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlRunExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("crawl-run");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Page source for listing and detail pages: the browser when one is configured, plain HTTP otherwise.
     */
    @Bean(name = "catalogPageSource")
    public PageSource catalogPageSource(
        HttpPageSource httpPageSource,
        ObjectProvider<WebDriver> webDriver,
        CrawlerProperties properties
    ) {
        WebDriver driver = webDriver.getIfAvailable();
        if (driver == null) {
            return httpPageSource;
        }
        return new SeleniumPageSource(driver, properties);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
