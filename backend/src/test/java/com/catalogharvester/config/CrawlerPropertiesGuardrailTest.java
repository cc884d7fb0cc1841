package com.catalogharvester.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserLikeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getHttp().setUserAgent("   ");
        assertTrue(properties.getHttp().getUserAgent().startsWith("Mozilla/5.0"));
        assertTrue(properties.getHttp().getUserAgent().contains("catalog-harvester"));
        properties.getHttp().setUserAgent(" harvester-test/1.0 ");
        assertEquals("harvester-test/1.0", properties.getHttp().getUserAgent());
    }

    @Test
    void concurrencyAndDelaysAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getHttp().setMaxConcurrentRequests(0);
        properties.getHttp().setPerHostDelayMs(-10);
        properties.getHttp().setMaxRetries(-1);
        properties.getHttp().setThrottleCooldownMs(-1);
        properties.getHttp().setTimeoutSeconds(0);
        properties.getStore().setPageDelayMs(-5);
        properties.getStore().setItemDelayMs(-5);
        properties.getLinkFollow().setConcurrency(0);
        properties.getLinkFollow().setDelayMs(0);

        assertEquals(1, properties.getHttp().getMaxConcurrentRequests());
        assertEquals(0, properties.getHttp().getPerHostDelayMs());
        assertEquals(0, properties.getHttp().getMaxRetries());
        assertEquals(0, properties.getHttp().getThrottleCooldownMs());
        assertEquals(1, properties.getHttp().getTimeoutSeconds());
        assertEquals(0, properties.getStore().getPageDelayMs());
        assertEquals(0, properties.getStore().getItemDelayMs());
        assertEquals(1, properties.getLinkFollow().getConcurrency());
        assertEquals(1, properties.getLinkFollow().getDelayMs());
    }

    @Test
    void checkpointIntervalDefaultsToFiveAndNeverDropsBelowOne() {
        CrawlerProperties properties = new CrawlerProperties();
        assertEquals(5, properties.getState().getCheckpointInterval());
        properties.getState().setCheckpointInterval(0);
        assertEquals(1, properties.getState().getCheckpointInterval());
    }
}
