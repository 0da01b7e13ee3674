package com.contractlink.harvester.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HarvesterPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("contract-harvester/0.1"));
    }

    @Test
    void concurrencyTimeoutsAndRetriesAreClamped() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostDelayMs(-10);
        properties.setScraperTimeoutSeconds(0);
        properties.getRetry().setMaxAttempts(0);
        properties.getSchedule().setStartHour(30);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(0, properties.getPerHostDelayMs());
        assertEquals(1, properties.getScraperTimeoutSeconds());
        assertEquals(1, properties.getRetry().getMaxAttempts());
        assertEquals(23, properties.getSchedule().getStartHour());
    }

    @Test
    void unknownSourceUsesDefaultsAndBaseUrlLosesTrailingSlash() {
        HarvesterProperties properties = new HarvesterProperties();
        HarvesterProperties.Source source = new HarvesterProperties.Source();
        source.setBaseUrl("https://mirror.example.org/commbuys/");
        properties.getSources().put("commbuys", source);

        assertTrue(properties.source("symphony").isEnabled());
        assertEquals("https://fallback.example.org", properties.source("symphony").baseUrlOr("https://fallback.example.org"));
        assertEquals("https://mirror.example.org/commbuys", properties.source("COMMBUYS").baseUrlOr("ignored"));
    }
}
