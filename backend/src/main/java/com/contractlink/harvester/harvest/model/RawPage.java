package com.contractlink.harvester.harvest.model;

/**
 * One successfully fetched payload. {@code jurisdiction} is the state code the request was scoped
 * to, or null when the payload spans several states.
 */
public record RawPage(String url, String body, String contentType, String jurisdiction) {
}
