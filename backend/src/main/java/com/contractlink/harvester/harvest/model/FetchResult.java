package com.contractlink.harvester.harvest.model;

import java.util.List;

/**
 * Pages fetched for one source. {@code degraded} is normally derived from the errors; a source that
 * recovered through a fallback keeps the failure in {@code errors} without being degraded.
 */
public record FetchResult(
    SourceId source,
    List<RawPage> pages,
    List<HarvestError> errors,
    int requestsAttempted,
    boolean degraded
) {
    public FetchResult {
        pages = pages == null ? List.of() : List.copyOf(pages);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public FetchResult(SourceId source, List<RawPage> pages, List<HarvestError> errors, int requestsAttempted) {
        this(source, pages, errors, requestsAttempted, errors != null && errors.stream().anyMatch(HarvestError::degradesSource));
    }

    public static FetchResult recovered(SourceId source, List<RawPage> pages, List<HarvestError> errors, int requestsAttempted) {
        return new FetchResult(source, pages, errors, requestsAttempted, false);
    }

    public boolean nothingFetched() {
        return pages.isEmpty();
    }
}
