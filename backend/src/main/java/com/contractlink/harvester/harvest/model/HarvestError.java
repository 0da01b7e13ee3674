package com.contractlink.harvester.harvest.model;

public record HarvestError(HarvestErrorKind kind, SourceId source, String detail) {

    public static HarvestError of(HarvestErrorKind kind, SourceId source, String detail) {
        return new HarvestError(kind, source, detail == null ? "" : detail);
    }

    public static HarvestError fromFetch(SourceId source, HttpFetchResult fetch) {
        return new HarvestError(fetch.failureKind(), source, fetch.failureDetail());
    }

    public boolean degradesSource() {
        return kind == HarvestErrorKind.NETWORK
            || kind == HarvestErrorKind.RATE_LIMIT
            || kind == HarvestErrorKind.TIMEOUT_BUDGET;
    }

    @Override
    public String toString() {
        return kind + " " + (source == null ? "-" : source.key()) + ": " + detail;
    }
}
