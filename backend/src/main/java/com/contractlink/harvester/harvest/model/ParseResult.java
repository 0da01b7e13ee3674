package com.contractlink.harvester.harvest.model;

import java.util.List;

public record ParseResult(List<RawListing> listings, List<HarvestError> errors) {
    public ParseResult {
        listings = listings == null ? List.of() : List.copyOf(listings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
