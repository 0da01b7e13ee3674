package com.contractlink.harvester.harvest.model;

import java.util.List;

public record SaveResult(int inserted, int updated, int failed, List<HarvestError> errors) {
    public SaveResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static SaveResult empty() {
        return new SaveResult(0, 0, 0, List.of());
    }
}
