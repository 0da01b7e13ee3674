package com.contractlink.harvester.harvest.model;

public record NormalizeResult(ContractRecord record, DropReason dropReason, String detail) {

    public static NormalizeResult accepted(ContractRecord record) {
        return new NormalizeResult(record, null, null);
    }

    public static NormalizeResult dropped(DropReason reason, String detail) {
        return new NormalizeResult(null, reason, detail);
    }

    public boolean isAccepted() {
        return record != null;
    }

    public boolean passedKeywordFilter() {
        return dropReason != DropReason.NOT_RELEVANT;
    }
}
