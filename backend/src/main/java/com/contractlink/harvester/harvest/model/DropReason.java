package com.contractlink.harvester.harvest.model;

public enum DropReason {
    NOT_RELEVANT,
    MISSING_TITLE,
    UNMAPPABLE_STATE,
    MISSING_LINK
}
