package com.contractlink.harvester.harvest.model;

public enum HarvestErrorKind {
    NETWORK,
    RATE_LIMIT,
    PARSE,
    VALIDATION,
    PERSISTENCE,
    TIMEOUT_BUDGET
}
