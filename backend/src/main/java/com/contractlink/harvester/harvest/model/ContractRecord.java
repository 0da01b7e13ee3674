package com.contractlink.harvester.harvest.model;

import java.time.Instant;
import java.time.LocalDate;

public record ContractRecord(
    String state,
    String title,
    String solicitationNumber,
    LocalDate dueDate,
    String link,
    String agency,
    SourceId source,
    Instant scrapedAt,
    String description,
    String organizationType,
    String naicsCode
) {
    public static final String UNKNOWN_DUE_DATE = "unknown";

    public ContractKey key() {
        return new ContractKey(state, solicitationNumber);
    }

    public String dueDateIso() {
        return dueDate == null ? UNKNOWN_DUE_DATE : dueDate.toString();
    }
}
