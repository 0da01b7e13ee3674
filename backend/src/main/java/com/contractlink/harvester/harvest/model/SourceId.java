package com.contractlink.harvester.harvest.model;

import java.util.Locale;

/**
 * Known procurement sources. Declaration order is the dedup priority: a jurisdiction's own
 * official portal comes before multi-state platforms, and the national aggregator comes last.
 */
public enum SourceId {
    COMMBUYS("commbuys", "COMMBUYS (Massachusetts)"),
    EMARYLAND("emaryland", "eMaryland Marketplace"),
    NEW_HAMPSHIRE("newhampshire", "New Hampshire DAS"),
    RHODE_ISLAND("rhodeisland", "Rhode Island RIDOP"),
    SYMPHONY("symphony", "Periscope / SciQuest"),
    BIDEXPRESS("bidexpress", "BidExpress"),
    DEMANDSTAR("demandstar", "DemandStar");

    private final String key;
    private final String displayName;

    SourceId(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public static SourceId fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SourceId id : values()) {
            if (id.key.equals(normalized) || id.name().equalsIgnoreCase(normalized)) {
                return id;
            }
        }
        return null;
    }
}
