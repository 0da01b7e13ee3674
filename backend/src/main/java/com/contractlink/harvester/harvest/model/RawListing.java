package com.contractlink.harvester.harvest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record RawListing(SourceId source, String pageUrl, String jurisdiction, Map<String, String> fields) {
    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String SOLICITATION_NUMBER = "solicitation_number";
    public static final String DUE_DATE = "due_date";
    public static final String LINK = "link";
    public static final String AGENCY = "agency";
    public static final String LOCATION = "location";
    public static final String STATE = "state";
    public static final String CITY = "city";
    public static final String CATEGORY = "category";
    public static final String ORGANIZATION_TYPE = "organization_type";

    public RawListing {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String field(String name) {
        String value = fields.get(name);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static Builder builder(SourceId source, String pageUrl, String jurisdiction) {
        return new Builder(source, pageUrl, jurisdiction);
    }

    public static final class Builder {
        private final SourceId source;
        private final String pageUrl;
        private final String jurisdiction;
        private final Map<String, String> fields = new LinkedHashMap<>();

        private Builder(SourceId source, String pageUrl, String jurisdiction) {
            this.source = source;
            this.pageUrl = pageUrl;
            this.jurisdiction = jurisdiction;
        }

        public Builder put(String name, String value) {
            if (name != null && value != null && !value.isBlank()) {
                fields.put(name, value.trim());
            }
            return this;
        }

        public RawListing build() {
            return new RawListing(source, pageUrl, jurisdiction, fields);
        }
    }
}
