package com.contractlink.harvester.harvest.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Server-side query filters. An empty state set means every jurisdiction the source covers.
 */
public record ScrapeFilters(Set<String> states, List<String> keywords, int limit) {

    public ScrapeFilters {
        Set<String> normalizedStates = new LinkedHashSet<>();
        if (states != null) {
            for (String state : states) {
                if (state != null && !state.isBlank()) {
                    normalizedStates.add(state.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        states = Set.copyOf(normalizedStates);
        List<String> normalizedKeywords = new ArrayList<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    normalizedKeywords.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        keywords = List.copyOf(normalizedKeywords);
        limit = Math.max(1, limit);
    }

    public static ScrapeFilters unrestricted() {
        return new ScrapeFilters(Set.of(), List.of(), 500);
    }

    public boolean includesState(String stateCode) {
        return states.isEmpty() || (stateCode != null && states.contains(stateCode.toUpperCase(Locale.ROOT)));
    }
}
