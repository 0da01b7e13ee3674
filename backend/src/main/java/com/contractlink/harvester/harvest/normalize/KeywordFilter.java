package com.contractlink.harvester.harvest.normalize;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class KeywordFilter {
    public static final List<String> CLEANING_KEYWORDS = List.of(
        "janitorial",
        "custodial",
        "cleaning",
        "housekeeping",
        "sanitation",
        "facilities maintenance",
        "building maintenance",
        "floor care",
        "carpet cleaning",
        "window cleaning",
        "disinfection",
        "environmental services",
        "porter"
    );

    public boolean matches(String title, String description) {
        return !matchedTerms(title, description).isEmpty();
    }

    public List<String> matchedTerms(String title, String description) {
        String haystack = ((title == null ? "" : title) + " " + (description == null ? "" : description))
            .toLowerCase(Locale.ROOT);
        if (haystack.isBlank()) {
            return List.of();
        }
        List<String> matched = new ArrayList<>();
        for (String keyword : CLEANING_KEYWORDS) {
            if (haystack.contains(keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }
}
