package com.contractlink.harvester.harvest.normalize;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort NAICS tagging. Hints are checked in enum order, so the narrower building services
 * phrases win over the generic "cleaning".
 */
@Component
public class NaicsClassifier {
    private static final Pattern SIX_DIGITS = Pattern.compile("(?<!\\d)(\\d{6})(?!\\d)");

    public Optional<NaicsCode> classify(String categoryHint, String title) {
        if (categoryHint != null) {
            Matcher matcher = SIX_DIGITS.matcher(categoryHint);
            while (matcher.find()) {
                NaicsCode explicit = NaicsCode.fromCode(matcher.group(1));
                if (explicit != null) {
                    return Optional.of(explicit);
                }
            }
        }
        Optional<NaicsCode> fromHint = matchHints(categoryHint);
        if (fromHint.isPresent()) {
            return fromHint;
        }
        return matchHints(title);
    }

    private Optional<NaicsCode> matchHints(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (NaicsCode code : NaicsCode.values()) {
            for (String hint : code.hints()) {
                if (lower.contains(hint)) {
                    return Optional.of(code);
                }
            }
        }
        return Optional.empty();
    }
}
