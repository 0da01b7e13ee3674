package com.contractlink.harvester.harvest.normalize;

import com.contractlink.harvester.harvest.model.ContractRecord;
import com.contractlink.harvester.harvest.model.DropReason;
import com.contractlink.harvester.harvest.model.NormalizeResult;
import com.contractlink.harvester.harvest.model.RawListing;
import com.contractlink.harvester.harvest.model.SourceId;
import com.contractlink.harvester.harvest.util.HashUtils;
import com.contractlink.harvester.harvest.util.ListingUrlUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a source's raw field bag into a {@link ContractRecord}. Checks run in a fixed order: title,
 * keyword relevance, state, link. The first failing check decides the drop reason.
 */
@Component
public class ListingNormalizer {
    public static final int MAX_DESCRIPTION_LENGTH = 2000;
    public static final int MAX_SOLICITATION_NUMBER_LENGTH = 255;
    static final int GENERATED_ID_HEX_LENGTH = 12;

    private static final Set<String> PLACEHOLDER_IDS = Set.of("n/a", "na", "none", "-", "tbd", "unknown");

    private final KeywordFilter keywordFilter;
    private final StateNormalizer stateNormalizer;
    private final NaicsClassifier naicsClassifier;
    private final Clock clock;

    public ListingNormalizer(
        KeywordFilter keywordFilter,
        StateNormalizer stateNormalizer,
        NaicsClassifier naicsClassifier,
        Clock clock
    ) {
        this.keywordFilter = keywordFilter;
        this.stateNormalizer = stateNormalizer;
        this.naicsClassifier = naicsClassifier;
        this.clock = clock;
    }

    public NormalizeResult normalize(RawListing listing, String fallbackLink) {
        String title = listing.field(RawListing.TITLE);
        if (title == null) {
            return NormalizeResult.dropped(DropReason.MISSING_TITLE, "listing from " + listing.pageUrl() + " has no title");
        }
        String description = listing.field(RawListing.DESCRIPTION);
        if (!keywordFilter.matches(title, description)) {
            return NormalizeResult.dropped(DropReason.NOT_RELEVANT, title);
        }

        Optional<String> state = resolveState(listing);
        if (state.isEmpty()) {
            return NormalizeResult.dropped(
                DropReason.UNMAPPABLE_STATE,
                "no state in '" + firstNonBlank(listing.field(RawListing.STATE), listing.field(RawListing.LOCATION))
                    + "' for '" + title + "'"
            );
        }

        String ownLink = ListingUrlUtils.toAbsolute(listing.field(RawListing.LINK), listing.pageUrl());
        String link = ownLink != null ? ownLink : ListingUrlUtils.toAbsolute(fallbackLink, null);
        if (link == null) {
            return NormalizeResult.dropped(DropReason.MISSING_LINK, "no usable link for '" + title + "'");
        }

        String solicitationNumber = solicitationNumber(listing.source(), listing.field(RawListing.SOLICITATION_NUMBER), ownLink, title);
        LocalDate dueDate = DueDateNormalizer.parse(listing.field(RawListing.DUE_DATE));
        String naicsCode = naicsClassifier.classify(listing.field(RawListing.CATEGORY), title)
            .map(NaicsCode::code)
            .orElse(null);

        return NormalizeResult.accepted(new ContractRecord(
            state.get(),
            title,
            solicitationNumber,
            dueDate,
            link,
            listing.field(RawListing.AGENCY) == null ? "" : listing.field(RawListing.AGENCY),
            listing.source(),
            clock.instant(),
            truncate(description, MAX_DESCRIPTION_LENGTH),
            listing.field(RawListing.ORGANIZATION_TYPE),
            naicsCode
        ));
    }

    /**
     * Stable id for listings the portal does not number: {@code <SOURCE>-<12 hex of sha256(link or title)>}.
     */
    public static String generatedSolicitationNumber(SourceId source, String link, String title) {
        String basis = link != null && !link.isBlank() ? link.trim() : title.trim();
        return source.name() + "-" + HashUtils.shortSha256Hex(basis, GENERATED_ID_HEX_LENGTH);
    }

    private String solicitationNumber(SourceId source, String raw, String ownLink, String title) {
        if (raw == null || PLACEHOLDER_IDS.contains(raw.toLowerCase(Locale.ROOT))) {
            return generatedSolicitationNumber(source, ownLink, title);
        }
        return truncate(raw, MAX_SOLICITATION_NUMBER_LENGTH);
    }

    private Optional<String> resolveState(RawListing listing) {
        String[] candidates = {
            listing.field(RawListing.STATE),
            listing.jurisdiction(),
            listing.field(RawListing.LOCATION)
        };
        for (String candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            Optional<String> code = stateNormalizer.toCode(candidate);
            if (code.isPresent()) {
                return code;
            }
        }
        return Optional.empty();
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
