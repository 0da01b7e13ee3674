package com.contractlink.harvester.harvest.source;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.http.PoliteHttpClient;
import com.contractlink.harvester.harvest.model.ContractRecord;
import com.contractlink.harvester.harvest.model.DropReason;
import com.contractlink.harvester.harvest.model.FetchResult;
import com.contractlink.harvester.harvest.model.HarvestError;
import com.contractlink.harvester.harvest.model.HarvestErrorKind;
import com.contractlink.harvester.harvest.model.HttpFetchResult;
import com.contractlink.harvester.harvest.model.NormalizeResult;
import com.contractlink.harvester.harvest.model.ParseResult;
import com.contractlink.harvester.harvest.model.RawListing;
import com.contractlink.harvester.harvest.model.RawPage;
import com.contractlink.harvester.harvest.model.ScrapeFilters;
import com.contractlink.harvester.harvest.model.ScraperResult;
import com.contractlink.harvester.harvest.model.SourceId;
import com.contractlink.harvester.harvest.normalize.ListingNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public abstract class AbstractScraper implements Scraper {
    protected static final String HTML_ACCEPT = "text/html,application/xhtml+xml";

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final SourceId source;
    protected final HarvesterProperties properties;
    protected final PoliteHttpClient httpClient;
    private final ListingNormalizer listingNormalizer;

    protected AbstractScraper(
        SourceId source,
        HarvesterProperties properties,
        PoliteHttpClient httpClient,
        ListingNormalizer listingNormalizer
    ) {
        this.source = source;
        this.properties = properties;
        this.httpClient = httpClient;
        this.listingNormalizer = listingNormalizer;
    }

    @Override
    public SourceId source() {
        return source;
    }

    /**
     * States this source can return. Empty means nationwide.
     */
    protected abstract Set<String> coveredStates();

    /**
     * Link used when a listing carries none of its own.
     */
    protected abstract String publicSearchUrl();

    @Override
    public NormalizeResult normalize(RawListing listing) {
        return listingNormalizer.normalize(listing, publicSearchUrl());
    }

    @Override
    public ScraperResult run(ScrapeFilters filters) {
        long startedNanos = System.nanoTime();
        if (!coversAnyRequestedState(filters)) {
            log.debug("{} skipped: none of {} requested", source.key(), filters.states());
            return ScraperResult.skipped(source);
        }

        FetchResult fetched = fetchRaw(filters);
        List<HarvestError> errors = new ArrayList<>(fetched.errors());
        ParseResult parsed = fetched.nothingFetched() ? new ParseResult(List.of(), List.of()) : parse(fetched);
        errors.addAll(parsed.errors());

        List<ContractRecord> records = new ArrayList<>();
        int keywordMatched = 0;
        for (RawListing listing : parsed.listings()) {
            NormalizeResult result = normalize(listing);
            if (result.passedKeywordFilter()) {
                keywordMatched++;
            }
            if (result.isAccepted()) {
                records.add(result.record());
                continue;
            }
            if (result.dropReason() == DropReason.UNMAPPABLE_STATE || result.dropReason() == DropReason.MISSING_LINK) {
                log.warn("{} dropped listing ({}): {}", source.key(), result.dropReason(), result.detail());
                errors.add(HarvestError.of(HarvestErrorKind.VALIDATION, source, result.dropReason() + ": " + result.detail()));
            } else {
                log.debug("{} dropped listing ({}): {}", source.key(), result.dropReason(), result.detail());
            }
        }

        boolean degraded = fetched.degraded();
        boolean zeroResults = !degraded && !fetched.nothingFetched() && parsed.listings().isEmpty();
        Duration duration = Duration.ofNanos(System.nanoTime() - startedNanos);
        if (zeroResults) {
            log.warn(
                "{} fetched {} page(s) but parsed zero listings; selectors may need maintenance",
                source.key(),
                fetched.pages().size()
            );
        }
        log.info(
            "{} finished raw={} relevant={} normalized={} errors={} degraded={} in {} ms",
            source.key(),
            parsed.listings().size(),
            keywordMatched,
            records.size(),
            errors.size(),
            degraded,
            duration.toMillis()
        );
        return new ScraperResult(
            source,
            parsed.listings().size(),
            keywordMatched,
            records.size(),
            errors,
            duration,
            degraded,
            zeroResults,
            records
        );
    }

    protected boolean coversAnyRequestedState(ScrapeFilters filters) {
        Set<String> covered = coveredStates();
        if (covered.isEmpty() || filters.states().isEmpty()) {
            return true;
        }
        for (String state : covered) {
            if (filters.includesState(state)) {
                return true;
            }
        }
        return false;
    }

    protected String baseUrl(String fallback) {
        return properties.source(source.key()).baseUrlOr(fallback);
    }

    /**
     * GETs every request in order. A failed request is recorded and the rest continue.
     */
    protected FetchResult fetchPages(List<PageRequest> requests, String accept) {
        List<RawPage> pages = new ArrayList<>();
        List<HarvestError> errors = new ArrayList<>();
        for (PageRequest request : requests) {
            HttpFetchResult fetch = httpClient.get(request.url(), accept);
            if (fetch.isSuccessful()) {
                pages.add(new RawPage(fetch.finalUrlOrRequested(), fetch.body(), fetch.contentType(), request.jurisdiction()));
            } else {
                log.warn("{} fetch failed after {} attempt(s): {}", source.key(), fetch.attempts(), fetch.failureDetail());
                errors.add(HarvestError.fromFetch(source, fetch));
            }
        }
        return new FetchResult(source, pages, errors, requests.size());
    }

    /**
     * Runs {@code extractor} over each item, turning a failure into a PARSE error for that item only.
     * A null return skips the item silently.
     */
    protected <T> void extractEach(
        List<T> items,
        RawPage page,
        ItemExtractor<T> extractor,
        List<RawListing> listings,
        List<HarvestError> errors
    ) {
        int index = 0;
        for (T item : items) {
            index++;
            try {
                RawListing listing = extractor.extract(item, page);
                if (listing != null) {
                    listings.add(listing);
                }
            } catch (RuntimeException e) {
                log.warn("{} could not parse item {} on {}: {}", source.key(), index, page.url(), e.toString());
                errors.add(HarvestError.of(
                    HarvestErrorKind.PARSE,
                    source,
                    "item " + index + " on " + page.url() + ": " + e.getMessage()
                ));
            }
        }
    }

    protected RawListing.Builder listing(RawPage page) {
        return RawListing.builder(source, page.url(), page.jurisdiction());
    }

    @FunctionalInterface
    protected interface ItemExtractor<T> {
        RawListing extract(T item, RawPage page);
    }

    protected record PageRequest(String url, String jurisdiction) {
    }
}
