package com.contractlink.harvester.harvest.source;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.http.PoliteHttpClient;
import com.contractlink.harvester.harvest.model.FetchResult;
import com.contractlink.harvester.harvest.model.HarvestError;
import com.contractlink.harvester.harvest.model.ParseResult;
import com.contractlink.harvester.harvest.model.RawListing;
import com.contractlink.harvester.harvest.model.RawPage;
import com.contractlink.harvester.harvest.model.ScrapeFilters;
import com.contractlink.harvester.harvest.model.SourceId;
import com.contractlink.harvester.harvest.normalize.ListingNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A state's own procurement portal: one public listing page, every row in that state.
 */
abstract class StatePortalScraper extends AbstractScraper {
    private final String stateCode;
    private final String defaultBaseUrl;
    private final String searchPath;

    protected StatePortalScraper(
        SourceId source,
        String stateCode,
        String defaultBaseUrl,
        String searchPath,
        HarvesterProperties properties,
        PoliteHttpClient httpClient,
        ListingNormalizer listingNormalizer
    ) {
        super(source, properties, httpClient, listingNormalizer);
        this.stateCode = stateCode;
        this.defaultBaseUrl = defaultBaseUrl;
        this.searchPath = searchPath;
    }

    protected abstract List<Element> selectRows(Document document);

    protected abstract RawListing extractRow(Element row, RawPage page);

    @Override
    protected Set<String> coveredStates() {
        return Set.of(stateCode);
    }

    @Override
    protected String publicSearchUrl() {
        return baseUrl(defaultBaseUrl) + searchPath;
    }

    @Override
    public FetchResult fetchRaw(ScrapeFilters filters) {
        return fetchPages(List.of(new PageRequest(publicSearchUrl(), stateCode)), HTML_ACCEPT);
    }

    @Override
    public ParseResult parse(FetchResult raw) {
        List<RawListing> listings = new ArrayList<>();
        List<HarvestError> errors = new ArrayList<>();
        for (RawPage page : raw.pages()) {
            Document document = Jsoup.parse(page.body() == null ? "" : page.body(), page.url());
            extractEach(selectRows(document), page, this::extractRow, listings, errors);
        }
        return new ParseResult(listings, errors);
    }
}
