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
import com.contractlink.harvester.harvest.normalize.StateNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Periscope / SciQuest public event pages, one request per state organization.
 */
@Component
public class SymphonyScraper extends AbstractScraper {
    static final String DEFAULT_BASE_URL = "https://solutions.sciquest.com";
    static final String SEARCH_PATH = "/apps/Router/PublicEvent";

    static final Map<String, String> ORGANIZATIONS;

    static {
        Map<String, String> orgs = new LinkedHashMap<>();
        orgs.put("AZ", "Arizona");
        orgs.put("CA", "California");
        orgs.put("CO", "Colorado");
        orgs.put("CT", "Connecticut");
        orgs.put("GA", "Georgia");
        orgs.put("HI", "Hawaii");
        orgs.put("ID", "Idaho");
        orgs.put("IL", "Illinois");
        orgs.put("KS", "Kansas");
        orgs.put("KY", "Kentucky");
        orgs.put("ME", "Maine");
        orgs.put("MI", "SIGMA");
        orgs.put("MN", "Minnesota");
        orgs.put("MO", "Missouri");
        orgs.put("MS", "Mississippi");
        orgs.put("MT", "Montana");
        orgs.put("NV", "Nevada");
        orgs.put("NM", "NewMexico");
        orgs.put("ND", "NorthDakota");
        orgs.put("OH", "Ohio");
        orgs.put("OK", "Oklahoma");
        orgs.put("OR", "Oregon");
        orgs.put("SC", "SouthCarolina");
        orgs.put("TN", "Tennessee");
        orgs.put("TX", "ESBD");
        orgs.put("UT", "Utah");
        orgs.put("WA", "Washington");
        orgs.put("WI", "Wisconsin");
        ORGANIZATIONS = Collections.unmodifiableMap(orgs);
    }

    private static final String ROWS = ".event-item, .solicitation-row, .opportunity-item";

    private final StateNormalizer stateNormalizer;

    public SymphonyScraper(
        HarvesterProperties properties,
        PoliteHttpClient httpClient,
        ListingNormalizer listingNormalizer,
        StateNormalizer stateNormalizer
    ) {
        super(SourceId.SYMPHONY, properties, httpClient, listingNormalizer);
        this.stateNormalizer = stateNormalizer;
    }

    @Override
    protected Set<String> coveredStates() {
        return ORGANIZATIONS.keySet();
    }

    @Override
    protected String publicSearchUrl() {
        return baseUrl(DEFAULT_BASE_URL) + SEARCH_PATH;
    }

    @Override
    public FetchResult fetchRaw(ScrapeFilters filters) {
        List<PageRequest> requests = new ArrayList<>();
        for (Map.Entry<String, String> entry : ORGANIZATIONS.entrySet()) {
            if (filters.includesState(entry.getKey())) {
                requests.add(new PageRequest(eventsUrl(entry.getValue()), entry.getKey()));
            }
        }
        return fetchPages(requests, HTML_ACCEPT);
    }

    String eventsUrl(String organization) {
        return publicSearchUrl() + "?OrgName=" + URLEncoder.encode(organization, StandardCharsets.UTF_8);
    }

    @Override
    public ParseResult parse(FetchResult raw) {
        List<RawListing> listings = new ArrayList<>();
        List<HarvestError> errors = new ArrayList<>();
        for (RawPage page : raw.pages()) {
            Document document = Jsoup.parse(page.body() == null ? "" : page.body(), page.url());
            List<Element> rows = document.select(ROWS);
            if (rows.isEmpty()) {
                rows = document.select("div[data-event-id]");
            }
            extractEach(rows, page, this::extractRow, listings, errors);
        }
        return new ParseResult(listings, errors);
    }

    private RawListing extractRow(Element row, RawPage page) {
        Element title = HtmlSupport.titleElement(row, ".title, .event-title, .solicitation-title");
        if (title == null) {
            return null;
        }
        String number = HtmlSupport.text(row, ".sol-number, .event-id, .solicitation-number");
        if (number == null && row.hasAttr("data-event-id")) {
            number = row.attr("data-event-id");
        }
        String agency = HtmlSupport.text(row, ".agency, .organization, .buyer");
        if (agency == null) {
            agency = stateNormalizer.nameFor(page.jurisdiction()).orElse(null);
        }
        return listing(page)
            .put(RawListing.TITLE, HtmlSupport.text(title))
            .put(RawListing.LINK, HtmlSupport.href(title))
            .put(RawListing.SOLICITATION_NUMBER, number)
            .put(RawListing.DUE_DATE, HtmlSupport.text(row, ".due-date, .closing-date, .end-date"))
            .put(RawListing.AGENCY, agency)
            .put(RawListing.CATEGORY, HtmlSupport.text(row, ".category, .commodity"))
            .build();
    }
}
