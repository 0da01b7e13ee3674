package com.contractlink.harvester.harvest.source;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.http.PoliteHttpClient;
import com.contractlink.harvester.harvest.model.FetchResult;
import com.contractlink.harvester.harvest.model.HarvestError;
import com.contractlink.harvester.harvest.model.HarvestErrorKind;
import com.contractlink.harvester.harvest.model.HttpFetchResult;
import com.contractlink.harvester.harvest.model.ParseResult;
import com.contractlink.harvester.harvest.model.RawListing;
import com.contractlink.harvester.harvest.model.RawPage;
import com.contractlink.harvester.harvest.model.ScrapeFilters;
import com.contractlink.harvester.harvest.model.SourceId;
import com.contractlink.harvester.harvest.normalize.ListingNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * DemandStar national aggregator. The open-opportunities API is tried first; when it fails or
 * returns nothing, the public listing page is scraped instead.
 */
@Component
public class DemandStarScraper extends AbstractScraper {
    static final String DEFAULT_API_URL = "https://api.demandstar.com/api/public/v1/open-opportunities";
    static final String DEFAULT_BASE_URL = "https://www.demandstar.com";
    static final String PUBLIC_PATH = "/procurement-opportunities/";

    private static final String CARDS = ".opportunity-card, .opp-item, .bid-listing";

    private final ObjectMapper objectMapper;

    public DemandStarScraper(
        HarvesterProperties properties,
        PoliteHttpClient httpClient,
        ListingNormalizer listingNormalizer,
        ObjectMapper objectMapper
    ) {
        super(SourceId.DEMANDSTAR, properties, httpClient, listingNormalizer);
        this.objectMapper = objectMapper;
    }

    @Override
    protected Set<String> coveredStates() {
        return Set.of();
    }

    @Override
    protected String publicSearchUrl() {
        return baseUrl(DEFAULT_BASE_URL) + PUBLIC_PATH;
    }

    String apiUrl(ScrapeFilters filters) {
        StringBuilder url = new StringBuilder(properties.source(source().key()).apiUrlOr(DEFAULT_API_URL));
        url.append("?limit=").append(filters.limit()).append("&offset=0");
        if (!filters.keywords().isEmpty()) {
            url.append("&keywords=").append(URLEncoder.encode(String.join(",", filters.keywords()), StandardCharsets.UTF_8));
        }
        if (filters.states().size() == 1) {
            url.append("&state=").append(filters.states().iterator().next());
        }
        return url.toString();
    }

    @Override
    public FetchResult fetchRaw(ScrapeFilters filters) {
        HttpFetchResult api = httpClient.get(apiUrl(filters), "application/json");
        if (api.isSuccessful() && countOpportunities(api.body()) > 0) {
            return new FetchResult(source(), List.of(toPage(api)), List.of(), 1);
        }
        if (api.isSuccessful()) {
            log.warn("demandstar API returned no opportunities; trying public page");
        } else {
            log.warn("demandstar API failed ({}); trying public page", api.failureDetail());
        }

        HttpFetchResult html = httpClient.get(publicSearchUrl(), HTML_ACCEPT);
        if (html.isSuccessful()) {
            List<HarvestError> recovered = api.isSuccessful() ? List.of() : List.of(HarvestError.fromFetch(source(), api));
            return FetchResult.recovered(source(), List.of(toPage(html)), recovered, 2);
        }
        log.warn("demandstar public page failed after {} attempt(s): {}", html.attempts(), html.failureDetail());
        List<HarvestError> errors = new ArrayList<>();
        if (!api.isSuccessful()) {
            errors.add(HarvestError.fromFetch(source(), api));
        }
        errors.add(HarvestError.fromFetch(source(), html));
        return new FetchResult(source(), List.of(), errors, 2);
    }

    @Override
    public ParseResult parse(FetchResult raw) {
        List<RawListing> listings = new ArrayList<>();
        List<HarvestError> errors = new ArrayList<>();
        for (RawPage page : raw.pages()) {
            if (isJson(page)) {
                parseApiPage(page, listings, errors);
            } else {
                Document document = Jsoup.parse(page.body() == null ? "" : page.body(), page.url());
                extractEach(document.select(CARDS), page, this::extractCard, listings, errors);
            }
        }
        return new ParseResult(listings, errors);
    }

    private void parseApiPage(RawPage page, List<RawListing> listings, List<HarvestError> errors) {
        JsonNode root;
        try {
            root = objectMapper.readTree(page.body());
        } catch (JsonProcessingException e) {
            log.warn("demandstar API payload from {} is not valid JSON: {}", page.url(), e.getOriginalMessage());
            errors.add(HarvestError.of(HarvestErrorKind.PARSE, source(), "invalid JSON from " + page.url()));
            return;
        }
        List<JsonNode> items = new ArrayList<>();
        opportunities(root).forEach(items::add);
        extractEach(items, page, this::extractOpportunity, listings, errors);
    }

    private RawListing extractOpportunity(JsonNode opportunity, RawPage page) {
        if (!opportunity.isObject()) {
            throw new IllegalArgumentException("opportunity is not an object: " + opportunity.getNodeType());
        }
        JsonNode location = opportunity.path("location");
        JsonNode organization = opportunity.path("organization");
        String city = text(location, "city");
        String agency = text(organization, "name");
        if (agency != null && city != null) {
            agency = agency + " - " + city;
        }
        return listing(page)
            .put(RawListing.SOLICITATION_NUMBER, text(opportunity, "id"))
            .put(RawListing.TITLE, text(opportunity, "title"))
            .put(RawListing.DESCRIPTION, text(opportunity, "description"))
            .put(RawListing.DUE_DATE, text(opportunity, "dueDate"))
            .put(RawListing.LINK, text(opportunity, "url"))
            .put(RawListing.STATE, text(location, "state"))
            .put(RawListing.CITY, city)
            .put(RawListing.AGENCY, agency)
            .put(RawListing.ORGANIZATION_TYPE, text(organization, "type"))
            .put(RawListing.CATEGORY, text(opportunity, "category"))
            .build();
    }

    private RawListing extractCard(Element card, RawPage page) {
        Element title = HtmlSupport.titleElement(card, ".title, .opp-title");
        if (title == null) {
            return null;
        }
        return listing(page)
            .put(RawListing.TITLE, HtmlSupport.text(title))
            .put(RawListing.LINK, HtmlSupport.href(title))
            .put(RawListing.LOCATION, HtmlSupport.text(card, ".location, .state, .city"))
            .put(RawListing.AGENCY, HtmlSupport.text(card, ".agency, .organization, .org-name"))
            .put(RawListing.DUE_DATE, HtmlSupport.text(card, ".due-date, .closing-date"))
            .put(RawListing.SOLICITATION_NUMBER, HtmlSupport.text(card, ".opp-id, .bid-id"))
            .build();
    }

    private int countOpportunities(String body) {
        if (body == null || body.isBlank()) {
            return 0;
        }
        try {
            return opportunities(objectMapper.readTree(body)).size();
        } catch (JsonProcessingException e) {
            return 0;
        }
    }

    private static JsonNode opportunities(JsonNode root) {
        if (root == null) {
            return MissingNode.getInstance();
        }
        return root.isArray() ? root : root.path("opportunities");
    }

    private static boolean isJson(RawPage page) {
        String contentType = page.contentType() == null ? "" : page.contentType().toLowerCase(Locale.ROOT);
        if (contentType.contains("json")) {
            return true;
        }
        String body = page.body() == null ? "" : page.body().trim();
        return body.startsWith("{") || body.startsWith("[");
    }

    private static RawPage toPage(HttpFetchResult fetch) {
        return new RawPage(fetch.finalUrlOrRequested(), fetch.body(), fetch.contentType(), null);
    }

    private static String text(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            return value.asText().trim();
        }
        return value.toString();
    }
}
