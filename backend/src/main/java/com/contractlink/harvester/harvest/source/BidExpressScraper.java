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
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BidExpress business RSS feeds. Each feed belongs to one state agency, so the feed's state is the
 * listing's jurisdiction.
 */
@Component
public class BidExpressScraper extends AbstractScraper {
    static final String DEFAULT_BASE_URL = "https://www.bidexpress.com";
    static final String RSS_ACCEPT = "application/rss+xml, application/xml;q=0.9, text/xml;q=0.8";

    static final Map<String, String> BUSINESS_IDS;

    static {
        Map<String, String> ids = new LinkedHashMap<>();
        ids.put("FL", "303803");
        ids.put("TX", "303801");
        ids.put("CA", "303802");
        ids.put("NY", "303804");
        ids.put("PA", "303805");
        ids.put("OH", "303806");
        ids.put("NC", "303807");
        ids.put("VA", "303808");
        BUSINESS_IDS = Collections.unmodifiableMap(ids);
    }

    private static final Pattern DUE_LINE = Pattern.compile(
        "(?i)(?:due|closing|closes|bid opening|letting)[^:]{0,20}:\\s*([^\\n]{6,60})"
    );

    public BidExpressScraper(HarvesterProperties properties, PoliteHttpClient httpClient, ListingNormalizer listingNormalizer) {
        super(SourceId.BIDEXPRESS, properties, httpClient, listingNormalizer);
    }

    @Override
    protected Set<String> coveredStates() {
        return BUSINESS_IDS.keySet();
    }

    @Override
    protected String publicSearchUrl() {
        return baseUrl(DEFAULT_BASE_URL) + "/";
    }

    String feedUrl(String businessId) {
        return baseUrl(DEFAULT_BASE_URL) + "/businesses/" + businessId + "/rss";
    }

    @Override
    public FetchResult fetchRaw(ScrapeFilters filters) {
        List<PageRequest> requests = new ArrayList<>();
        for (Map.Entry<String, String> entry : BUSINESS_IDS.entrySet()) {
            if (filters.includesState(entry.getKey())) {
                requests.add(new PageRequest(feedUrl(entry.getValue()), entry.getKey()));
            }
        }
        return fetchPages(requests, RSS_ACCEPT);
    }

    @Override
    public ParseResult parse(FetchResult raw) {
        List<RawListing> listings = new ArrayList<>();
        List<HarvestError> errors = new ArrayList<>();
        for (RawPage page : raw.pages()) {
            Document feed = Jsoup.parse(page.body() == null ? "" : page.body(), page.url(), Parser.xmlParser());
            extractEach(feed.select("item"), page, this::extractItem, listings, errors);
        }
        return new ParseResult(listings, errors);
    }

    private RawListing extractItem(Element item, RawPage page) {
        String title = childText(item, "title");
        String link = childText(item, "link");
        String description = plainText(childText(item, "description"));
        String guid = childText(item, "guid");
        return listing(page)
            .put(RawListing.TITLE, title)
            .put(RawListing.LINK, link)
            .put(RawListing.DESCRIPTION, description)
            .put(RawListing.SOLICITATION_NUMBER, solicitationNumber(guid, link))
            .put(RawListing.DUE_DATE, dueDate(description, childText(item, "pubDate")))
            .put(RawListing.AGENCY, "BidExpress")
            .put(RawListing.CATEGORY, childText(item, "category"))
            .build();
    }

    static String solicitationNumber(String guid, String link) {
        String basis = guid != null ? guid : link;
        if (basis == null) {
            return null;
        }
        if (basis.startsWith("http://") || basis.startsWith("https://")) {
            String trimmed = basis.endsWith("/") ? basis.substring(0, basis.length() - 1) : basis;
            int slash = trimmed.lastIndexOf('/');
            return slash >= 0 && slash < trimmed.length() - 1 ? trimmed.substring(slash + 1) : null;
        }
        return basis;
    }

    // Feeds carry the deadline in the description body; pubDate is the fallback.
    static String dueDate(String description, String pubDate) {
        if (description != null) {
            Matcher matcher = DUE_LINE.matcher(description);
            if (matcher.find()) {
                return matcher.group(1).trim();
            }
        }
        return pubDate;
    }

    private static String childText(Element item, String name) {
        Element child = item.selectFirst(name);
        if (child == null) {
            return null;
        }
        String text = child.text().trim();
        return text.isEmpty() ? null : text;
    }

    private static String plainText(String html) {
        if (html == null) {
            return null;
        }
        return Jsoup.parse(html).text();
    }
}
