package com.contractlink.harvester.harvest.source;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.http.PoliteHttpClient;
import com.contractlink.harvester.harvest.model.RawListing;
import com.contractlink.harvester.harvest.model.RawPage;
import com.contractlink.harvester.harvest.model.SourceId;
import com.contractlink.harvester.harvest.normalize.ListingNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EMarylandScraper extends StatePortalScraper {
    static final String DEFAULT_BASE_URL = "https://emma.maryland.gov";
    static final String SEARCH_PATH = "/page.aspx/en/bpm/process_list";

    private static final String ROWS = ".opportunity-item, .solicitation-row, .bid-row";
    private static final String FALLBACK_ROWS = "div#main-content div.item, div#main-content div.row";

    public EMarylandScraper(HarvesterProperties properties, PoliteHttpClient httpClient, ListingNormalizer listingNormalizer) {
        super(SourceId.EMARYLAND, "MD", DEFAULT_BASE_URL, SEARCH_PATH, properties, httpClient, listingNormalizer);
    }

    @Override
    protected List<Element> selectRows(Document document) {
        List<Element> rows = document.select(ROWS);
        return rows.isEmpty() ? document.select(FALLBACK_ROWS) : rows;
    }

    @Override
    protected RawListing extractRow(Element row, RawPage page) {
        Element title = HtmlSupport.titleElement(row, ".title, .solicitation-title, .process-name");
        if (title == null) {
            return null;
        }
        String agency = HtmlSupport.text(row, ".agency, .organization, .buyer");
        return listing(page)
            .put(RawListing.TITLE, HtmlSupport.text(title))
            .put(RawListing.LINK, HtmlSupport.href(title))
            .put(RawListing.SOLICITATION_NUMBER, HtmlSupport.text(row, ".sol-number, .bid-number, .process-id"))
            .put(RawListing.DUE_DATE, HtmlSupport.text(row, ".due-date, .closing-date, .end-date"))
            .put(RawListing.AGENCY, agency != null ? agency : "Maryland")
            .put(RawListing.DESCRIPTION, HtmlSupport.text(row, ".description, .summary"))
            .build();
    }
}
