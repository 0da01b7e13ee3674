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
public class NewHampshireScraper extends StatePortalScraper {
    static final String DEFAULT_BASE_URL = "https://apps.das.nh.gov";
    static final String SEARCH_PATH = "/bidscontracts/";

    public NewHampshireScraper(HarvesterProperties properties, PoliteHttpClient httpClient, ListingNormalizer listingNormalizer) {
        super(SourceId.NEW_HAMPSHIRE, "NH", DEFAULT_BASE_URL, SEARCH_PATH, properties, httpClient, listingNormalizer);
    }

    @Override
    protected List<Element> selectRows(Document document) {
        return HtmlSupport.rowsOrTable(document, ".bid-listing, .opportunity-row, .solicitation-item", "table#bids-table");
    }

    // Table layout: bid number, agency, ..., due date in the last column.
    @Override
    protected RawListing extractRow(Element row, RawPage page) {
        Element title = HtmlSupport.titleElement(row, ".title, .bid-title");
        if (title == null) {
            return null;
        }
        List<Element> cells = row.select("td");
        RawListing.Builder builder = listing(page)
            .put(RawListing.TITLE, HtmlSupport.text(title))
            .put(RawListing.LINK, HtmlSupport.href(title));
        if (!cells.isEmpty()) {
            builder.put(RawListing.SOLICITATION_NUMBER, HtmlSupport.cell(cells, 0));
        } else {
            builder.put(RawListing.SOLICITATION_NUMBER, HtmlSupport.text(row, ".bid-number, .sol-number"));
        }
        if (cells.size() > 2) {
            builder.put(RawListing.DUE_DATE, HtmlSupport.cell(cells, cells.size() - 1));
        } else {
            builder.put(RawListing.DUE_DATE, HtmlSupport.text(row, ".due-date, .closing-date"));
        }
        String agency = cells.size() > 1 ? HtmlSupport.cell(cells, 1) : HtmlSupport.text(row, ".agency, .department");
        return builder
            .put(RawListing.AGENCY, agency != null ? agency : "New Hampshire")
            .build();
    }
}
