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
public class CommbuysScraper extends StatePortalScraper {
    static final String DEFAULT_BASE_URL = "https://www.commbuys.com";
    static final String SEARCH_PATH = "/bso/external/publicBids.sdo";

    public CommbuysScraper(HarvesterProperties properties, PoliteHttpClient httpClient, ListingNormalizer listingNormalizer) {
        super(SourceId.COMMBUYS, "MA", DEFAULT_BASE_URL, SEARCH_PATH, properties, httpClient, listingNormalizer);
    }

    @Override
    protected List<Element> selectRows(Document document) {
        return HtmlSupport.rowsOrTable(document, "tr.bid-row, tr.solicitation-row", "table#bids-table");
    }

    // Columns: bid number, title, agency, due date.
    @Override
    protected RawListing extractRow(Element row, RawPage page) {
        List<Element> cells = row.select("td");
        if (cells.size() < 4) {
            return null;
        }
        Element titleCell = cells.get(1);
        Element titleLink = titleCell.selectFirst("a[href]");
        return listing(page)
            .put(RawListing.SOLICITATION_NUMBER, HtmlSupport.cell(cells, 0))
            .put(RawListing.TITLE, titleLink != null ? HtmlSupport.text(titleLink) : HtmlSupport.text(titleCell))
            .put(RawListing.LINK, HtmlSupport.href(titleLink))
            .put(RawListing.AGENCY, HtmlSupport.cell(cells, 2))
            .put(RawListing.DUE_DATE, HtmlSupport.cell(cells, 3))
            .build();
    }
}
