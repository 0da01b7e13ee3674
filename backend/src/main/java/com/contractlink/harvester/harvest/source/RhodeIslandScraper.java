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
public class RhodeIslandScraper extends StatePortalScraper {
    static final String DEFAULT_BASE_URL = "https://www.ridop.ri.gov";
    static final String SEARCH_PATH = "/public-solicitations.php";

    public RhodeIslandScraper(HarvesterProperties properties, PoliteHttpClient httpClient, ListingNormalizer listingNormalizer) {
        super(SourceId.RHODE_ISLAND, "RI", DEFAULT_BASE_URL, SEARCH_PATH, properties, httpClient, listingNormalizer);
    }

    @Override
    protected List<Element> selectRows(Document document) {
        return HtmlSupport.rowsOrTable(
            document,
            ".solicitation-row, .bid-row, .opportunity-item",
            "table.solicitations, table.bids-table"
        );
    }

    // Table layout: solicitation number, agency, title, due date.
    @Override
    protected RawListing extractRow(Element row, RawPage page) {
        Element title = HtmlSupport.titleElement(row, ".title, .solicitation-title");
        if (title == null) {
            return null;
        }
        List<Element> cells = row.select("td");
        String number = !cells.isEmpty()
            ? HtmlSupport.cell(cells, 0)
            : HtmlSupport.text(row, ".sol-number, .rfp-number");
        String dueDate = cells.size() > 3
            ? HtmlSupport.cell(cells, 3)
            : HtmlSupport.text(row, ".due-date, .closing-date");
        String agency = cells.size() > 1
            ? HtmlSupport.cell(cells, 1)
            : HtmlSupport.text(row, ".agency, .department");
        return listing(page)
            .put(RawListing.TITLE, HtmlSupport.text(title))
            .put(RawListing.LINK, HtmlSupport.href(title))
            .put(RawListing.SOLICITATION_NUMBER, number)
            .put(RawListing.DUE_DATE, dueDate)
            .put(RawListing.AGENCY, agency != null ? agency : "Rhode Island")
            .build();
    }
}
