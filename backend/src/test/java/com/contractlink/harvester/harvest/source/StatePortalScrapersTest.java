package com.contractlink.harvester.harvest.source;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.http.PoliteHttpClient;
import com.contractlink.harvester.harvest.model.ContractRecord;
import com.contractlink.harvester.harvest.model.HarvestErrorKind;
import com.contractlink.harvester.harvest.model.ScrapeFilters;
import com.contractlink.harvester.harvest.model.ScraperResult;
import com.contractlink.harvester.harvest.model.SourceId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static com.contractlink.harvester.harvest.source.ScraperFixtures.fixture;
import static com.contractlink.harvester.harvest.source.ScraperFixtures.ok;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatePortalScrapersTest {

    @Mock
    private PoliteHttpClient httpClient;

    private final HarvesterProperties properties = new HarvesterProperties();

    @Test
    void commbuysReadsBidTableRows() throws Exception {
        String url = "https://www.commbuys.com/bso/external/publicBids.sdo";
        when(httpClient.get(eq(url), anyString())).thenReturn(ok(url, fixture("commbuys.html"), "text/html"));
        CommbuysScraper scraper = new CommbuysScraper(properties, httpClient, ScraperFixtures.normalizer());

        ScraperResult result = scraper.run(ScrapeFilters.unrestricted());

        assertEquals(3, result.rawCount());
        assertEquals(2, result.keywordMatchedCount());
        assertEquals(2, result.normalizedCount());
        assertThat(result.degraded()).isFalse();
        assertThat(result.errors()).isEmpty();
        ContractRecord first = result.records().get(0);
        assertEquals("MA", first.state());
        assertEquals("BD-24-1080-OSD01", first.solicitationNumber());
        assertEquals("Janitorial Services for State Office Buildings", first.title());
        assertEquals("Operational Services Division", first.agency());
        assertEquals(LocalDate.of(2025, 3, 15), first.dueDate());
        assertEquals("https://www.commbuys.com/bso/external/bidDetail.sdo?docId=BD-24-1080-OSD01", first.link());
        ContractRecord second = result.records().get(1);
        assertEquals("BD-24-1080-TRC03", second.solicitationNumber());
        assertThat(second.dueDate()).isNull();
        assertEquals("561790", second.naicsCode());
    }

    @Test
    void eMarylandReadsOpportunityItems() throws Exception {
        String url = "https://emma.maryland.gov/page.aspx/en/bpm/process_list";
        when(httpClient.get(eq(url), anyString())).thenReturn(ok(url, fixture("emaryland.html"), "text/html"));
        EMarylandScraper scraper = new EMarylandScraper(properties, httpClient, ScraperFixtures.normalizer());

        ScraperResult result = scraper.run(ScrapeFilters.unrestricted());

        assertEquals(3, result.rawCount());
        assertThat(result.records())
            .extracting(ContractRecord::solicitationNumber)
            .containsExactly("BPM051234", "BPM051235");
        ContractRecord court = result.records().get(0);
        assertEquals("MD", court.state());
        assertEquals(LocalDate.of(2025, 4, 2), court.dueDate());
        assertEquals("Judiciary of Maryland", court.agency());
        assertThat(court.description()).contains("trash removal");
        assertEquals("Maryland", result.records().get(1).agency());
    }

    @Test
    void newHampshireReadsFallbackTable() throws Exception {
        String url = "https://apps.das.nh.gov/bidscontracts/";
        when(httpClient.get(eq(url), anyString())).thenReturn(ok(url, fixture("newhampshire.html"), "text/html"));
        NewHampshireScraper scraper = new NewHampshireScraper(properties, httpClient, ScraperFixtures.normalizer());

        ScraperResult result = scraper.run(ScrapeFilters.unrestricted());

        assertEquals(3, result.rawCount());
        assertEquals(2, result.normalizedCount());
        ContractRecord safety = result.records().get(0);
        assertEquals("NH", safety.state());
        assertEquals("RFB 2718-25", safety.solicitationNumber());
        assertEquals("Department of Safety", safety.agency());
        assertEquals(LocalDate.of(2025, 5, 1), safety.dueDate());
        assertEquals("https://apps.das.nh.gov/bidscontracts/bids/2718-25.pdf", safety.link());
        assertEquals("238990", result.records().get(1).naicsCode());
    }

    @Test
    void rhodeIslandGeneratesIdsForPlaceholderNumbers() throws Exception {
        String url = "https://www.ridop.ri.gov/public-solicitations.php";
        when(httpClient.get(eq(url), anyString())).thenReturn(ok(url, fixture("rhodeisland.html"), "text/html"));
        RhodeIslandScraper scraper = new RhodeIslandScraper(properties, httpClient, ScraperFixtures.normalizer());

        ScraperResult result = scraper.run(ScrapeFilters.unrestricted());

        assertEquals(2, result.normalizedCount());
        assertEquals("RFP 80154321", result.records().get(0).solicitationNumber());
        assertEquals(LocalDate.of(2025, 6, 3), result.records().get(0).dueDate());
        ContractRecord beaches = result.records().get(1);
        assertThat(beaches.solicitationNumber()).startsWith("RHODE_ISLAND-");
        assertEquals("https://www.ridop.ri.gov/solicitations/beach-facilities", beaches.link());
        assertEquals(LocalDate.of(2025, 6, 10), beaches.dueDate());
    }

    @Test
    void configuredBaseUrlOverridesDefault() throws Exception {
        HarvesterProperties.Source source = new HarvesterProperties.Source();
        source.setBaseUrl("http://localhost:8089/");
        properties.getSources().put("commbuys", source);
        String url = "http://localhost:8089/bso/external/publicBids.sdo";
        when(httpClient.get(eq(url), anyString())).thenReturn(ok(url, fixture("commbuys.html"), "text/html"));

        ScraperResult result = new CommbuysScraper(properties, httpClient, ScraperFixtures.normalizer())
            .run(ScrapeFilters.unrestricted());

        assertThat(result.records().get(0).link()).startsWith("http://localhost:8089/bso/external/bidDetail.sdo");
    }

    @Test
    void headerlessBidTableKeepsFirstRow() {
        String url = "https://www.commbuys.com/bso/external/publicBids.sdo";
        String html = "<html><body><table id=\"bids-table\">"
            + "<tr><td>BD-1</td><td><a href=\"/bid/1\">Janitorial Services Region 1</a></td><td>OSD</td><td>12/31/2024</td></tr>"
            + "<tr><td>BD-2</td><td><a href=\"/bid/2\">Custodial Services Region 2</a></td><td>OSD</td><td>Dec 31, 2024</td></tr>"
            + "<tr><td>BD-3</td><td><a href=\"/bid/3\">Cleaning Services Region 3</a></td><td>OSD</td><td>TBD</td></tr>"
            + "</table></body></html>";
        when(httpClient.get(eq(url), anyString())).thenReturn(ok(url, html, "text/html"));

        ScraperResult result = new CommbuysScraper(properties, httpClient, ScraperFixtures.normalizer())
            .run(ScrapeFilters.unrestricted());

        assertEquals(3, result.rawCount());
        assertThat(result.records())
            .extracting(ContractRecord::solicitationNumber)
            .containsExactly("BD-1", "BD-2", "BD-3");
        assertEquals(LocalDate.of(2024, 12, 31), result.records().get(0).dueDate());
    }

    @Test
    void headerRowOfBidTableIsNotAListing() {
        String url = "https://www.commbuys.com/bso/external/publicBids.sdo";
        String html = "<html><body><table id=\"bids-table\">"
            + "<tr><th>Bid</th><th>Title</th><th>Agency</th><th>Due</th></tr>"
            + "<tr><td>BD-7</td><td><a href=\"/bid/7\">Janitorial Services</a></td><td>OSD</td><td>01/15/2025</td></tr>"
            + "</table></body></html>";
        when(httpClient.get(eq(url), anyString())).thenReturn(ok(url, html, "text/html"));

        ScraperResult result = new CommbuysScraper(properties, httpClient, ScraperFixtures.normalizer())
            .run(ScrapeFilters.unrestricted());

        assertEquals(1, result.rawCount());
        assertThat(result.errors()).isEmpty();
        assertEquals("BD-7", result.records().get(0).solicitationNumber());
    }

    @Test
    void fetchFailureDegradesSourceWithoutParsing() {
        String url = "https://www.commbuys.com/bso/external/publicBids.sdo";
        when(httpClient.get(eq(url), anyString())).thenReturn(ScraperFixtures.status(url, 503));

        ScraperResult result = new CommbuysScraper(properties, httpClient, ScraperFixtures.normalizer())
            .run(ScrapeFilters.unrestricted());

        assertThat(result.degraded()).isTrue();
        assertThat(result.zeroResults()).isFalse();
        assertThat(result.records()).isEmpty();
        assertThat(result.errors()).singleElement()
            .satisfies(error -> {
                assertEquals(HarvestErrorKind.NETWORK, error.kind());
                assertEquals(SourceId.COMMBUYS, error.source());
                assertThat(error.detail()).contains("http_503");
            });
    }

    @Test
    void emptyPageIsFlaggedAsZeroResults() {
        String url = "https://www.ridop.ri.gov/public-solicitations.php";
        when(httpClient.get(eq(url), anyString())).thenReturn(ok(url, "<html><body><p>Site redesigned</p></body></html>", "text/html"));

        ScraperResult result = new RhodeIslandScraper(properties, httpClient, ScraperFixtures.normalizer())
            .run(ScrapeFilters.unrestricted());

        assertThat(result.zeroResults()).isTrue();
        assertThat(result.degraded()).isFalse();
        assertEquals(0, result.rawCount());
    }

    @Test
    void skipsPortalOutsideRequestedStates() {
        ScraperResult result = new EMarylandScraper(properties, httpClient, ScraperFixtures.normalizer())
            .run(new ScrapeFilters(Set.of("ma"), List.of(), 50));

        assertThat(result.records()).isEmpty();
        assertThat(result.zeroResults()).isFalse();
        verify(httpClient, never()).get(anyString(), anyString());
    }
}
