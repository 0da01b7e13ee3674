package com.contractlink.harvester.harvest.source;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.http.PoliteHttpClient;
import com.contractlink.harvester.harvest.model.ContractRecord;
import com.contractlink.harvester.harvest.model.ScrapeFilters;
import com.contractlink.harvester.harvest.model.ScraperResult;
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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BidExpressScraperTest {

    @Mock
    private PoliteHttpClient httpClient;

    @Test
    void readsRssItemsForRequestedState() throws Exception {
        String feed = "https://www.bidexpress.com/businesses/303803/rss";
        when(httpClient.get(eq(feed), anyString())).thenReturn(ok(feed, fixture("bidexpress.xml"), "application/rss+xml"));
        BidExpressScraper scraper = new BidExpressScraper(new HarvesterProperties(), httpClient, ScraperFixtures.normalizer());

        ScraperResult result = scraper.run(new ScrapeFilters(Set.of("FL"), List.of(), 100));

        assertEquals(3, result.rawCount());
        assertEquals(2, result.normalizedCount());
        ContractRecord custodial = result.records().get(0);
        assertEquals("FL", custodial.state());
        assertEquals("E5Z41", custodial.solicitationNumber());
        assertEquals(LocalDate.of(2025, 8, 12), custodial.dueDate());
        assertEquals("BidExpress", custodial.agency());
        assertEquals("561720", custodial.naicsCode());
        assertThat(custodial.description()).doesNotContain("<p>").contains("DeLand complex");
        ContractRecord restArea = result.records().get(1);
        assertEquals("E1A02", restArea.solicitationNumber());
        assertEquals(LocalDate.of(2025, 7, 9), restArea.dueDate());
    }

    @Test
    void solicitationNumberComesFromGuidOrLinkTail() {
        assertEquals("T7123", BidExpressScraper.solicitationNumber("T7123", "https://x/y/z"));
        assertEquals("E5Z41", BidExpressScraper.solicitationNumber(null, "https://www.bidexpress.com/s/E5Z41/"));
        assertNull(BidExpressScraper.solicitationNumber(null, null));
    }

    @Test
    void dueDateFallsBackToPublicationDate() {
        assertEquals("08/12/2025 10:30 AM", BidExpressScraper.dueDate("Letting Date: 08/12/2025 10:30 AM", "ignored"));
        assertEquals("Tue, 08 Jul 2025 12:00:00 GMT", BidExpressScraper.dueDate("Structural steel coating.", "Tue, 08 Jul 2025 12:00:00 GMT"));
    }

    @Test
    void feedUrlUsesBusinessId() {
        BidExpressScraper scraper = new BidExpressScraper(new HarvesterProperties(), httpClient, ScraperFixtures.normalizer());

        assertEquals("https://www.bidexpress.com/businesses/303801/rss", scraper.feedUrl(BidExpressScraper.BUSINESS_IDS.get("TX")));
    }
}
