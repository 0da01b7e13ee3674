package com.contractlink.harvester.harvest.source;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.http.PoliteHttpClient;
import com.contractlink.harvester.harvest.http.RetryPolicy;
import com.contractlink.harvester.harvest.model.ContractRecord;
import com.contractlink.harvester.harvest.model.HarvestErrorKind;
import com.contractlink.harvester.harvest.model.ScrapeFilters;
import com.contractlink.harvester.harvest.model.ScraperResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.contractlink.harvester.harvest.source.ScraperFixtures.fixture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DemandStarScraperTest {
    private MockWebServer server;
    private ExecutorService executor;
    private HarvesterProperties properties;
    private DemandStarScraper scraper;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        properties = new HarvesterProperties();
        properties.setPerHostDelayMs(0);
        properties.setRequestTimeoutSeconds(5);
        properties.getRetry().setMaxAttempts(1);
        HarvesterProperties.Source source = new HarvesterProperties.Source();
        source.setApiUrl(server.url("/api/open-opportunities").toString());
        source.setBaseUrl(server.url("/").toString());
        properties.getSources().put("demandstar", source);

        executor = Executors.newFixedThreadPool(1);
        PoliteHttpClient httpClient = new PoliteHttpClient(
            properties,
            RetryPolicy.from(properties.getRetry(), delay -> { }),
            executor
        );
        scraper = new DemandStarScraper(properties, httpClient, ScraperFixtures.normalizer(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void usesApiWhenItReturnsOpportunities() throws Exception {
        String json = fixture("demandstar.json");
        server.setDispatcher(routes(new MockResponse().setBody(json).setHeader("Content-Type", "application/json"), null));

        ScraperResult result = scraper.run(new ScrapeFilters(Set.of(), List.of("janitorial"), 25));

        assertEquals(3, result.rawCount());
        assertEquals(2, result.normalizedCount());
        assertThat(result.degraded()).isFalse();
        ContractRecord tampa = result.records().get(0);
        assertEquals("FL", tampa.state());
        assertEquals("DS-448812", tampa.solicitationNumber());
        assertEquals("City of Tampa - Tampa", tampa.agency());
        assertEquals("City", tampa.organizationType());
        assertEquals(LocalDate.of(2025, 9, 5), tampa.dueDate());
        assertEquals("561720", tampa.naicsCode());
        assertEquals("IL", result.records().get(1).state());

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).startsWith("/api/open-opportunities?limit=25&offset=0&keywords=janitorial");
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void fallsBackToPublicPageWhenApiFails() throws Exception {
        String html = fixture("demandstar.html");
        server.setDispatcher(routes(
            new MockResponse().setResponseCode(500),
            new MockResponse().setBody(html).setHeader("Content-Type", "text/html")
        ));

        ScraperResult result = scraper.run(ScrapeFilters.unrestricted());

        assertEquals(2, server.getRequestCount());
        assertThat(result.degraded()).isFalse();
        assertEquals(2, result.rawCount());
        assertEquals(1, result.normalizedCount());
        ContractRecord library = result.records().get(0);
        assertEquals("OR", library.state());
        assertEquals("550101", library.solicitationNumber());
        assertEquals(LocalDate.of(2025, 10, 3), library.dueDate());
        assertThat(library.link()).endsWith("/app/limited/bids/550101/details");
        assertThat(result.errors()).hasSize(2);
        assertEquals(HarvestErrorKind.NETWORK, result.errors().get(0).kind());
        assertThat(result.errors().get(0).detail()).startsWith("http_500");
        assertEquals(HarvestErrorKind.VALIDATION, result.errors().get(1).kind());
    }

    @Test
    void emptyApiResponseAlsoFallsBack() throws Exception {
        String html = fixture("demandstar.html");
        server.setDispatcher(routes(
            new MockResponse().setBody("{\"opportunities\":[]}").setHeader("Content-Type", "application/json"),
            new MockResponse().setBody(html).setHeader("Content-Type", "text/html")
        ));

        ScraperResult result = scraper.run(ScrapeFilters.unrestricted());

        assertEquals(2, server.getRequestCount());
        assertEquals(1, result.normalizedCount());
    }

    @Test
    void bothPathsFailingDegradesSource() {
        server.setDispatcher(routes(new MockResponse().setResponseCode(503), new MockResponse().setResponseCode(502)));

        ScraperResult result = scraper.run(ScrapeFilters.unrestricted());

        assertThat(result.degraded()).isTrue();
        assertThat(result.records()).isEmpty();
        assertThat(result.errors()).hasSize(2)
            .allSatisfy(error -> assertEquals(HarvestErrorKind.NETWORK, error.kind()));
    }

    @Test
    void singleRequestedStateIsPassedToApi() {
        String url = scraper.apiUrl(new ScrapeFilters(Set.of("tx"), List.of("custodial", "janitorial"), 10));

        assertThat(url).endsWith("?limit=10&offset=0&keywords=custodial%2Cjanitorial&state=TX");
    }

    private static Dispatcher routes(MockResponse api, MockResponse page) {
        return new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath() == null ? "" : request.getPath();
                if (path.startsWith("/api/")) {
                    return api;
                }
                if (path.startsWith(DemandStarScraper.PUBLIC_PATH) && page != null) {
                    return page;
                }
                return new MockResponse().setResponseCode(404);
            }
        };
    }
}
