package com.contractlink.harvester.harvest.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

/** Full pass against unreachable sources: every scraper degrades, the run still completes. */
@SpringBootTest
@ActiveProfiles("test")
class HarvestRunEndpointTest {

  @Autowired private WebApplicationContext context;

  @Autowired private ObjectMapper objectMapper;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
  }

  @Test
  void passWithAllSourcesDownIsRecordedAsCompletedWithErrors() throws Exception {
    MvcResult result =
        mockMvc
            .perform(post("/api/harvest/run").header("X-Admin-Token", "test-admin-token"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED_WITH_ERRORS"))
            .andExpect(jsonPath("$.records_found").value(0))
            .andReturn();

    JsonNode report = objectMapper.readTree(result.getResponse().getContentAsString());
    assertThat(report.path("degraded_sources").size()).isEqualTo(7);
    assertThat(report.path("by_source").path("commbuys").asInt(-1)).isZero();
    assertThat(report.path("notes").asText()).contains("NETWORK");
    long runId = report.path("run_id").asLong();

    mockMvc
        .perform(get("/api/harvest/runs/latest").header("X-Admin-Token", "test-admin-token"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.run_id").value(runId))
        .andExpect(jsonPath("$.trigger").value("admin"));
  }
}
