package dev.trailanalytics;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the full application against the race documents under {@code src/test/resources/data}.
 */
@SpringBootTest(properties = "trail.analytics.data-root=src/test/resources")
@AutoConfigureMockMvc
class SmokeIntegrationTest {

  @Autowired private MockMvc mvc;

  @Test
  void startup_loads_manifest_and_selects_default_year() throws Exception {
    mvc.perform(get("/api/races"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(3)))
        .andExpect(jsonPath("$[2].metadata.year").value(2024));

    mvc.perform(get("/api/panels/summary"))
        .andExpect(status().isOk())
        .andExpect(
            jsonPath(
                "$.selectedIds", containsInAnyOrder("alpine-ultra-2025", "coastal-women-2025")));
  }

  @Test
  void race_documents_are_normalized_on_load() throws Exception {
    mvc.perform(get("/api/races/alpine-ultra-2025"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.results", hasSize(5)))
        .andExpect(jsonPath("$.results[0].rank").value(1))
        .andExpect(jsonPath("$.results[0].score").value(950.0))
        .andExpect(jsonPath("$.metadata.seriesTags", hasSize(2)));

    mvc.perform(get("/api/races/coastal-women-2025"))
        .andExpect(jsonPath("$.metadata.seriesTags[0]").value("World Series"));
  }

  @Test
  void summary_table_covers_the_default_selection() throws Exception {
    mvc.perform(get("/api/panels/summary/summary"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(2)));
  }

  @Test
  void unknown_race_is_a_bad_request() throws Exception {
    mvc.perform(get("/api/races/missing-race")).andExpect(status().isBadRequest());
  }
}
