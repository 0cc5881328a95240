package com.factory.planner.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Planner REST endpoint")
class PlannerControllerTest {

    private static final String CATALOG = """
            {"resources": ["Iron Ore", "Iron Ingot", "Iron Plate"],
             "recipes": [
               {"name": "Smelt Iron", "tags": ["smelter"], "per_minute": 30.0,
                "rates": [["Iron Ore", -1.0], ["Iron Ingot", 1.0]]},
               {"name": "Press Plate", "tags": ["constructor"], "per_minute": 10.0,
                "rates": [["Iron Ingot", -3.0], ["Iron Plate", 2.0]]}]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Plans a chain and reports recipes, net flows and text")
    void testPlan() throws Exception {
        String body = """
                {"catalog": %s,
                 "rules": {"rules": [
                   {"Resource": {"resource": "Iron Ore", "constraint": {"Greater": -60.0}}},
                   {"Resource": {"resource": "Iron Plate", "constraint": "Unconstrained"}}]},
                 "optimizations": [{"kind": "Resource", "name": "Iron Plate", "coefficient": 1.0}]}
                """.formatted(CATALOG);

        mockMvc.perform(post("/api/v1/plan").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.feasible").value(true))
                .andExpect(jsonPath("$.status").value("Optimal"))
                .andExpect(jsonPath("$.recipes", hasSize(2)))
                .andExpect(jsonPath("$.recipes[0].recipe").value("Smelt Iron"))
                .andExpect(jsonPath("$.recipes[0].rate", closeTo(2.0, 1e-9)))
                .andExpect(jsonPath("$.recipes[1].recipe").value("Press Plate"))
                .andExpect(jsonPath("$.recipes[1].rate", closeTo(2.0, 1e-9)))
                .andExpect(jsonPath("$.netResources", hasSize(3)))
                .andExpect(jsonPath("$.netResources[2].resource").value("Iron Plate"))
                .andExpect(jsonPath("$.netResources[2].netRate", closeTo(40.0, 1e-6)))
                .andExpect(jsonPath("$.report", containsString("Iron Plate net 40.0 /min")));
    }

    @Test
    @DisplayName("Solver failures come back as an infeasible result")
    void testInfeasible() throws Exception {
        String body = """
                {"catalog": %s,
                 "rules": {"rules": [{"Resource": {"resource": "Iron Plate", "constraint": {"Equal": 10.0}}}]}}
                """.formatted(CATALOG);

        mockMvc.perform(post("/api/v1/plan").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.feasible").value(false))
                .andExpect(jsonPath("$.status").value("Infeasible"))
                .andExpect(jsonPath("$.recipes", hasSize(0)));
    }

    @Test
    @DisplayName("Excluded tags remove recipes before planning")
    void testExcludedTags() throws Exception {
        String body = """
                {"catalog": %s,
                 "rules": {"rules": [
                   {"Resource": {"resource": "Iron Ore", "constraint": {"Greater": -60.0}}},
                   {"Resource": {"resource": "Iron Ingot", "constraint": "Unconstrained"}}]},
                 "optimizations": [{"kind": "Resource", "name": "Iron Ingot", "coefficient": 1.0}],
                 "excludedTags": ["constructor"]}
                """.formatted(CATALOG);

        mockMvc.perform(post("/api/v1/plan").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recipes", hasSize(1)))
                .andExpect(jsonPath("$.recipes[0].recipe").value("Smelt Iron"))
                .andExpect(jsonPath("$.netResources", hasSize(2)));
    }

    @Test
    @DisplayName("Unknown names in the catalog document are unprocessable")
    void testUnknownResource() throws Exception {
        String body = """
                {"catalog": {"resources": ["Iron Ore"],
                             "recipes": [{"name": "Smelt Iron", "tags": [], "per_minute": 30.0,
                                          "rates": [["Iron Ore", -1.0], ["Iron Ingot", 1.0]]}]}}
                """;

        mockMvc.perform(post("/api/v1/plan").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("UNKNOWN_RESOURCE"));
    }

    @Test
    @DisplayName("A request without a catalog is a bad request")
    void testMissingCatalog() throws Exception {
        mockMvc.perform(post("/api/v1/plan").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
    }
}
