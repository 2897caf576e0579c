package com.system.packsolver.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
public class PackingAPITest {

  @Autowired
  private MockMvc mockMvc;

  @Test
  public void testSolve() throws Exception {
    String body = """
        {
          "items": [
            { "id": 0, "name": "a", "weight": 2, "value": 100 },
            { "id": 1, "name": "b", "weight": 3, "value": 200 },
            { "id": 2, "name": "c", "weight": 1, "value": 50 }
          ],
          "capacities": [5]
        }
        """;

    mockMvc.perform(post("/api/packing/solve").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.solution.totalValue").value(300.0))
        .andExpect(jsonPath("$.solution.universeCount").value(8))
        .andExpect(jsonPath("$.solution.assignment[2]").value(-1))
        .andExpect(jsonPath("$.solution.containers[0].items.length()").value(2));
  }

  @Test
  public void testSolveWithSynergy() throws Exception {
    String body = """
        {
          "items": [
            { "id": 0, "name": "Laptop", "weight": 2, "value": 2000, "category": "ELECTRONICS" },
            { "id": 1, "name": "Charger", "weight": 1, "value": 50, "category": "ELECTRONICS" }
          ],
          "capacities": [5],
          "synergies": [ { "items": ["Laptop", "Charger"], "bonus": 200 } ]
        }
        """;

    mockMvc.perform(post("/api/packing/solve").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.solution.totalValue").value(2250.0))
        .andExpect(jsonPath("$.solution.containers[0].synergyBonus").value(200.0));
  }

  @Test
  public void testZeroContainersIsBadRequest() throws Exception {
    String body = """
        {
          "items": [ { "id": 0, "name": "a", "weight": 1, "value": 10 } ],
          "capacities": []
        }
        """;

    mockMvc.perform(post("/api/packing/solve").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.error").value("invalid_configuration"));
  }

  @Test
  public void testNegativeWeightIsBadRequest() throws Exception {
    String body = """
        {
          "items": [ { "id": 0, "name": "a", "weight": -1, "value": 10 } ],
          "capacities": [5]
        }
        """;

    mockMvc.perform(post("/api/packing/solve").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_input"));
  }

  @Test
  public void testGreedyEndpoint() throws Exception {
    String body = """
        {
          "items": [ { "id": 0, "name": "anvil", "weight": 10, "value": 100 } ],
          "capacities": [5]
        }
        """;

    mockMvc.perform(post("/api/packing/solve/greedy").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.algorithmType").value("GREEDY"))
        .andExpect(jsonPath("$.solution.totalValue").value(0.0))
        .andExpect(jsonPath("$.unassignedItems").value(1));
  }

  @Test
  public void testDemoEndpoint() throws Exception {
    mockMvc.perform(post("/api/packing/demo").contentType(MediaType.APPLICATION_JSON)
            .content("{ \"itemCount\": 10, \"containerCount\": 2, \"capacity\": 8, \"seed\": 3 }"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalItems").value(10))
        .andExpect(jsonPath("$.solution.containers.length()").value(2));
  }

  @Test
  public void testDefaultSynergies() throws Exception {
    mockMvc.perform(get("/api/packing/synergies"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(9))
        .andExpect(jsonPath("$[0].bonus").value(200.0));
  }
}
