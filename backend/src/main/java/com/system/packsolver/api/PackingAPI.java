package com.system.packsolver.api;

import com.system.packsolver.bll.controller.PackingController;
import com.system.packsolver.schemas.GeneratedInstanceRequest;
import com.system.packsolver.schemas.PackingRequest;
import com.system.packsolver.schemas.PackingResultSchema;
import com.system.packsolver.schemas.SynergyRuleSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/packing")
@RequiredArgsConstructor
public class PackingAPI {

  private final PackingController packingController;

  /**
   * Solve a packing instance
   * POST /api/packing/solve
   *
   * Request body example:
   * {
   *   "items": [
   *     { "id": 0, "name": "Laptop", "weight": 2, "value": 2000, "category": "ELECTRONICS" },
   *     { "id": 1, "name": "Charger", "weight": 1, "value": 50, "category": "ELECTRONICS" }
   *   ],
   *   "capacities": [5],
   *   "synergies": [ { "items": ["Laptop", "Charger"], "bonus": 200 } ],
   *   "algorithmType": "BRANCH_AND_BOUND"
   * }
   *
   * Leave "synergies" out and set "useDefaultSynergies": true to use the configured table.
   */
  @PostMapping("/solve")
  public ResponseEntity<PackingResultSchema> solve(@RequestBody PackingRequest request) {
    return respond(packingController.executePacking(request));
  }

  /**
   * Same as /solve with the greedy heuristic (fast, not optimal)
   * POST /api/packing/solve/greedy
   */
  @PostMapping("/solve/greedy")
  public ResponseEntity<PackingResultSchema> solveGreedy(@RequestBody PackingRequest request) {
    return respond(packingController.executeGreedy(request));
  }

  /**
   * Generate a seeded random instance and solve it
   * POST /api/packing/demo
   *
   * Request body example:
   * {
   *   "itemCount": 15,
   *   "containerCount": 2,
   *   "capacity": 10,
   *   "seed": 42
   * }
   */
  @PostMapping("/demo")
  public ResponseEntity<PackingResultSchema> demo(
      @RequestBody(required = false) GeneratedInstanceRequest request) {
    if (request == null) {
      request = new GeneratedInstanceRequest();
    }
    return respond(packingController.executeDemo(request));
  }

  /**
   * Default synergy table
   * GET /api/packing/synergies
   */
  @GetMapping("/synergies")
  public ResponseEntity<List<SynergyRuleSchema>> getSynergies() {
    return ResponseEntity.ok(packingController.getDefaultSynergies());
  }

  private ResponseEntity<PackingResultSchema> respond(PackingResultSchema result) {
    if (Boolean.TRUE.equals(result.getSuccess())) {
      return ResponseEntity.ok(result);
    } else {
      return ResponseEntity.internalServerError().body(result);
    }
  }
}
