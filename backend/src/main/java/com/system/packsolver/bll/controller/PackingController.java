package com.system.packsolver.bll.controller;

import com.system.packsolver.bll.adapter.SynergyCatalogAdapter;
import com.system.packsolver.bll.service.ItemGeneratorService;
import com.system.packsolver.config.Constants;
import com.system.packsolver.config.PackingProperties;
import com.system.packsolver.schemas.*;
import com.system.packsolver.schemas.algorithm.BranchAndBound.BranchAndBoundSolver;
import com.system.packsolver.schemas.algorithm.BranchAndBound.SearchBudget;
import com.system.packsolver.schemas.algorithm.BranchAndBound.SolverOptions;
import com.system.packsolver.schemas.algorithm.Greedy.GreedyPacker;
import com.system.packsolver.schemas.algorithm.Input.InvalidPackingInputException;
import com.system.packsolver.schemas.algorithm.Input.PackingInstance;
import com.system.packsolver.schemas.algorithm.Input.SynergyTable;
import com.system.packsolver.schemas.algorithm.Output.AssignmentResult;
import com.system.packsolver.schemas.algorithm.Output.SolutionAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class PackingController {

  private final SynergyCatalogAdapter synergyCatalogAdapter;
  private final ItemGeneratorService itemGeneratorService;
  private final PackingProperties packingProperties;

  private final GreedyPacker greedyPacker = new GreedyPacker();
  private final SolutionAggregator solutionAggregator = new SolutionAggregator();

  /**
   * Validate the request, run the selected algorithm and wrap the aggregated solution.
   * Invalid input is thrown before any search starts; failures during the run are reported
   * as an unsuccessful result.
   */
  public PackingResultSchema executePacking(PackingRequest request) {
    return executePacking(request, resolveAlgorithmType(request.getAlgorithmType()));
  }

  /**
   * Same as {@link #executePacking(PackingRequest)} with the greedy heuristic, whatever the request asks for.
   */
  public PackingResultSchema executeGreedy(PackingRequest request) {
    return executePacking(request, Constants.ALGORITHM_GREEDY);
  }

  private PackingResultSchema executePacking(PackingRequest request, String algorithmType) {
    LocalDateTime startTime = LocalDateTime.now();
    long startNanos = System.nanoTime();

    SynergyTable synergyTable = synergyCatalogAdapter.resolve(request);
    PackingInstance instance = PackingInstance.of(request.getItems(), request.getCapacities(), synergyTable);

    try {
      SolutionSchema solution = solve(instance, algorithmType, buildOptions(request));
      LocalDateTime endTime = LocalDateTime.now();
      long runtimeMs = (System.nanoTime() - startNanos) / 1_000_000;
      solution.setRuntimeMs(runtimeMs);

      int assigned = (int) solution.getAssignment().stream()
          .filter(container -> container != Constants.UNASSIGNED)
          .count();
      int unassigned = instance.itemCount() - assigned;

      log.info("{} finished in {} ms: total value {}, {}/{} items packed",
          algorithmType, runtimeMs, solution.getTotalValue(), assigned, instance.itemCount());

      return PackingResultSchema.builder()
          .success(true)
          .message(buildMessage(algorithmType, solution, unassigned))
          .algorithmType(algorithmType)
          .executionStartTime(startTime)
          .executionEndTime(endTime)
          .runtimeMs(runtimeMs)
          .totalItems(instance.itemCount())
          .assignedItems(assigned)
          .unassignedItems(unassigned)
          .solution(solution)
          .build();

    } catch (RuntimeException e) {
      log.error("Packing execution failed for {}", instance.describe(), e);
      return PackingResultSchema.builder()
          .success(false)
          .message("Packing execution failed: " + e.getMessage())
          .algorithmType(algorithmType)
          .executionStartTime(startTime)
          .executionEndTime(LocalDateTime.now())
          .runtimeMs((System.nanoTime() - startNanos) / 1_000_000)
          .totalItems(instance.itemCount())
          .build();
    }
  }

  /**
   * Generate a seeded demo instance and solve it with the default synergy table.
   */
  public PackingResultSchema executeDemo(GeneratedInstanceRequest request) {
    return executePacking(itemGeneratorService.generateInstance(request));
  }

  public List<SynergyRuleSchema> getDefaultSynergies() {
    return synergyCatalogAdapter.getDefaultRules();
  }

  /**
   * Run one algorithm on a validated instance. {@code runtimeMs} is left for the caller to set.
   */
  public SolutionSchema solve(PackingInstance instance, String algorithmType, SolverOptions options) {
    AssignmentResult result;
    switch (algorithmType) {
      case Constants.ALGORITHM_GREEDY:
        result = greedyPacker.solve(instance);
        break;
      case Constants.ALGORITHM_BRANCH_AND_BOUND:
      default:
        result = new BranchAndBoundSolver(instance, options).solve();
        break;
    }
    return solutionAggregator.aggregate(instance, result);
  }

  private SolverOptions buildOptions(PackingRequest request) {
    PackingProperties.Solver solver = packingProperties.getSolver();

    boolean warmStart = request.getGreedyWarmStart() != null ?
        request.getGreedyWarmStart() : solver.isGreedyWarmStart();
    long timeBudgetMs = request.getTimeBudgetMs() != null ?
        request.getTimeBudgetMs() : solver.getTimeBudgetMs();

    return SolverOptions.builder()
        .synergySlackRatio(solver.getSynergySlackRatio())
        .greedyWarmStart(warmStart)
        .budget(SearchBudget.ofMillis(timeBudgetMs))
        .build();
  }

  private String resolveAlgorithmType(String requested) {
    if (requested == null || requested.isBlank()) {
      return Constants.DEFAULT_ALGORITHM;
    }
    String algorithmType = requested.trim().toUpperCase(Locale.ROOT);
    if (!algorithmType.equals(Constants.ALGORITHM_BRANCH_AND_BOUND)
        && !algorithmType.equals(Constants.ALGORITHM_GREEDY)) {
      throw new InvalidPackingInputException("Unknown algorithm type: " + requested);
    }
    return algorithmType;
  }

  private String buildMessage(String algorithmType, SolutionSchema solution, int unassigned) {
    StringBuilder message = new StringBuilder(algorithmType).append(" executed successfully");
    message.append(unassigned > 0 ?
        " (" + unassigned + " items left out)" :
        " (all items packed)");
    if (!Boolean.TRUE.equals(solution.getComplete())) {
      message.append("; time budget reached, best solution found so far returned");
    }
    return message.toString();
  }
}
