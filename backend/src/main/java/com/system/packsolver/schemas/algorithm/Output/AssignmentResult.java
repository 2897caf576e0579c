package com.system.packsolver.schemas.algorithm.Output;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Raw outcome of an algorithm run, before aggregation.
 * {@code sortedAssignment} follows the instance's ratio-sorted item order.
 */
@Getter
@AllArgsConstructor
public class AssignmentResult {
    private final int[] sortedAssignment;
    private final double totalValue;
    private final boolean complete;
    private final long nodesExplored;
}
