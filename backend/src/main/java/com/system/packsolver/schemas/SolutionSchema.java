package com.system.packsolver.schemas;

import lombok.*;
import java.math.BigInteger;
import java.util.List;

/**
 * Structured result of one solve call.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolutionSchema {
    private List<ContainerResultSchema> containers;
    private Double totalValue;

    // (containers + 1)^items, size of the raw search space (informational)
    private BigInteger universeCount;

    // Wall-clock time measured by the caller around the solve
    private Long runtimeMs;

    // Original item index -> container index, or -1 when the item is left out
    private List<Integer> assignment;

    // false when a search budget stopped the search before every branch was explored
    private Boolean complete;
    private Long nodesExplored;
}
