package com.system.packsolver.schemas.algorithm.BranchAndBound;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class SearchStatistics {
    private long nodesExplored;
    private long leavesScored;
    private long boundPrunes;
    private long exclusionsSkipped;
    private long improvements;

    void nodeEntered() {
        nodesExplored++;
    }

    void leafScored() {
        leavesScored++;
    }

    void pruned() {
        boundPrunes++;
    }

    void exclusionSkipped() {
        exclusionsSkipped++;
    }

    void improved() {
        improvements++;
    }
}
