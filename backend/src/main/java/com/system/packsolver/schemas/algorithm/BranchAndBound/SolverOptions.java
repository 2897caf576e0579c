package com.system.packsolver.schemas.algorithm.BranchAndBound;

import com.system.packsolver.config.Constants;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SolverOptions {
    @Builder.Default
    private final double synergySlackRatio = Constants.SYNERGY_SLACK_RATIO;

    @Builder.Default
    private final boolean greedyWarmStart = Constants.USE_GREEDY_WARM_START;

    @Builder.Default
    private final SearchBudget budget = SearchBudget.unlimited();

    public static SolverOptions defaults() {
        return SolverOptions.builder().build();
    }
}
