package com.system.packsolver.schemas;

import lombok.*;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackingRequest {
    private List<ItemSchema> items;
    private List<Double> capacities;

    // Explicit rule set; when null the configured defaults are used if useDefaultSynergies is set
    private List<SynergyRuleSchema> synergies;
    private Boolean useDefaultSynergies;

    // BRANCH_AND_BOUND (default) or GREEDY
    private String algorithmType;

    // Optional overrides of the configured solver settings
    private Long timeBudgetMs;
    private Boolean greedyWarmStart;
}
