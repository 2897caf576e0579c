package com.system.packsolver.config;

import com.system.packsolver.schemas.SynergyRuleSchema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings under {@code packing.*} in application.yml.
 * Defaults fall back to {@link Constants} when a key is absent.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "packing")
public class PackingProperties {

    /** Default synergy table used when a request does not bring its own rules. */
    private List<SynergyRuleSchema> synergies = new ArrayList<>();

    private Solver solver = new Solver();

    private Generator generator = new Generator();

    @Getter
    @Setter
    public static class Solver {
        /** Share of the total synergy bonus added to every bound. */
        private double synergySlackRatio = Constants.SYNERGY_SLACK_RATIO;

        /** Seed the search with the greedy packing. */
        private boolean greedyWarmStart = Constants.USE_GREEDY_WARM_START;

        /** Stop the search after this many milliseconds; 0 disables the budget. */
        private long timeBudgetMs = Constants.DEFAULT_TIME_BUDGET_MS;
    }

    @Getter
    @Setter
    public static class Generator {
        private int defaultItemCount = Constants.DEFAULT_GENERATED_ITEMS;
        private int maxItemCount = Constants.MAX_GENERATED_ITEMS;
        private int defaultContainerCount = Constants.DEFAULT_GENERATED_CONTAINERS;
        private int maxContainerCount = Constants.MAX_GENERATED_CONTAINERS;
        private double defaultCapacity = Constants.DEFAULT_GENERATED_CAPACITY;
    }
}
