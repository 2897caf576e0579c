package com.system.packsolver.config;

public class Constants {
    // Assignment marker for items left out of every container
    public static final int UNASSIGNED = -1;

    // Algorithm constants
    public static final String ALGORITHM_BRANCH_AND_BOUND = "BRANCH_AND_BOUND";
    public static final String ALGORITHM_GREEDY = "GREEDY";
    public static final String DEFAULT_ALGORITHM = ALGORITHM_BRANCH_AND_BOUND;

    // Share of the total synergy bonus added to every bound as an allowance for bonuses
    // the fractional relaxation cannot see
    public static final double SYNERGY_SLACK_RATIO = 0.3;

    // Seed the best-known solution with the greedy packing before searching
    public static final boolean USE_GREEDY_WARM_START = true;

    // 0 = no time budget, the search runs until every branch is explored or pruned
    public static final long DEFAULT_TIME_BUDGET_MS = 0L;

    // Demo instance generation
    public static final int DEFAULT_GENERATED_ITEMS = 15;
    public static final int MAX_GENERATED_ITEMS = 1000;
    public static final int DEFAULT_GENERATED_CONTAINERS = 1;
    public static final int MAX_GENERATED_CONTAINERS = 50;
    public static final double DEFAULT_GENERATED_CAPACITY = 10.0;

    // Value bands for generated items: 30% high, 40% medium, 30% low
    public static final double HIGH_VALUE_BAND = 0.3;
    public static final double MEDIUM_VALUE_BAND = 0.7;
    // Earlier items get a slightly better band draw
    public static final double POSITION_SKEW = 0.15;

    // Control de logs
    public static final boolean VERBOSE_LOGGING = false; // true = log every improvement of the best solution
}
