package com.system.packsolver.schemas.algorithm.BranchAndBound;

import com.system.packsolver.config.Constants;
import com.system.packsolver.schemas.algorithm.Greedy.GreedyPacker;
import com.system.packsolver.schemas.algorithm.Input.PackingInstance;
import com.system.packsolver.schemas.algorithm.Output.AssignmentEvaluator;
import com.system.packsolver.schemas.algorithm.Output.AssignmentResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.stream.IntStream;

/**
 * Depth-first branch and bound over per-item decisions.
 *
 * Items are visited in descending value/weight ratio. At each item the search first tries every
 * container that can still hold it, most remaining capacity first, then leaving it out. A node is
 * abandoned when its bound (packed value + fractional relaxation of the remaining items into the
 * pooled remaining capacity + synergy slack) is not above the best total found so far; the
 * leave-out branch is only tried while {@code bound - itemValue} is still above that best.
 *
 * The recursion is driven by an explicit stack of {@link SearchFrame}s, so deep item lists do not
 * depend on the thread's call-stack size. All state is local to one {@link #solve()} call.
 */
@Slf4j
public class BranchAndBoundSolver {

    private final PackingInstance instance;
    private final SolverOptions options;
    private final BoundEstimator boundEstimator;

    private SearchState state;
    private BestState best;
    private SearchStatistics statistics;

    public BranchAndBoundSolver(PackingInstance instance, SolverOptions options) {
        this.instance = instance;
        this.options = options != null ? options : SolverOptions.defaults();
        this.boundEstimator = new BoundEstimator(instance.getSynergyTable(), this.options.getSynergySlackRatio());
    }

    public AssignmentResult solve() {
        log.info("Branch and bound: {}", instance.describe());

        state = new SearchState(instance);
        best = initialBest();
        statistics = new SearchStatistics();

        boolean complete = true;
        Deque<SearchFrame> stack = new ArrayDeque<>();
        SearchFrame root = enter(0);
        if (root != null) {
            stack.push(root);
        }

        while (!stack.isEmpty()) {
            SearchFrame frame = stack.peek();
            frame.undoPlacement(state);

            if (options.getBudget().exhausted()) {
                complete = false;
                log.warn("Search budget exhausted after {} nodes, returning best value found so far ({})",
                    statistics.getNodesExplored(), best.getTotalValue());
                break;
            }

            if (frame.hasPendingContainer()) {
                int container = frame.containerOrder[frame.nextBranch++];
                frame.place(state, container);
                pushIfOpen(stack, enter(frame.cursor + 1));
                continue;
            }

            if (!frame.exclusionTried) {
                frame.exclusionTried = true;
                if (frame.bound - instance.value(frame.cursor) > best.getTotalValue()) {
                    state.leaveOut(frame.cursor);
                    pushIfOpen(stack, enter(frame.cursor + 1));
                    continue;
                }
                statistics.exclusionSkipped();
            }

            stack.pop();
        }

        log.info("Branch and bound finished: value={}, complete={}, nodes={}",
            best.getTotalValue(), complete, statistics.getNodesExplored());
        log.debug("Search statistics: {}", statistics);

        return new AssignmentResult(best.getAssignment(), best.getTotalValue(), complete,
            statistics.getNodesExplored());
    }

    public SearchStatistics getStatistics() {
        return statistics;
    }

    private BestState initialBest() {
        if (options.isGreedyWarmStart()) {
            int[] greedy = new GreedyPacker().pack(instance);
            double value = AssignmentEvaluator.totalValue(instance, greedy);
            log.debug("Greedy warm start value: {}", value);
            return new BestState(greedy, value);
        }
        int[] empty = new int[instance.itemCount()];
        Arrays.fill(empty, Constants.UNASSIGNED);
        return new BestState(empty, 0.0);
    }

    /**
     * Visits the node at {@code cursor}. Leaves are scored on the spot and pruned nodes are
     * dropped; both return {@code null}. Otherwise the new frame is returned.
     */
    private SearchFrame enter(int cursor) {
        statistics.nodeEntered();

        if (cursor == instance.itemCount()) {
            statistics.leafScored();
            double value = AssignmentEvaluator.totalValue(instance, state.assignment());
            if (best.offer(state.assignment(), value)) {
                statistics.improved();
                if (Constants.VERBOSE_LOGGING) {
                    log.debug("New best value {} at node {}", value, statistics.getNodesExplored());
                }
            }
            return null;
        }

        double bound = boundEstimator.bound(instance, cursor, state.pooledRemainingCapacity(), state.getBaseValue());
        if (bound <= best.getTotalValue()) {
            statistics.pruned();
            return null;
        }

        return new SearchFrame(cursor, bound, eligibleContainers(instance.weight(cursor)));
    }

    /**
     * Containers that can still hold {@code weight}, most remaining capacity first,
     * lower index first on ties.
     */
    private int[] eligibleContainers(double weight) {
        return IntStream.range(0, instance.containerCount())
            .filter(c -> state.fits(c, weight))
            .boxed()
            .sorted(Comparator.comparingDouble((Integer c) -> state.remainingCapacity(c)).reversed()
                .thenComparingInt(c -> c))
            .mapToInt(Integer::intValue)
            .toArray();
    }

    private static void pushIfOpen(Deque<SearchFrame> stack, SearchFrame frame) {
        if (frame != null) {
            stack.push(frame);
        }
    }
}
