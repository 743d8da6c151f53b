package lazor.planning;

import lazor.domain.Board;
import lazor.domain.BlockType;
import lazor.domain.Configuration;
import lazor.domain.Inventory;
import lazor.domain.Placement;
import lazor.planning.analysis.BoardAnalyzer;
import lazor.planning.analysis.BoardAnalyzer.BoardFeatures;
import lazor.planning.heuristic.BlockOrderHeuristic;
import lazor.simulation.Coverage;
import lazor.simulation.CoverageEvaluator;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Backtracking search over block-to-slot assignments.
 *
 * The search walks the slots in the order chosen by {@link BoardAnalyzer}; at
 * each slot it either places one of the block types still available or leaves
 * the slot empty. Blocks of one type are interchangeable, so branching is over
 * which slots receive a type, never over which block goes where.
 *
 * Inventory plans come from {@link InventorySubsets}: the full inventory first
 * (with a share of the time limit when more plans follow), then smaller
 * sub-vectors until one is solved or the budget is gone. Every node is
 * evaluated and the search stops at the first configuration lighting every
 * target, even if part of the plan is still unplaced. Otherwise the
 * configuration lighting the most targets is kept so a partial result can be
 * returned on timeout.
 *
 * One instance runs one search at a time; it is not thread-safe.
 */
public class PlacementSearch implements SearchStrategy {

    /** Why the current descent stopped early */
    private enum StopReason {
        NONE,
        /** The current plan's share of the budget ran out; later plans may still run */
        PLAN_DEADLINE,
        DEADLINE,
        NODE_LIMIT,
        CANCELLED
    }

    private final SearchConfig config;
    private long timeoutMs;
    private long maxNodes;
    private long seed;
    private AtomicBoolean cancelled;

    // Per-run state
    private Board board;
    private Placement placement;
    private Configuration configuration;
    private CoverageEvaluator evaluator;
    private BlockOrderHeuristic typeOrder;
    private int[] slotOrder;
    private long nodes;
    private long deadline;
    private long planDeadline;
    private StopReason stopReason;

    // Best configuration seen so far (ties keep the earlier discovery)
    private Placement bestPlacement;
    private Coverage bestCoverage;

    // Set when a plan is solved
    private Placement foundPlacement;
    private Coverage foundCoverage;

    public PlacementSearch(SearchConfig config) {
        this.config = config;
        this.timeoutMs = config.getTimeoutMs();
        this.maxNodes = config.getMaxNodes();
        this.seed = config.getSeed();
    }

    @Override
    public String getName() {
        return "Placement Search (seed " + seed + ")";
    }

    @Override
    public void setTimeout(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void setMaxNodes(long maxNodes) {
        this.maxNodes = maxNodes;
    }

    /**
     * Sets the seed perturbing slot and block-type order; 0 keeps the plain order.
     */
    public void setSeed(long seed) {
        this.seed = seed;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Sets a flag shared with other searches; once raised, this search stops at
     * its next time check and returns its best result.
     */
    public void setCancellationFlag(AtomicBoolean cancelled) {
        this.cancelled = cancelled;
    }

    /**
     * @return nodes expanded by the last search
     */
    public long getNodesExpanded() {
        return nodes;
    }

    @Override
    public Solution search(Board board) {
        long startTime = System.currentTimeMillis();
        this.board = board;
        this.placement = new Placement(board);
        this.configuration = new Configuration(board, placement);
        this.evaluator = new CoverageEvaluator(config.getCollisionModel());
        this.typeOrder = new BlockOrderHeuristic(seed);
        this.nodes = 0;
        this.deadline = SearchConfig.deadlineAfter(startTime, timeoutMs);
        this.stopReason = StopReason.NONE;
        this.bestPlacement = null;
        this.bestCoverage = null;
        this.foundPlacement = null;
        this.foundCoverage = null;

        // Step 1: Fixed blocks alone may already light everything
        Coverage baseline = evaluator.evaluate(configuration);
        recordBest(baseline);
        if (baseline.allHit()) {
            if (SearchConfig.isNormal()) {
                System.err.println("[Search] " + board.getName() + ": solved by fixed blocks alone");
            }
            return buildSolution(placement, baseline, true, startTime);
        }

        // Step 2: Slot ordering
        BoardFeatures features = BoardAnalyzer.analyze(board, evaluator, seed);
        this.slotOrder = features.slotOrder;

        // Step 3: Inventory plans, full inventory first
        List<Inventory> plans = InventorySubsets.plans(board.getInventory());
        if (SearchConfig.isNormal()) {
            System.err.println("[Search] " + board.getName() + " seed=" + seed + ": "
                    + plans.size() + " inventory plans, " + board.getSlotCount() + " slots, timeout="
                    + timeoutMs + "ms");
        }

        for (int i = 0; i < plans.size(); i++) {
            if (System.currentTimeMillis() >= deadline) {
                stopReason = StopReason.DEADLINE;
                break;
            }
            if (isCancelled()) {
                stopReason = StopReason.CANCELLED;
                break;
            }
            Inventory plan = plans.get(i);
            planDeadline = deadline;
            if (i == 0 && plans.size() > 1) {
                planDeadline = Math.min(deadline,
                        SearchConfig.deadlineAfter(startTime, (long) (timeoutMs * config.getFullInventoryFraction())));
            }
            stopReason = StopReason.NONE;

            long planStart = System.currentTimeMillis();
            long nodesBefore = nodes;
            boolean found = descend(0, plan.toArray(), plan.total(), null);

            if (SearchConfig.isVerbose()) {
                System.err.println("[Search]   plan " + plan + ": " + (found ? "SOLVED" : "no solution")
                        + " (" + (nodes - nodesBefore) + " nodes, "
                        + (System.currentTimeMillis() - planStart) + "ms"
                        + (stopReason != StopReason.NONE ? ", stopped: " + stopReason : "") + ")");
            }

            if (found) {
                if (SearchConfig.isNormal()) {
                    System.err.println("[Search] " + board.getName() + " seed=" + seed + ": solved with "
                            + foundPlacement.blockCount() + " blocks during plan " + plan + " after " + nodes + " nodes");
                }
                return buildSolution(foundPlacement, foundCoverage, true, startTime);
            }
            if (stopReason != StopReason.NONE && stopReason != StopReason.PLAN_DEADLINE) {
                break;
            }
        }

        if (SearchConfig.isNormal()) {
            System.err.println("[Search] " + board.getName() + " seed=" + seed + ": no full solution ("
                    + (stopReason == StopReason.NONE ? "search space exhausted" : stopReason)
                    + "), best partial hits " + bestCoverage.getHitCount() + "/" + bestCoverage.getTargetCount());
        }
        return buildSolution(bestPlacement, bestCoverage, false, startTime);
    }

    /**
     * Expands one node: the slots before {@code pos} are decided.
     *
     * @param pos index into the slot order
     * @param remaining blocks of the plan left to place, by type ordinal
     * @param remainingTotal sum of {@code remaining}
     * @param inherited coverage of the current configuration when the parent
     *                  left a slot empty, null if it must be evaluated
     * @return true if the plan is solved below this node
     */
    private boolean descend(int pos, int[] remaining, int remainingTotal, Coverage inherited) {
        if (stopReason != StopReason.NONE) {
            return false;
        }
        nodes++;
        if (nodes > maxNodes) {
            stopReason = StopReason.NODE_LIMIT;
            return false;
        }
        if (nodes % config.getTimeCheckInterval() == 0 && checkBudget()) {
            return false;
        }

        Coverage coverage = inherited != null ? inherited : evaluator.evaluate(configuration);
        if (inherited == null) {
            recordBest(coverage);
            // Blocks left over may stay in the inventory
            if (coverage.allHit()) {
                foundPlacement = placement.snapshot();
                foundCoverage = coverage;
                return true;
            }
        }

        if (remainingTotal == 0) {
            return false;
        }

        int slotsLeft = slotOrder.length - pos;
        if (slotsLeft < remainingTotal) {
            return false;
        }

        int slot = slotOrder[pos];
        int unhit = coverage.getTargetCount() - coverage.getHitCount();
        for (BlockType type : typeOrder.order(remaining, unhit, coverage.getTargetCount())) {
            placement.assign(slot, type);
            remaining[type.ordinal()]--;
            boolean found = descend(pos + 1, remaining, remainingTotal - 1, null);
            remaining[type.ordinal()]++;
            placement.unassign(slot);
            if (found) {
                return true;
            }
            if (stopReason != StopReason.NONE) {
                return false;
            }
        }

        // Leave the slot empty; the configuration does not change
        if (slotsLeft - 1 >= remainingTotal) {
            return descend(pos + 1, remaining, remainingTotal, coverage);
        }
        return false;
    }

    /**
     * @return true if the search must unwind
     */
    private boolean checkBudget() {
        if (isCancelled()) {
            stopReason = StopReason.CANCELLED;
            return true;
        }
        long now = System.currentTimeMillis();
        if (now >= deadline) {
            stopReason = StopReason.DEADLINE;
            return true;
        }
        if (now >= planDeadline) {
            stopReason = StopReason.PLAN_DEADLINE;
            return true;
        }
        if (SearchConfig.isVerbose() && nodes % (config.getTimeCheckInterval() * 4096L) == 0) {
            System.err.println("[Search]   " + nodes + " nodes, best hits " + bestCoverage.getHitCount()
                    + "/" + bestCoverage.getTargetCount());
        }
        return false;
    }

    private boolean isCancelled() {
        return cancelled != null && cancelled.get();
    }

    private void recordBest(Coverage coverage) {
        if (bestCoverage == null || coverage.getHitCount() > bestCoverage.getHitCount()) {
            bestCoverage = coverage;
            bestPlacement = placement.snapshot();
        }
    }

    private Solution buildSolution(Placement result, Coverage coverage, boolean solved, long startTime) {
        long elapsed = System.currentTimeMillis() - startTime;
        return new Solution(board, result.toMap(), coverage, solved, elapsed, seed,
                config.getCollisionModel(), SearchMode.SINGLE, nodes);
    }
}
