package lazor.planning.analysis;

import lazor.domain.Board;
import lazor.domain.Cell;
import lazor.domain.Configuration;
import lazor.domain.Point;
import lazor.planning.SearchConfig;
import lazor.simulation.Coverage;
import lazor.simulation.CoverageEvaluator;
import lazor.simulation.Trajectory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Pre-analyzes a board to decide the order in which slots are filled.
 * Computes per-slot criticality from the blockless trace and sorts slots so the
 * decisions most likely to change target coverage are made first.
 */
public class BoardAnalyzer {

    // ========== Analysis Result ==========

    public static class BoardFeatures {
        // Basic metrics
        public final int slotCount;
        public final int forbiddenCells;
        public final int fixedBlocks;
        public final int blocksAvailable;
        public final int lasers;
        public final int targets;

        /** Coverage with only the fixed blocks in place */
        public final Coverage fixedOnlyCoverage;

        /** Lasers passing each slot's border under the fixed-only trace, by slot index */
        public final int[] criticality;

        /** Minimum Manhattan distance from each slot's center to a target, by slot index */
        public final int[] targetDistance;

        /** Slot indices in search order */
        public final int[] slotOrder;

        public final String analysisReport;

        BoardFeatures(Board board, Coverage fixedOnlyCoverage, int[] criticality,
                      int[] targetDistance, int[] slotOrder, String report) {
            this.slotCount = board.getSlotCount();
            this.forbiddenCells = board.getWidth() * board.getHeight() - slotCount - board.countFixedBlocks();
            this.fixedBlocks = board.countFixedBlocks();
            this.blocksAvailable = board.getInventory().total();
            this.lasers = board.getLasers().size();
            this.targets = board.getTargets().size();
            this.fixedOnlyCoverage = fixedOnlyCoverage;
            this.criticality = criticality;
            this.targetDistance = targetDistance;
            this.slotOrder = slotOrder;
            this.analysisReport = report;
        }
    }

    // ========== Main Analysis Entry Point ==========

    /**
     * Analyzes the board and returns the slot order for a search.
     *
     * @param board the board
     * @param evaluator coverage evaluator of the collision model in use
     * @param seed 0 for the plain order, otherwise slots are shuffled inside small windows
     */
    public static BoardFeatures analyze(Board board, CoverageEvaluator evaluator, long seed) {
        Coverage fixedOnly = evaluator.evaluate(Configuration.fixedOnly(board));

        List<Cell> slots = board.getEmptyCells();
        int[] criticality = new int[slots.size()];
        int[] distance = new int[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            Cell cell = slots.get(i);
            criticality[i] = computeCriticality(cell, fixedOnly.getTrajectories());
            distance[i] = nearestTargetDistance(cell, board.getTargets());
        }

        int[] order = orderSlots(criticality, distance, seed);
        String report = generateReport(board, fixedOnly, criticality, distance, order, seed);
        if (SearchConfig.isVerbose()) {
            System.err.println(report);
        }
        return new BoardFeatures(board, fixedOnly, criticality, distance, order, report);
    }

    // ========== Slot Scoring ==========

    /**
     * Counts the lasers whose blockless path touches the border of the cell.
     * A block there can only interact with beams that reach its border.
     */
    static int computeCriticality(Cell cell, List<Trajectory> trajectories) {
        List<Point> border = cell.borderPoints();
        int count = 0;
        for (Trajectory trajectory : trajectories) {
            for (Point p : border) {
                if (trajectory.contains(p)) {
                    count++;
                    break;
                }
            }
        }
        return count;
    }

    static int nearestTargetDistance(Cell cell, List<Point> targets) {
        Point center = cell.center();
        int best = targets.isEmpty() ? 0 : Integer.MAX_VALUE;
        for (Point target : targets) {
            best = Math.min(best, center.manhattanDistance(target));
        }
        return best;
    }

    /**
     * Sorts slots by criticality descending, then target distance ascending,
     * then slot index. A non-zero seed shuffles the sorted order within
     * consecutive windows, which keeps the coarse ordering intact.
     */
    static int[] orderSlots(int[] criticality, int[] distance, long seed) {
        List<Integer> order = new ArrayList<>(criticality.length);
        for (int i = 0; i < criticality.length; i++) {
            order.add(i);
        }
        order.sort(Comparator.<Integer>comparingInt(i -> -criticality[i])
                .thenComparingInt(i -> distance[i])
                .thenComparingInt(i -> i));

        if (seed != 0) {
            Random random = new Random(seed);
            int window = SearchConfig.SLOT_SHUFFLE_WINDOW;
            for (int start = 0; start < order.size(); start += window) {
                Collections.shuffle(order.subList(start, Math.min(start + window, order.size())), random);
            }
        }
        return order.stream().mapToInt(Integer::intValue).toArray();
    }

    // ========== Report ==========

    private static String generateReport(Board board, Coverage fixedOnly, int[] criticality,
                                         int[] distance, int[] order, long seed) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n========== BOARD ANALYSIS ==========\n");
        sb.append(String.format("Board: %s (%dx%d)\n", board.getName(), board.getWidth(), board.getHeight()));
        sb.append(String.format("Slots: %d, Fixed blocks: %d, Inventory: %s\n",
                board.getSlotCount(), board.countFixedBlocks(), board.getInventory()));
        sb.append(String.format("Lasers: %d, Targets: %d, Hit without movable blocks: %d\n",
                board.getLasers().size(), board.getTargets().size(), fixedOnly.getHitCount()));
        sb.append("Slot order (seed ").append(seed).append("):\n");
        List<Cell> slots = board.getEmptyCells();
        for (int slot : order) {
            sb.append(String.format("  %s criticality=%d distance=%d\n",
                    slots.get(slot), criticality[slot], distance[slot]));
        }
        sb.append("====================================");
        return sb.toString();
    }
}
