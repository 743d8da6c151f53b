package lazor.planning;

import lazor.domain.Board;
import lazor.domain.BlockType;
import lazor.domain.Cell;
import lazor.domain.Point;
import lazor.simulation.CollisionModel;
import lazor.simulation.Coverage;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a search: the final placement of movable blocks, the coverage it
 * produces, and how the result was obtained. Immutable.
 */
public final class Solution {

    /**
     * Orders results best first: solved before unsolved, more targets hit,
     * shorter elapsed time, lower seed.
     */
    public static final Comparator<Solution> BEST_FIRST =
            Comparator.comparing((Solution s) -> !s.solved)
                    .thenComparing(Comparator.comparingInt(Solution::getHitCount).reversed())
                    .thenComparingLong(Solution::getElapsedMs)
                    .thenComparingLong(Solution::getSeed);

    private final Board board;
    private final Map<Cell, BlockType> placement;
    private final Coverage coverage;
    private final boolean solved;
    private final long elapsedMs;
    private final long seed;
    private final CollisionModel collisionModel;
    private final SearchMode searchMode;
    private final long nodesExpanded;

    public Solution(Board board, Map<Cell, BlockType> placement, Coverage coverage, boolean solved,
                    long elapsedMs, long seed, CollisionModel collisionModel, SearchMode searchMode,
                    long nodesExpanded) {
        this.board = board;
        this.placement = Collections.unmodifiableMap(new LinkedHashMap<>(placement));
        this.coverage = coverage;
        this.solved = solved;
        this.elapsedMs = elapsedMs;
        this.seed = seed;
        this.collisionModel = collisionModel;
        this.searchMode = searchMode;
        this.nodesExpanded = nodesExpanded;
    }

    /**
     * @return a copy of this result attributed to another search mode
     */
    public Solution withSearchMode(SearchMode mode) {
        return new Solution(board, placement, coverage, solved, elapsedMs, seed, collisionModel, mode, nodesExpanded);
    }

    public Board getBoard() {
        return board;
    }

    /**
     * @return movable blocks placed, keyed by cell in slot order (fixed blocks are never included)
     */
    public Map<Cell, BlockType> getPlacement() {
        return placement;
    }

    /**
     * @return the movable block placed at the cell, or null
     */
    public BlockType getPlacedBlock(Cell cell) {
        return placement.get(cell);
    }

    public Coverage getCoverage() {
        return coverage;
    }

    /**
     * @return hit status per target, in target declaration order
     */
    public Map<Point, Boolean> getTargetHits() {
        return coverage.getTargetHits();
    }

    public int getHitCount() {
        return coverage.getHitCount();
    }

    public int getTargetCount() {
        return coverage.getTargetCount();
    }

    public boolean isSolved() {
        return solved;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public long getSeed() {
        return seed;
    }

    public CollisionModel getCollisionModel() {
        return collisionModel;
    }

    public SearchMode getSearchMode() {
        return searchMode;
    }

    public long getNodesExpanded() {
        return nodesExpanded;
    }

    public int getBlocksUsed() {
        return placement.size();
    }

    @Override
    public String toString() {
        return "Solution{" + (solved ? "solved" : "unsolved")
                + ", hits=" + getHitCount() + "/" + getTargetCount()
                + ", blocks=" + placement.size()
                + ", elapsed=" + elapsedMs + "ms, seed=" + seed
                + ", " + collisionModel + "/" + searchMode + "}";
    }
}
