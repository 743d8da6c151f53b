package lazor.planning;

import lazor.domain.Board;

/**
 * Strategy interface for placement search drivers.
 *
 * Implementations:
 * - PlacementSearch: single-threaded backtracking with one seed
 * - MultiSeedExplorer: several PlacementSearch runs in parallel, best result wins
 */
public interface SearchStrategy {

    /**
     * Searches for a placement that lights every target of the board.
     * Never returns null: when no full solution is found in budget the
     * best partial result is returned with {@code solved = false}.
     *
     * @param board the board to solve
     * @return the solution, full or partial
     */
    Solution search(Board board);

    /**
     * @return the name of this strategy (for logging)
     */
    String getName();

    /**
     * Sets the maximum time allowed for search in milliseconds.
     *
     * @param timeoutMs maximum search time
     */
    void setTimeout(long timeoutMs);

    /**
     * Sets the maximum number of search nodes to expand.
     *
     * @param maxNodes maximum nodes
     */
    void setMaxNodes(long maxNodes);
}
