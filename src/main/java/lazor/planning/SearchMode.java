package lazor.planning;

/**
 * Which search driver produced a solution.
 */
public enum SearchMode {
    /** One placement search with a single seed */
    SINGLE,
    /** Several seeded searches run concurrently, best result kept */
    MULTI_SEED
}
