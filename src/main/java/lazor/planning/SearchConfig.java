package lazor.planning;

import lazor.simulation.CollisionModel;

import java.util.Arrays;

/**
 * Configuration for the placement search and the multi-seed explorer.
 * Centralizes all configurable parameters to avoid hardcoding.
 */
public class SearchConfig {

    /** Default per-board time limit (3 minutes) */
    public static final long DEFAULT_TIMEOUT_MS = 180_000;

    /** No node cap: the time limit alone bounds the search */
    public static final long UNLIMITED_NODES = Long.MAX_VALUE;

    /** Deadline and cancellation are checked every N node expansions */
    public static final int DEFAULT_TIME_CHECK_INTERVAL = 256;

    /** Share of the time limit granted to the full-inventory attempt when subset plans follow */
    public static final double DEFAULT_FULL_INVENTORY_FRACTION = 0.5;

    /** Seeds tried by the multi-seed explorer */
    public static final int[] DEFAULT_SEEDS = {0, 1, 2, 3, 5, 7, 11, 13};

    /** Block-type order is swapped for one in this many nodes when a seed is set */
    public static final int TYPE_ORDER_PERTURBATION = 4;

    /** Slots are shuffled within consecutive windows of this size when a seed is set */
    public static final int SLOT_SHUFFLE_WINDOW = 4;

    /** Extra wait for explorer workers past the deadline, covering one time-check interval */
    public static final long WORKER_GRACE_MS = 250;

    // ========== Logging Configuration ==========

    /**
     * Log level for controlling output verbosity.
     * 0 = SILENT (no output except critical errors)
     * 1 = MINIMAL (final result per board, strategy start/stop)
     * 2 = NORMAL (+ subset plan progress, worker completions)
     * 3 = VERBOSE (+ slot ordering, analysis reports, node counters)
     * Overridden by the LAZOR_LOG_LEVEL environment variable.
     */
    public static final int LOG_LEVEL = readLogLevel();

    /** Helper method to check if verbose logging is enabled */
    public static boolean isVerbose() { return LOG_LEVEL >= 3; }

    /** Helper method to check if normal logging is enabled */
    public static boolean isNormal() { return LOG_LEVEL >= 2; }

    /** Helper method to check if minimal logging is enabled */
    public static boolean isMinimal() { return LOG_LEVEL >= 1; }

    private static int readLogLevel() {
        String value = System.getenv("LAZOR_LOG_LEVEL");
        if (value == null || value.isBlank()) {
            return 1;
        }
        try {
            return Math.max(0, Math.min(3, Integer.parseInt(value.trim())));
        } catch (NumberFormatException e) {
            System.err.println("[Config] Ignoring invalid LAZOR_LOG_LEVEL '" + value + "'");
            return 1;
        }
    }

    // Instance configuration
    private long timeoutMs = DEFAULT_TIMEOUT_MS;
    private long maxNodes = UNLIMITED_NODES;
    private int timeCheckInterval = DEFAULT_TIME_CHECK_INTERVAL;
    private double fullInventoryFraction = DEFAULT_FULL_INVENTORY_FRACTION;
    private CollisionModel collisionModel = CollisionModel.WALL;
    private long seed = 0;
    private int[] seeds = DEFAULT_SEEDS.clone();
    private int workers = 0;
    private boolean parallel = false;

    public SearchConfig() {}

    public SearchConfig(long timeoutMs, CollisionModel collisionModel) {
        setTimeoutMs(timeoutMs);
        setCollisionModel(collisionModel);
    }

    /**
     * Creates a SearchConfig with default values.
     * Factory method for cleaner API.
     */
    public static SearchConfig defaults() {
        return new SearchConfig();
    }

    /**
     * @return {@code start + timeoutMs}, or {@code Long.MAX_VALUE} when that would overflow
     */
    public static long deadlineAfter(long start, long timeoutMs) {
        return timeoutMs > Long.MAX_VALUE - start ? Long.MAX_VALUE : start + timeoutMs;
    }

    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("Time limit must not be negative: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    public long getMaxNodes() { return maxNodes; }
    public void setMaxNodes(long maxNodes) {
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("Node cap must be positive: " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    public int getTimeCheckInterval() { return timeCheckInterval; }
    public void setTimeCheckInterval(int timeCheckInterval) {
        if (timeCheckInterval <= 0) {
            throw new IllegalArgumentException("Time check interval must be positive: " + timeCheckInterval);
        }
        this.timeCheckInterval = timeCheckInterval;
    }

    public double getFullInventoryFraction() { return fullInventoryFraction; }
    public void setFullInventoryFraction(double fullInventoryFraction) {
        if (fullInventoryFraction <= 0 || fullInventoryFraction > 1) {
            throw new IllegalArgumentException("Full inventory fraction must be in (0, 1]: " + fullInventoryFraction);
        }
        this.fullInventoryFraction = fullInventoryFraction;
    }

    public CollisionModel getCollisionModel() { return collisionModel; }
    public void setCollisionModel(CollisionModel collisionModel) {
        if (collisionModel == null) {
            throw new IllegalArgumentException("Collision model is required");
        }
        this.collisionModel = collisionModel;
    }

    public long getSeed() { return seed; }
    public void setSeed(long seed) { this.seed = seed; }

    public int[] getSeeds() { return seeds.clone(); }
    public void setSeeds(int[] seeds) {
        if (seeds == null || seeds.length == 0) {
            throw new IllegalArgumentException("At least one seed is required");
        }
        this.seeds = seeds.clone();
    }

    /**
     * @return worker thread count; 0 until set means min(seeds, available processors)
     */
    public int getWorkers() {
        if (workers > 0) return workers;
        return Math.max(1, Math.min(seeds.length, Runtime.getRuntime().availableProcessors()));
    }
    public void setWorkers(int workers) {
        if (workers < 0) {
            throw new IllegalArgumentException("Worker count must not be negative: " + workers);
        }
        this.workers = workers;
    }

    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }

    @Override
    public String toString() {
        return "SearchConfig{timeout=" + timeoutMs + "ms, maxNodes="
                + (maxNodes == UNLIMITED_NODES ? "unlimited" : String.valueOf(maxNodes))
                + ", collision=" + collisionModel + ", seed=" + seed
                + ", seeds=" + Arrays.toString(seeds) + ", parallel=" + parallel + "}";
    }
}
