package lazor.planning;

import lazor.domain.Board;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one {@link PlacementSearch} per seed concurrently and keeps the best result.
 *
 * Workers share only the immutable board, one cancellation flag and one best
 * result slot. The first worker to solve the board raises the flag; the others
 * notice it at their next time check and return what they have. If nobody
 * solves the board by the deadline, the partial results are ranked by
 * {@link Solution#BEST_FIRST}.
 */
public class MultiSeedExplorer implements SearchStrategy {

    private final SearchConfig config;
    private long timeoutMs;
    private long maxNodes;
    private int[] seeds;

    public MultiSeedExplorer(SearchConfig config) {
        this.config = config;
        this.timeoutMs = config.getTimeoutMs();
        this.maxNodes = config.getMaxNodes();
        this.seeds = config.getSeeds();
    }

    @Override
    public String getName() {
        return "Multi-Seed Explorer " + Arrays.toString(seeds);
    }

    @Override
    public void setTimeout(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    @Override
    public void setMaxNodes(long maxNodes) {
        this.maxNodes = maxNodes;
    }

    public void setSeeds(int[] seeds) {
        if (seeds == null || seeds.length == 0) {
            throw new IllegalArgumentException("At least one seed is required");
        }
        this.seeds = seeds.clone();
    }

    @Override
    public Solution search(Board board) {
        long startTime = System.currentTimeMillis();
        long deadline = SearchConfig.deadlineAfter(startTime, timeoutMs);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        AtomicReference<Solution> best = new AtomicReference<>();

        int threads = Math.max(1, Math.min(seeds.length, config.getWorkers()));
        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "lazor-seed-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        if (SearchConfig.isMinimal()) {
            System.err.println("[Explorer] " + board.getName() + ": " + seeds.length + " seeds on "
                    + threads + " threads, timeout=" + timeoutMs + "ms");
        }

        List<Future<Solution>> futures = new ArrayList<>(seeds.length);
        try {
            for (int seed : seeds) {
                futures.add(pool.submit(() -> runWorker(board, seed, deadline, cancelled, best)));
            }

            List<Solution> results = new ArrayList<>(seeds.length);
            for (int i = 0; i < futures.size(); i++) {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                long wait = SearchConfig.deadlineAfter(remaining, SearchConfig.WORKER_GRACE_MS);
                try {
                    Solution result = futures.get(i).get(wait, TimeUnit.MILLISECONDS);
                    if (result != null) {
                        results.add(result);
                    }
                } catch (ExecutionException e) {
                    System.err.println("[Explorer] Worker for seed " + seeds[i] + " failed: " + e.getCause());
                    e.getCause().printStackTrace(System.err);
                } catch (TimeoutException e) {
                    System.err.println("[Explorer] Worker for seed " + seeds[i] + " did not stop in time");
                    cancelled.set(true);
                }
            }

            Solution winner = results.stream().min(Solution.BEST_FIRST).orElse(best.get());
            return finish(board, winner, startTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            System.err.println("[Explorer] Interrupted, returning best result so far");
            return finish(board, best.get(), startTime);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Runs one seeded search with whatever time is left when the worker starts.
     */
    private Solution runWorker(Board board, int seed, long deadline,
                               AtomicBoolean cancelled, AtomicReference<Solution> best) {
        if (cancelled.get()) {
            return null;
        }
        PlacementSearch search = new PlacementSearch(config);
        search.setSeed(seed);
        search.setTimeout(Math.max(0, deadline - System.currentTimeMillis()));
        search.setMaxNodes(maxNodes);
        search.setCancellationFlag(cancelled);

        Solution result = search.search(board);
        best.accumulateAndGet(result, (current, candidate) ->
                current == null || Solution.BEST_FIRST.compare(candidate, current) < 0 ? candidate : current);
        if (result.isSolved()) {
            cancelled.set(true);
        }
        if (SearchConfig.isNormal()) {
            System.err.println("[Explorer]   seed " + seed + ": " + (result.isSolved() ? "SOLVED" : "partial")
                    + " hits " + result.getHitCount() + "/" + result.getTargetCount()
                    + " (" + result.getElapsedMs() + "ms, " + result.getNodesExpanded() + " nodes)");
        }
        return result;
    }

    private Solution finish(Board board, Solution winner, long startTime) {
        if (winner == null) {
            // Every worker failed or was skipped; fall back to a seed 0 search with no time left
            PlacementSearch fallback = new PlacementSearch(config);
            fallback.setSeed(0);
            fallback.setTimeout(0);
            winner = fallback.search(board);
        }
        Solution result = winner.withSearchMode(SearchMode.MULTI_SEED);
        if (SearchConfig.isMinimal()) {
            System.err.println("[Explorer] " + board.getName() + ": " + (result.isSolved() ? "SOLVED" : "unsolved")
                    + " by seed " + result.getSeed() + " in " + (System.currentTimeMillis() - startTime) + "ms");
        }
        return result;
    }
}
