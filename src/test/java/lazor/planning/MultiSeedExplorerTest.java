package lazor.planning;

import lazor.simulation.Coverage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MultiSeedExplorerTest {

    private static MultiSeedExplorer explorer(long timeoutMs, int... seeds) {
        SearchConfig config = Boards.config(timeoutMs);
        config.setSeeds(seeds);
        config.setWorkers(Math.min(seeds.length, 4));
        return new MultiSeedExplorer(config);
    }

    @Test
    @DisplayName("a parallel solution re-traces to exactly the recorded hit status")
    void parallelEquivalence() {
        Solution solution = explorer(30_000, 0, 1, 2, 3).search(Boards.fourLasers());

        assertTrue(solution.isSolved());
        assertEquals(SearchMode.MULTI_SEED, solution.getSearchMode());
        Coverage retraced = Boards.retrace(solution);
        assertEquals(solution.getTargetHits(), retraced.getTargetHits());
        assertTrue(retraced.allHit());
    }

    @Test
    void unboundedTimeLimit() {
        MultiSeedExplorer explorer = explorer(Long.MAX_VALUE, 0, 1);
        explorer.setMaxNodes(1_000_000);

        Solution solution = explorer.search(Boards.fourLasers());

        assertTrue(solution.isSolved());
        assertTrue(solution.getNodesExpanded() > 0);
    }

    @Test
    void solvesWithSurplusInventory() {
        Solution solution = explorer(30_000, 0, 5, 7).search(Boards.surplusInventory());

        assertTrue(solution.isSolved());
        assertTrue(Boards.retrace(solution).allHit());
    }

    @Test
    @DisplayName("without a full solution the best partial result is returned")
    void bestPartialWins() {
        Solution solution = explorer(30_000, 0, 1, 2).search(Boards.threeLasers());

        assertFalse(solution.isSolved());
        assertEquals(3, solution.getHitCount());
        assertEquals(solution.getTargetHits(), Boards.retrace(solution).getTargetHits());
    }

    @Test
    @DisplayName("all workers stop at the shared deadline")
    void budgetRespect() {
        long start = System.currentTimeMillis();
        Solution solution = explorer(300, 0, 1, 2, 3).search(Boards.hopeless());
        long elapsed = System.currentTimeMillis() - start;

        assertFalse(solution.isSolved());
        assertEquals(SearchMode.MULTI_SEED, solution.getSearchMode());
        assertTrue(elapsed < 300 + SearchConfig.WORKER_GRACE_MS + 1_500, "took " + elapsed + "ms");
    }

    @Test
    void singleSeedBehavesLikePlainSearch() {
        Solution parallel = explorer(30_000, 0).search(Boards.fourLasers());
        Solution single = new PlacementSearch(Boards.config(30_000)).search(Boards.fourLasers());

        assertEquals(single.getPlacement(), parallel.getPlacement());
        assertEquals(0, parallel.getSeed());
    }

    @Test
    void rejectsEmptySeedList() {
        MultiSeedExplorer explorer = explorer(1_000, 0);
        assertThrows(IllegalArgumentException.class, () -> explorer.setSeeds(new int[0]));
    }
}
