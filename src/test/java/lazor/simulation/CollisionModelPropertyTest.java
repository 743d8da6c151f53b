package lazor.simulation;

import lazor.domain.Board;
import lazor.domain.BlockType;
import lazor.domain.CellKind;
import lazor.domain.Configuration;
import lazor.domain.Direction;
import lazor.domain.Inventory;
import lazor.domain.Laser;
import lazor.domain.Point;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cross-checks the two collision conventions and the tracer contract on random boards.
 */
class CollisionModelPropertyTest {

    /** Random board with one laser */
    static class Scenario {
        final Board board;
        final Laser laser;

        Scenario(int width, int height, List<String> symbols, int x, int y, Direction direction) {
            List<String> rows = new ArrayList<>();
            for (int r = 0; r < height; r++) {
                rows.add(String.join(" ", symbols.subList(r * width, (r + 1) * width)));
            }
            this.laser = new Laser(Point.of(x, y), direction);
            this.board = Board.fromRows("random", rows, Inventory.empty(), List.of(laser), List.of());
        }

        @Override
        public String toString() {
            return board + " " + laser;
        }
    }

    @Provide
    Arbitrary<Scenario> scenarios() {
        return Arbitraries.integers().between(1, 5).flatMap(w ->
                Arbitraries.integers().between(1, 5).flatMap(h ->
                        Combinators.combine(
                                Arbitraries.of("o", "x", "A", "B", "C").list().ofSize(w * h),
                                Arbitraries.integers().between(0, 2 * w),
                                Arbitraries.integers().between(0, 2 * h),
                                Arbitraries.of(Direction.class))
                                .as((cells, x, y, d) -> new Scenario(w, h, cells, x, y, d))));
    }

    @Property(tries = 500)
    @Label("wall and center conventions trace identical trajectories")
    void conventionsAgree(@ForAll("scenarios") Scenario s) {
        Configuration configuration = Configuration.fixedOnly(s.board);
        Trajectory wall = new WallRayTracer().trace(configuration, s.laser);
        Trajectory center = new CenterRayTracer().trace(configuration, s.laser);

        assertEquals(wall.toList(), center.toList());
        assertEquals(wall.getRaysSpawned(), center.getRaysSpawned());
        assertEquals(wall.getAbsorbed(), center.getAbsorbed());
    }

    @Property(tries = 300)
    @Label("tracing is a pure function of configuration and laser")
    void tracingIsDeterministic(@ForAll("scenarios") Scenario s) {
        Configuration configuration = Configuration.fixedOnly(s.board);
        RayTracer tracer = new WallRayTracer();

        assertEquals(tracer.trace(configuration, s.laser), tracer.trace(configuration, s.laser));
    }

    @Property(tries = 300)
    @Label("every beam is accounted for and every point lies on the lattice")
    void beamsTerminateOnTheBoard(@ForAll("scenarios") Scenario s) {
        Trajectory t = new WallRayTracer().trace(Configuration.fixedOnly(s.board), s.laser);

        assertEquals(t.getRaysSpawned(), t.getAbsorbed() + t.getCycleTerminations());
        assertTrue(t.contains(s.laser.origin));
        for (Point p : t.getPoints()) {
            assertTrue(s.board.isOnLattice(p), "off-lattice point " + p);
        }
    }

    @Property(tries = 300)
    @Label("a target counts as hit only when its exact point is lit")
    void hitsAreExact(@ForAll("scenarios") Scenario s) {
        List<Point> targets = new ArrayList<>();
        for (int x = 0; x < s.board.getLatticeWidth(); x++) {
            for (int y = 0; y < s.board.getLatticeHeight(); y++) {
                targets.add(Point.of(x, y));
            }
        }
        Board withTargets = new Board(s.board.getName(), s.board.getWidth(), s.board.getHeight(),
                kinds(s.board), fixed(s.board), Inventory.empty(), s.board.getLasers(), targets);

        CoverageEvaluator evaluator = new CoverageEvaluator(CollisionModel.WALL);
        Coverage coverage = evaluator.evaluate(Configuration.fixedOnly(withTargets));
        Trajectory t = coverage.getTrajectories().get(0);

        int lit = 0;
        for (Point target : targets) {
            assertEquals(t.contains(target), coverage.getTargetHits().get(target), "target " + target);
            if (t.contains(target)) lit++;
        }
        assertEquals(lit, coverage.getHitCount());
        assertEquals(t.size(), coverage.getHitCount());
    }

    private static CellKind[][] kinds(Board board) {
        CellKind[][] kinds = new CellKind[board.getHeight()][board.getWidth()];
        for (int r = 0; r < board.getHeight(); r++) {
            for (int c = 0; c < board.getWidth(); c++) {
                kinds[r][c] = board.getKind(c, r);
            }
        }
        return kinds;
    }

    private static BlockType[][] fixed(Board board) {
        BlockType[][] fixed = new BlockType[board.getHeight()][board.getWidth()];
        for (int r = 0; r < board.getHeight(); r++) {
            for (int c = 0; c < board.getWidth(); c++) {
                fixed[r][c] = board.getFixedBlock(c, r);
            }
        }
        return fixed;
    }
}
