package lazor.simulation;

import lazor.domain.Board;
import lazor.domain.BlockType;
import lazor.domain.Configuration;
import lazor.domain.Direction;
import lazor.domain.Laser;
import lazor.domain.Point;
import lazor.domain.RayState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;

/**
 * Beam propagation shared by both collision conventions.
 *
 * Active beams are kept on an explicit stack rather than in recursion, so long
 * Refract chains cannot grow the call stack. One visited bitmap over
 * (point, direction) states is shared by all beams of the laser: a beam that
 * reaches a state already seen would only retrace known points, so it stops
 * there. That bounds the work by 4 * (2W+1) * (2H+1) states per laser.
 *
 * Subclasses only decide which block, if any, the next unit move meets.
 */
abstract class AbstractRayTracer implements RayTracer {

    private static final int DIRECTIONS = Direction.values().length;

    /**
     * Finds the block the move from (x, y) along {@code d} runs into.
     *
     * @return the obstruction, or null if the move enters no block
     */
    protected abstract Obstruction findObstruction(Configuration configuration, int x, int y, Direction d);

    @Override
    public Trajectory trace(Configuration configuration, Laser laser) {
        Board board = configuration.getBoard();
        int latticeWidth = board.getLatticeWidth();
        boolean[] visited = new boolean[latticeWidth * board.getLatticeHeight() * DIRECTIONS];

        LinkedHashSet<Point> points = new LinkedHashSet<>();
        points.add(laser.origin);
        Deque<RayState> active = new ArrayDeque<>();
        active.push(new RayState(laser.origin, laser.direction));

        int forks = 0;
        int absorbed = 0;
        int cycles = 0;

        while (!active.isEmpty()) {
            RayState ray = active.pop();
            Point p = ray.position;
            Direction d = ray.direction;

            while (true) {
                int state = (p.y * latticeWidth + p.x) * DIRECTIONS + d.ordinal();
                if (visited[state]) {
                    cycles++;
                    break;
                }
                visited[state] = true;

                Obstruction hit = findObstruction(configuration, p.x, p.y, d);
                if (hit == null) {
                    p = p.step(d);
                    points.add(p);
                    continue;
                }

                boolean alive = switch (hit.block) {
                    case OPAQUE -> false;
                    case REFLECT -> {
                        // re-evaluated at the same point on the next pass
                        d = hit.reflect(d);
                        yield true;
                    }
                    case REFRACT -> {
                        forks++;
                        active.push(new RayState(p, hit.reflect(d)));
                        p = p.step(d);
                        points.add(p);
                        yield true;
                    }
                };
                if (!alive) {
                    absorbed++;
                    break;
                }
            }
        }
        return new Trajectory(laser, points, forks, absorbed, cycles);
    }

    /**
     * Block seen by a beam at a cell address. Cells beyond the border act as
     * Reflect blocks, so beams never leave the board.
     */
    protected static BlockType blockAt(Configuration configuration, int col, int row) {
        if (!configuration.getBoard().isInside(col, row)) {
            return BlockType.REFLECT;
        }
        return configuration.blockAt(col, row);
    }
}
