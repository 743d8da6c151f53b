package lazor.simulation;

import lazor.domain.BlockType;
import lazor.domain.Configuration;
import lazor.domain.Direction;

/**
 * Wall convention: a unit move runs from the cell behind the beam into the
 * cell ahead of it, both found from the half-step points on either side of
 * the current point. A change of column means a vertical edge is crossed,
 * a change of row a horizontal one; both at once means the beam enters the
 * cell through its corner and a reflection flips both components.
 */
public class WallRayTracer extends AbstractRayTracer {

    @Override
    public CollisionModel getCollisionModel() {
        return CollisionModel.WALL;
    }

    @Override
    protected Obstruction findObstruction(Configuration configuration, int x, int y, Direction d) {
        // Work in quarter-cell units so the half-step points stay integral
        int colAhead = Math.floorDiv(2 * x + d.dx, 4);
        int colBehind = Math.floorDiv(2 * x - d.dx, 4);
        int rowAhead = Math.floorDiv(2 * y + d.dy, 4);
        int rowBehind = Math.floorDiv(2 * y - d.dy, 4);

        boolean crossesVertical = colAhead != colBehind;
        boolean crossesHorizontal = rowAhead != rowBehind;
        if (!crossesVertical && !crossesHorizontal) {
            return null;
        }

        BlockType block = blockAt(configuration, colAhead, rowAhead);
        if (block == null) {
            return null;
        }
        return new Obstruction(block, crossesVertical, crossesHorizontal);
    }
}
