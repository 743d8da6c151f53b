package lazor.simulation;

import lazor.domain.BlockType;
import lazor.domain.Configuration;
import lazor.domain.Direction;

/**
 * Center convention: block centers sit on odd-odd points, so each even
 * coordinate of the beam points at a center one step along the direction
 * and each odd coordinate is already level with it. The components where
 * the beam's coordinate is even are the ones a reflection inverts.
 * A beam on an odd-odd point is inside a cell and meets nothing.
 */
public class CenterRayTracer extends AbstractRayTracer {

    @Override
    public CollisionModel getCollisionModel() {
        return CollisionModel.CENTER;
    }

    @Override
    protected Obstruction findObstruction(Configuration configuration, int x, int y, Direction d) {
        boolean evenX = (x & 1) == 0;
        boolean evenY = (y & 1) == 0;
        if (!evenX && !evenY) {
            return null;
        }

        int centerX = evenX ? x + d.dx : x;
        int centerY = evenY ? y + d.dy : y;
        BlockType block = blockAt(configuration, Math.floorDiv(centerX - 1, 2), Math.floorDiv(centerY - 1, 2));
        if (block == null) {
            return null;
        }
        return new Obstruction(block, evenX, evenY);
    }
}
