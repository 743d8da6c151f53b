package lazor.simulation;

import lazor.domain.BlockType;
import lazor.domain.Direction;

/**
 * A block met by the next unit move of a beam, with the velocity components
 * a reflection off it would invert.
 */
final class Obstruction {

    final BlockType block;
    final boolean flipX;
    final boolean flipY;

    Obstruction(BlockType block, boolean flipX, boolean flipY) {
        this.block = block;
        this.flipX = flipX;
        this.flipY = flipY;
    }

    /**
     * @return the direction a beam leaves with when reflected by this obstruction
     */
    Direction reflect(Direction incoming) {
        return incoming.flip(flipX, flipY);
    }
}
