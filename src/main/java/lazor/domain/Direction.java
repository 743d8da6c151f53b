package lazor.domain;

/**
 * Enum representing the four diagonal directions a beam can travel.
 * Each direction has associated x and y deltas on the doubled lattice.
 * y grows downward, matching the row order of board files.
 */
public enum Direction {
    /** Up and to the left */
    UP_LEFT(-1, -1),

    /** Up and to the right */
    UP_RIGHT(1, -1),

    /** Down and to the left */
    DOWN_LEFT(-1, 1),

    /** Down and to the right */
    DOWN_RIGHT(1, 1);

    /** x delta when moving in this direction */
    public final int dx;

    /** y delta when moving in this direction */
    public final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    /**
     * Returns the direction with the selected components inverted.
     *
     * @param flipX invert the horizontal component
     * @param flipY invert the vertical component
     * @return the deflected direction
     */
    public Direction flip(boolean flipX, boolean flipY) {
        return of(flipX ? -dx : dx, flipY ? -dy : dy);
    }

    /**
     * Returns the opposite direction.
     *
     * @return the direction with both components inverted
     */
    public Direction opposite() {
        return flip(true, true);
    }

    /**
     * Looks up the direction for a delta pair.
     *
     * @param dx horizontal delta, -1 or +1
     * @param dy vertical delta, -1 or +1
     * @return the corresponding Direction
     * @throws IllegalArgumentException if the pair is not diagonal
     */
    public static Direction of(int dx, int dy) {
        if (dx == -1 && dy == -1) return UP_LEFT;
        if (dx == 1 && dy == -1) return UP_RIGHT;
        if (dx == -1 && dy == 1) return DOWN_LEFT;
        if (dx == 1 && dy == 1) return DOWN_RIGHT;
        throw new IllegalArgumentException("Not a diagonal direction: (" + dx + "," + dy + ")");
    }
}
