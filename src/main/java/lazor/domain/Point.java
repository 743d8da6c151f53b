package lazor.domain;

/**
 * Immutable point on the doubled lattice of a board.
 * A board of W x H cells spans x in [0, 2W] and y in [0, 2H];
 * odd-odd points are cell centers, every other point lies on a cell edge or corner.
 */
public final class Point {

    /** Horizontal coordinate, growing rightward */
    public final int x;

    /** Vertical coordinate, growing downward */
    public final int y;

    public Point(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public static Point of(int x, int y) {
        return new Point(x, y);
    }

    /**
     * Returns the point one lattice unit away in the given direction.
     *
     * @param direction the direction to move
     * @return the neighbouring point
     */
    public Point step(Direction direction) {
        return new Point(x + direction.dx, y + direction.dy);
    }

    /**
     * Calculates the Manhattan distance from this point to another point.
     *
     * @param other the other point
     * @return |x1 - x2| + |y1 - y2|
     */
    public int manhattanDistance(Point other) {
        return Math.abs(this.x - other.x) + Math.abs(this.y - other.y);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Point point = (Point) obj;
        return x == point.x && y == point.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
