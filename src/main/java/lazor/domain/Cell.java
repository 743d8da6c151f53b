package lazor.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable unit cell of the board, addressed by column and row (0,0 is top-left).
 */
public final class Cell {

    public final int col;
    public final int row;

    public Cell(int col, int row) {
        this.col = col;
        this.row = row;
    }

    public static Cell of(int col, int row) {
        return new Cell(col, row);
    }

    /**
     * @return the lattice point at the center of this cell
     */
    public Point center() {
        return new Point(2 * col + 1, 2 * row + 1);
    }

    /**
     * Returns the eight lattice points on the border of this cell:
     * four corners and four edge midpoints.
     *
     * @return border points, row by row
     */
    public List<Point> borderPoints() {
        Point c = center();
        List<Point> points = new ArrayList<>(8);
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                if (dx != 0 || dy != 0) {
                    points.add(new Point(c.x + dx, c.y + dy));
                }
            }
        }
        return points;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Cell cell = (Cell) obj;
        return col == cell.col && row == cell.row;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return "[" + col + "," + row + "]";
    }
}
