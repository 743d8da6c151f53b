package lazor.domain;

/**
 * A laser source: an origin lattice point and a diagonal direction.
 */
public final class Laser {

    public final Point origin;
    public final Direction direction;

    public Laser(Point origin, Direction direction) {
        if (origin == null || direction == null) {
            throw new IllegalArgumentException("Laser needs an origin and a direction");
        }
        this.origin = origin;
        this.direction = direction;
    }

    /**
     * Creates a laser from the four integers of a board file line.
     *
     * @throws IllegalArgumentException if (vx, vy) is not diagonal
     */
    public static Laser of(int x, int y, int vx, int vy) {
        return new Laser(new Point(x, y), Direction.of(vx, vy));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Laser laser = (Laser) obj;
        return origin.equals(laser.origin) && direction == laser.direction;
    }

    @Override
    public int hashCode() {
        return 31 * origin.hashCode() + direction.hashCode();
    }

    @Override
    public String toString() {
        return "Laser{" + origin + " " + direction.dx + "," + direction.dy + "}";
    }
}
