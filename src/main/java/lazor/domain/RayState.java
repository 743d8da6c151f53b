package lazor.domain;

/**
 * Position and direction of one active beam during tracing.
 */
public final class RayState {

    public final Point position;
    public final Direction direction;

    public RayState(Point position, Direction direction) {
        this.position = position;
        this.direction = direction;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        RayState other = (RayState) obj;
        return position.equals(other.position) && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return 31 * position.hashCode() + direction.ordinal();
    }

    @Override
    public String toString() {
        return position + "->" + direction;
    }
}
