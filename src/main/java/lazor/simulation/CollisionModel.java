package lazor.simulation;

/**
 * The two interchangeable rules for detecting when a beam meets a block.
 */
public enum CollisionModel {

    /** Compares the cells on either side of each unit move to find the edge crossed. */
    WALL,

    /** Derives the touched cell and the flipped components from coordinate parity. */
    CENTER;

    /**
     * @return a tracer implementing this convention
     */
    public RayTracer createTracer() {
        return switch (this) {
            case WALL -> new WallRayTracer();
            case CENTER -> new CenterRayTracer();
        };
    }

    /**
     * Parses a collision model name (case-insensitive).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static CollisionModel fromString(String s) {
        return switch (s.trim().toLowerCase()) {
            case "wall" -> WALL;
            case "center", "centre" -> CENTER;
            default -> throw new IllegalArgumentException("Invalid collision model: " + s);
        };
    }
}
