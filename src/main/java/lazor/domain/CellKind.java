package lazor.domain;

/**
 * Classification of a unit cell of the board.
 */
public enum CellKind {
    /** Holds a block that never moves */
    FIXED,

    /** Open slot that may receive a movable block */
    EMPTY,

    /** No block may be placed here; beams pass through */
    FORBIDDEN
}
