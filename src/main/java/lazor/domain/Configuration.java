package lazor.domain;

/**
 * A complete physical layout: the board's fixed blocks plus a placement.
 * This is the view the ray tracer reads; it reflects later changes to the placement.
 */
public class Configuration {

    private final Board board;
    private final Placement placement;

    /**
     * @param board the board
     * @param placement movable blocks, or null for fixed blocks only
     */
    public Configuration(Board board, Placement placement) {
        if (placement != null && placement.getBoard() != board) {
            throw new IllegalArgumentException("Placement belongs to a different board");
        }
        this.board = board;
        this.placement = placement;
    }

    /**
     * Configuration holding only the fixed blocks.
     */
    public static Configuration fixedOnly(Board board) {
        return new Configuration(board, null);
    }

    /**
     * Gets the block occupying a cell.
     *
     * @return the fixed or placed block, or null if the cell is open or off the board
     */
    public BlockType blockAt(int col, int row) {
        if (!board.isInside(col, row)) {
            return null;
        }
        BlockType fixed = board.getFixedBlock(col, row);
        if (fixed != null) {
            return fixed;
        }
        if (placement == null) {
            return null;
        }
        int slot = board.getSlotIndex(col, row);
        return slot < 0 ? null : placement.get(slot);
    }

    public Board getBoard() {
        return board;
    }

    public Placement getPlacement() {
        return placement;
    }
}
