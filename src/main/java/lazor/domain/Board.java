package lazor.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents the static (unchanging) description of a puzzle board.
 * This includes the cell layout, fixed blocks, the movable block inventory,
 * the lasers and the target points.
 *
 * The board uses two coordinate systems:
 * - Cells are addressed as (col, row), 0-indexed from the top-left
 * - Lasers and targets live on the doubled lattice, x in [0, 2*width], y in [0, 2*height]
 *
 * Instances are validated on construction and never change afterwards, so one
 * board can be shared by any number of concurrent searches.
 */
public class Board {

    /** Board name, usually the file name */
    private final String name;

    /** Number of cell columns */
    private final int width;

    /** Number of cell rows */
    private final int height;

    /** Cell classification, kinds[row][col] */
    private final CellKind[][] kinds;

    /** Fixed block types, null where the cell is not FIXED */
    private final BlockType[][] fixedBlocks;

    /**
     * Index of each EMPTY cell in {@link #emptyCells}, -1 for other cells.
     * This is the slot numbering used by {@link Placement}.
     */
    private final int[][] slotIndex;

    /** EMPTY cells in row-major order. Immutable. */
    private final List<Cell> emptyCells;

    private final Inventory inventory;

    /** Immutable */
    private final List<Laser> lasers;

    /** Immutable, in declaration order */
    private final List<Point> targets;

    /**
     * Creates a new Board.
     *
     * @param name board name
     * @param width number of cell columns
     * @param height number of cell rows
     * @param kinds cell classification, kinds[row][col] (will be copied)
     * @param fixedBlocks block type of each FIXED cell, fixedBlocks[row][col] (will be copied)
     * @param inventory movable blocks available
     * @param lasers laser sources
     * @param targets points every solution must light
     * @throws IllegalArgumentException if the description is inconsistent
     */
    public Board(String name, int width, int height,
                 CellKind[][] kinds, BlockType[][] fixedBlocks,
                 Inventory inventory, List<Laser> lasers, List<Point> targets) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Board dimensions must be positive: " + width + "x" + height);
        }
        if (kinds == null || kinds.length != height) {
            throw new IllegalArgumentException("Expected " + height + " rows of cell kinds");
        }
        if (inventory == null || lasers == null || targets == null) {
            throw new IllegalArgumentException("Inventory, lasers and targets are required");
        }
        this.name = name;
        this.width = width;
        this.height = height;
        this.kinds = new CellKind[height][width];
        this.fixedBlocks = new BlockType[height][width];
        this.slotIndex = new int[height][width];

        List<Cell> empties = new ArrayList<>();
        for (int r = 0; r < height; r++) {
            if (kinds[r] == null || kinds[r].length != width) {
                throw new IllegalArgumentException("Row " + r + " does not have " + width + " cells");
            }
            for (int c = 0; c < width; c++) {
                CellKind kind = kinds[r][c];
                if (kind == null) {
                    throw new IllegalArgumentException("Missing cell kind at " + Cell.of(c, r));
                }
                this.kinds[r][c] = kind;
                this.slotIndex[r][c] = -1;
                if (kind == CellKind.FIXED) {
                    BlockType type = fixedBlocks == null || fixedBlocks[r] == null ? null : fixedBlocks[r][c];
                    if (type == null) {
                        throw new IllegalArgumentException("Fixed cell " + Cell.of(c, r) + " has no block type");
                    }
                    this.fixedBlocks[r][c] = type;
                } else if (kind == CellKind.EMPTY) {
                    this.slotIndex[r][c] = empties.size();
                    empties.add(Cell.of(c, r));
                }
            }
        }
        this.emptyCells = Collections.unmodifiableList(empties);

        if (inventory.total() > emptyCells.size()) {
            throw new IllegalArgumentException("Inventory " + inventory + " holds " + inventory.total()
                    + " blocks but the board has only " + emptyCells.size() + " empty cells");
        }
        this.inventory = inventory;

        for (Laser laser : lasers) {
            if (!isOnLattice(laser.origin)) {
                throw new IllegalArgumentException("Laser origin outside the lattice: " + laser);
            }
        }
        for (Point target : targets) {
            if (!isOnLattice(target)) {
                throw new IllegalArgumentException("Target outside the lattice: " + target);
            }
        }
        this.lasers = List.copyOf(lasers);
        this.targets = List.copyOf(targets);
    }

    /**
     * Builds a board from grid rows written the way board files write them:
     * whitespace-separated symbols, {@code o} empty, {@code x} forbidden,
     * {@code A}/{@code B}/{@code C} fixed blocks.
     *
     * @throws IllegalArgumentException on unknown symbols or ragged rows
     */
    public static Board fromRows(String name, List<String> rows, Inventory inventory,
                                 List<Laser> lasers, List<Point> targets) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("No grid rows");
        }
        int height = rows.size();
        int width = rows.get(0).trim().split("\\s+").length;
        CellKind[][] kinds = new CellKind[height][];
        BlockType[][] fixed = new BlockType[height][width];
        for (int r = 0; r < height; r++) {
            String[] tokens = rows.get(r).trim().split("\\s+");
            if (tokens.length != width) {
                throw new IllegalArgumentException("Inconsistent grid row length at row " + r
                        + ": expected " + width + ", got " + tokens.length);
            }
            kinds[r] = new CellKind[width];
            for (int c = 0; c < width; c++) {
                String token = tokens[c];
                if (token.length() != 1) {
                    throw new IllegalArgumentException("Unknown grid token '" + token + "'");
                }
                char symbol = token.charAt(0);
                switch (symbol) {
                    case 'o' -> kinds[r][c] = CellKind.EMPTY;
                    case 'x' -> kinds[r][c] = CellKind.FORBIDDEN;
                    default -> {
                        kinds[r][c] = CellKind.FIXED;
                        fixed[r][c] = BlockType.fromSymbol(symbol);
                    }
                }
            }
        }
        return new Board(name, width, height, kinds, fixed, inventory, lasers, targets);
    }

    /**
     * @return the board name
     */
    public String getName() {
        return name;
    }

    /**
     * @return number of cell columns
     */
    public int getWidth() {
        return width;
    }

    /**
     * @return number of cell rows
     */
    public int getHeight() {
        return height;
    }

    /**
     * @return number of lattice columns (2 * width + 1)
     */
    public int getLatticeWidth() {
        return 2 * width + 1;
    }

    /**
     * @return number of lattice rows (2 * height + 1)
     */
    public int getLatticeHeight() {
        return 2 * height + 1;
    }

    /**
     * Checks if a cell address lies on the board.
     */
    public boolean isInside(int col, int row) {
        return col >= 0 && col < width && row >= 0 && row < height;
    }

    /**
     * Checks if a point lies within the lattice of this board.
     */
    public boolean isOnLattice(Point p) {
        return p.x >= 0 && p.x <= 2 * width && p.y >= 0 && p.y <= 2 * height;
    }

    /**
     * Gets the classification of a cell.
     *
     * @throws IndexOutOfBoundsException if the cell is not on the board
     */
    public CellKind getKind(int col, int row) {
        return kinds[row][col];
    }

    /**
     * Gets the fixed block at a cell.
     *
     * @return the block type, or null if the cell is off the board or not FIXED
     */
    public BlockType getFixedBlock(int col, int row) {
        if (!isInside(col, row)) {
            return null;
        }
        return fixedBlocks[row][col];
    }

    /**
     * Gets the slot number of an EMPTY cell.
     *
     * @return the slot index, or -1 if the cell is off the board or not EMPTY
     */
    public int getSlotIndex(int col, int row) {
        if (!isInside(col, row)) {
            return -1;
        }
        return slotIndex[row][col];
    }

    /**
     * @return EMPTY cells in row-major order; position in the list is the slot index
     */
    public List<Cell> getEmptyCells() {
        return emptyCells;
    }

    public int getSlotCount() {
        return emptyCells.size();
    }

    public Inventory getInventory() {
        return inventory;
    }

    public List<Laser> getLasers() {
        return lasers;
    }

    public List<Point> getTargets() {
        return targets;
    }

    /**
     * @return number of FIXED cells
     */
    public int countFixedBlocks() {
        int count = 0;
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                if (kinds[r][c] == CellKind.FIXED) count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "Board{name='" + name + "', " + width + "x" + height
                + ", slots=" + emptyCells.size() + ", inventory=" + inventory
                + ", lasers=" + lasers.size() + ", targets=" + targets.size() + "}";
    }
}
