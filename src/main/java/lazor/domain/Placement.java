package lazor.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable assignment of movable blocks to the EMPTY cells of a board.
 *
 * Slots are addressed by the board's slot index, so assign/unassign are O(1)
 * array writes and backtracking undoes exactly what it did. Per-type usage is
 * tracked so a placement can never exceed the board's inventory.
 *
 * Not thread-safe: every search owns its own instance.
 */
public class Placement {

    private final Board board;

    /** Block per slot, null where unassigned */
    private final BlockType[] assigned;

    /** Blocks in use, indexed by BlockType ordinal */
    private final int[] used;

    private int blockCount;

    /**
     * Creates an empty placement for a board.
     */
    public Placement(Board board) {
        this.board = board;
        this.assigned = new BlockType[board.getSlotCount()];
        this.used = new int[BlockType.values().length];
    }

    private Placement(Placement other) {
        this.board = other.board;
        this.assigned = Arrays.copyOf(other.assigned, other.assigned.length);
        this.used = Arrays.copyOf(other.used, other.used.length);
        this.blockCount = other.blockCount;
    }

    /**
     * Builds a placement from a cell map, e.g. one reported in a Solution.
     *
     * @throws IllegalArgumentException if a cell is not EMPTY on this board
     * @throws IllegalStateException if the map exceeds the inventory
     */
    public static Placement fromMap(Board board, Map<Cell, BlockType> blocks) {
        Placement placement = new Placement(board);
        for (Map.Entry<Cell, BlockType> e : blocks.entrySet()) {
            Cell cell = e.getKey();
            int slot = board.getSlotIndex(cell.col, cell.row);
            if (slot < 0) {
                throw new IllegalArgumentException("Cell " + cell + " is not an empty slot");
            }
            placement.assign(slot, e.getValue());
        }
        return placement;
    }

    /**
     * Places a block into a slot.
     *
     * @param slot slot index
     * @param type block type to place
     * @throws IllegalStateException if the slot is taken or the type is exhausted
     */
    public void assign(int slot, BlockType type) {
        if (assigned[slot] != null) {
            throw new IllegalStateException("Slot " + slot + " already holds " + assigned[slot]);
        }
        if (used[type.ordinal()] >= board.getInventory().get(type)) {
            throw new IllegalStateException("No " + type + " blocks left in inventory " + board.getInventory());
        }
        assigned[slot] = type;
        used[type.ordinal()]++;
        blockCount++;
    }

    /**
     * Removes the block from a slot; no-op if the slot is unassigned.
     */
    public void unassign(int slot) {
        BlockType type = assigned[slot];
        if (type == null) return;
        assigned[slot] = null;
        used[type.ordinal()]--;
        blockCount--;
    }

    /**
     * @return the block in the slot, or null if unassigned
     */
    public BlockType get(int slot) {
        return assigned[slot];
    }

    public int used(BlockType type) {
        return used[type.ordinal()];
    }

    /**
     * @return number of blocks currently placed
     */
    public int blockCount() {
        return blockCount;
    }

    public Board getBoard() {
        return board;
    }

    /**
     * @return an independent copy of this placement
     */
    public Placement snapshot() {
        return new Placement(this);
    }

    /**
     * @return placed blocks keyed by cell, in slot order (unmodifiable)
     */
    public Map<Cell, BlockType> toMap() {
        Map<Cell, BlockType> map = new LinkedHashMap<>();
        for (int i = 0; i < assigned.length; i++) {
            if (assigned[i] != null) {
                map.put(board.getEmptyCells().get(i), assigned[i]);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "Placement" + toMap();
    }
}
