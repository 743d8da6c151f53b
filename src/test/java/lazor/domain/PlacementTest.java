package lazor.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlacementTest {

    private Board board;
    private Placement placement;

    @BeforeEach
    void setUp() {
        board = Board.fromRows("placement", List.of("o o B", "o x o"), Inventory.of(2, 0, 1),
                List.of(Laser.of(0, 1, 1, 1)), List.of(Point.of(2, 2)));
        placement = new Placement(board);
    }

    @Test
    void assignAndUnassignTrackUsage() {
        placement.assign(0, BlockType.REFLECT);
        placement.assign(3, BlockType.REFRACT);

        assertEquals(BlockType.REFLECT, placement.get(0));
        assertEquals(1, placement.used(BlockType.REFLECT));
        assertEquals(1, placement.used(BlockType.REFRACT));
        assertEquals(2, placement.blockCount());

        placement.unassign(0);
        assertNull(placement.get(0));
        assertEquals(0, placement.used(BlockType.REFLECT));
        assertEquals(1, placement.blockCount());

        // Unassigning an empty slot is a no-op
        placement.unassign(1);
        assertEquals(1, placement.blockCount());
    }

    @Test
    @DisplayName("a placement never exceeds the inventory")
    void inventoryIsEnforced() {
        placement.assign(0, BlockType.REFRACT);

        assertThrows(IllegalStateException.class, () -> placement.assign(1, BlockType.REFRACT));
        assertThrows(IllegalStateException.class, () -> placement.assign(1, BlockType.OPAQUE));
        assertEquals(1, placement.blockCount());
    }

    @Test
    void occupiedSlotCannotBeReassigned() {
        placement.assign(2, BlockType.REFLECT);

        assertThrows(IllegalStateException.class, () -> placement.assign(2, BlockType.REFRACT));
        assertEquals(BlockType.REFLECT, placement.get(2));
    }

    @Test
    void snapshotIsIndependent() {
        placement.assign(0, BlockType.REFLECT);
        Placement copy = placement.snapshot();
        placement.unassign(0);
        placement.assign(1, BlockType.REFLECT);

        assertEquals(BlockType.REFLECT, copy.get(0));
        assertNull(copy.get(1));
        assertEquals(1, copy.blockCount());
    }

    @Test
    @DisplayName("map view lists placed blocks by cell in slot order")
    void mapRoundTrip() {
        placement.assign(3, BlockType.REFRACT);
        placement.assign(1, BlockType.REFLECT);

        Map<Cell, BlockType> map = placement.toMap();
        assertEquals(List.of(Cell.of(1, 0), Cell.of(2, 1)), List.copyOf(map.keySet()));

        Placement rebuilt = Placement.fromMap(board, map);
        assertEquals(BlockType.REFLECT, rebuilt.get(1));
        assertEquals(BlockType.REFRACT, rebuilt.get(3));
        assertEquals(2, rebuilt.blockCount());
    }

    @Test
    void fromMapRejectsNonSlotCells() {
        assertThrows(IllegalArgumentException.class,
                () -> Placement.fromMap(board, Map.of(Cell.of(2, 0), BlockType.REFLECT)));
        assertThrows(IllegalArgumentException.class,
                () -> Placement.fromMap(board, Map.of(Cell.of(1, 1), BlockType.REFLECT)));
    }

    @Test
    void configurationPrefersFixedThenPlacedBlocks() {
        placement.assign(0, BlockType.REFLECT);
        Configuration configuration = new Configuration(board, placement);

        assertEquals(BlockType.REFLECT, configuration.blockAt(0, 0));
        assertEquals(BlockType.OPAQUE, configuration.blockAt(2, 0));
        assertNull(configuration.blockAt(1, 0));
        assertNull(configuration.blockAt(1, 1));
        assertNull(configuration.blockAt(-1, 0));

        // The configuration is a live view of the placement
        placement.unassign(0);
        assertNull(configuration.blockAt(0, 0));

        assertNull(Configuration.fixedOnly(board).blockAt(0, 0));
        assertEquals(BlockType.OPAQUE, Configuration.fixedOnly(board).blockAt(2, 0));
    }
}
