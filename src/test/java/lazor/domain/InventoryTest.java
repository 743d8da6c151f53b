package lazor.domain;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InventoryTest {

    @Test
    void countsPerType() {
        Inventory inventory = Inventory.of(3, 2, 1);

        assertEquals(3, inventory.get(BlockType.REFLECT));
        assertEquals(2, inventory.get(BlockType.OPAQUE));
        assertEquals(1, inventory.get(BlockType.REFRACT));
        assertEquals(6, inventory.total());
        assertEquals("{A=3, B=2, C=1}", inventory.toString());
    }

    @Test
    void missingTypesInMapCountAsZero() {
        Map<BlockType, Integer> counts = new EnumMap<>(BlockType.class);
        counts.put(BlockType.REFRACT, 2);

        Inventory inventory = Inventory.of(counts);
        assertEquals(Inventory.of(0, 0, 2), inventory);
        assertEquals(0, inventory.get(BlockType.REFLECT));
        assertEquals(2, inventory.asMap().get(BlockType.REFRACT));
    }

    @Test
    void toArrayIsACopy() {
        Inventory inventory = Inventory.of(1, 1, 1);
        int[] counts = inventory.toArray();
        counts[0] = 9;

        assertEquals(1, inventory.get(BlockType.REFLECT));
    }

    @Test
    void rejectsNegativeCounts() {
        assertThrows(IllegalArgumentException.class, () -> Inventory.of(-1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> Inventory.ofCounts(new int[] {0, 0}));
    }

    @Test
    void emptyInventoryHasNoBlocks() {
        assertEquals(0, Inventory.empty().total());
    }

    @Test
    void directionsFlipComponents() {
        assertEquals(Direction.UP_RIGHT, Direction.DOWN_RIGHT.flip(false, true));
        assertEquals(Direction.DOWN_LEFT, Direction.DOWN_RIGHT.flip(true, false));
        assertEquals(Direction.UP_LEFT, Direction.DOWN_RIGHT.opposite());
        assertEquals(Direction.DOWN_RIGHT, Direction.DOWN_RIGHT.flip(false, false));
        assertThrows(IllegalArgumentException.class, () -> Direction.of(1, 0));
    }

    @Test
    void blockSymbolsAreCaseInsensitive() {
        assertEquals(BlockType.REFLECT, BlockType.fromSymbol('a'));
        assertEquals(BlockType.OPAQUE, BlockType.fromSymbol('B'));
        assertEquals(BlockType.REFRACT, BlockType.fromSymbol('c'));
        assertThrows(IllegalArgumentException.class, () -> BlockType.fromSymbol('o'));
    }
}
