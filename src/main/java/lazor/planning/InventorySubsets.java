package lazor.planning;

import lazor.domain.BlockType;
import lazor.domain.Inventory;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the inventory sub-vectors the search tries, in order.
 *
 * The full inventory comes first. Then come the smaller totals, largest first,
 * and within one total the vectors go in descending lexicographic order of
 * (Reflect, Refract, Opaque) counts. Each vector bounds the blocks of a
 * plan per type, so a plan never exceeds the board's inventory.
 */
public final class InventorySubsets {

    private InventorySubsets() {}

    /**
     * @param inventory the board's full inventory
     * @return every non-empty sub-vector, full inventory first
     */
    public static List<Inventory> plans(Inventory inventory) {
        int reflect = inventory.get(BlockType.REFLECT);
        int opaque = inventory.get(BlockType.OPAQUE);
        int refract = inventory.get(BlockType.REFRACT);

        List<Inventory> plans = new ArrayList<>();
        for (int size = inventory.total(); size >= 1; size--) {
            for (int a = Math.min(reflect, size); a >= 0; a--) {
                for (int c = Math.min(refract, size - a); c >= 0; c--) {
                    int b = size - a - c;
                    if (b <= opaque) {
                        plans.add(Inventory.of(a, b, c));
                    }
                }
            }
        }
        return plans;
    }

    /**
     * @return number of plans {@link #plans} yields, without building them
     */
    public static int count(Inventory inventory) {
        return (inventory.get(BlockType.REFLECT) + 1)
                * (inventory.get(BlockType.OPAQUE) + 1)
                * (inventory.get(BlockType.REFRACT) + 1) - 1;
    }
}
