package lazor.domain;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable count of movable blocks available per block type.
 * The search never consumes it; it only bounds how many Empty cells may receive each type.
 */
public final class Inventory {

    private static final Inventory EMPTY = new Inventory(new int[BlockType.values().length]);

    /** Counts indexed by BlockType ordinal */
    private final int[] counts;

    private Inventory(int[] counts) {
        long total = 0;
        for (BlockType type : BlockType.values()) {
            if (counts[type.ordinal()] < 0) {
                throw new IllegalArgumentException("Negative inventory for " + type + ": " + counts[type.ordinal()]);
            }
            total += counts[type.ordinal()];
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Inventory total out of range: " + total);
        }
        this.counts = counts;
    }

    /**
     * Creates an inventory from per-type counts.
     *
     * @param reflect number of movable Reflect blocks
     * @param opaque number of movable Opaque blocks
     * @param refract number of movable Refract blocks
     * @throws IllegalArgumentException if any count is negative or the total exceeds the int range
     */
    public static Inventory of(int reflect, int opaque, int refract) {
        int[] counts = new int[BlockType.values().length];
        counts[BlockType.REFLECT.ordinal()] = reflect;
        counts[BlockType.OPAQUE.ordinal()] = opaque;
        counts[BlockType.REFRACT.ordinal()] = refract;
        return new Inventory(counts);
    }

    /**
     * Creates an inventory from a map; missing types count as zero.
     */
    public static Inventory of(Map<BlockType, Integer> counts) {
        int[] array = new int[BlockType.values().length];
        for (Map.Entry<BlockType, Integer> e : counts.entrySet()) {
            array[e.getKey().ordinal()] = e.getValue();
        }
        return new Inventory(array);
    }

    /**
     * Creates an inventory from an array indexed by BlockType ordinal (copied).
     */
    public static Inventory ofCounts(int[] counts) {
        if (counts.length != BlockType.values().length) {
            throw new IllegalArgumentException("Expected " + BlockType.values().length + " counts, got " + counts.length);
        }
        return new Inventory(Arrays.copyOf(counts, counts.length));
    }

    public static Inventory empty() {
        return EMPTY;
    }

    public int get(BlockType type) {
        return counts[type.ordinal()];
    }

    /**
     * @return total number of movable blocks over all types
     */
    public int total() {
        int total = 0;
        for (int c : counts) total += c;
        return total;
    }

    /**
     * @return a copy of the counts, indexed by BlockType ordinal
     */
    public int[] toArray() {
        return Arrays.copyOf(counts, counts.length);
    }

    public Map<BlockType, Integer> asMap() {
        Map<BlockType, Integer> map = new EnumMap<>(BlockType.class);
        for (BlockType type : BlockType.values()) {
            map.put(type, counts[type.ordinal()]);
        }
        return map;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return Arrays.equals(counts, ((Inventory) obj).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (BlockType type : BlockType.values()) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(type.symbol).append('=').append(counts[type.ordinal()]);
        }
        return sb.append('}').toString();
    }
}
