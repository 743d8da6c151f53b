package lazor.planning.heuristic;

import lazor.domain.BlockType;
import lazor.planning.SearchConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Decides the order in which block types are tried at a slot.
 *
 * While more than half of the targets are still dark, Refract goes first since
 * a fork lights two paths at once; otherwise Reflect goes first to steer the
 * existing beams. Opaque is always last. A non-zero seed occasionally swaps
 * the first two choices, reproducibly for a given seed.
 *
 * One instance per search: the random source is consumed as nodes expand.
 */
public class BlockOrderHeuristic {

    private static final BlockType[] FORK_FIRST = {BlockType.REFRACT, BlockType.REFLECT, BlockType.OPAQUE};
    private static final BlockType[] REFLECT_FIRST = {BlockType.REFLECT, BlockType.REFRACT, BlockType.OPAQUE};

    private final Random random;

    /**
     * @param seed 0 for the unperturbed order
     */
    public BlockOrderHeuristic(long seed) {
        this.random = seed == 0 ? null : new Random(seed);
    }

    /**
     * @param remaining blocks left per type, indexed by ordinal
     * @param unhit targets not yet lit
     * @param targets total targets
     * @return the types with blocks left, in trial order
     */
    public List<BlockType> order(int[] remaining, int unhit, int targets) {
        BlockType[] base = unhit * 2 > targets ? FORK_FIRST : REFLECT_FIRST;
        List<BlockType> order = new ArrayList<>(3);
        for (BlockType type : base) {
            if (remaining[type.ordinal()] > 0) {
                order.add(type);
            }
        }
        if (random != null && random.nextInt(SearchConfig.TYPE_ORDER_PERTURBATION) == 0 && order.size() >= 2) {
            BlockType first = order.get(0);
            order.set(0, order.get(1));
            order.set(1, first);
        }
        return order;
    }
}
