package lazor.planning;

import lazor.domain.Board;

/**
 * Factory for selecting the search driver for a board.
 *
 * Selection logic:
 * - parallel mode requested: MultiSeedExplorer over the configured seeds
 * - otherwise: a single PlacementSearch with the configured seed
 */
public class StrategySelector {

    private final SearchConfig config;

    public StrategySelector() {
        this(SearchConfig.defaults());
    }

    public StrategySelector(SearchConfig config) {
        this.config = config;
    }

    /**
     * Selects the strategy to run on a board.
     *
     * @param board the board about to be solved
     * @return the configured strategy
     */
    public SearchStrategy selectStrategy(Board board) {
        SearchStrategy strategy;
        if (config.isParallel()) {
            strategy = new MultiSeedExplorer(config);
        } else {
            strategy = new PlacementSearch(config);
        }
        if (SearchConfig.isNormal()) {
            System.err.println("[Search] " + board.getName() + ": using " + strategy.getName());
        }
        return strategy;
    }
}
