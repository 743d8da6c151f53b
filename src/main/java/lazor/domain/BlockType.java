package lazor.domain;

/**
 * The three kinds of block a board can hold, fixed or movable.
 * Each kind carries the symbol used for it in board files.
 */
public enum BlockType {

    /** Reflects the beam off the surface it strikes. */
    REFLECT('A'),

    /** Absorbs the beam. */
    OPAQUE('B'),

    /** Lets the beam through and also reflects a second beam. */
    REFRACT('C');

    /** Symbol used in board files and reports */
    public final char symbol;

    BlockType(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Parses a block type from its board file symbol (case-insensitive).
     *
     * @param symbol A, B or C
     * @return the corresponding BlockType
     * @throws IllegalArgumentException if the symbol is not a block symbol
     */
    public static BlockType fromSymbol(char symbol) {
        return switch (Character.toUpperCase(symbol)) {
            case 'A' -> REFLECT;
            case 'B' -> OPAQUE;
            case 'C' -> REFRACT;
            default -> throw new IllegalArgumentException("Invalid block symbol: " + symbol);
        };
    }
}
