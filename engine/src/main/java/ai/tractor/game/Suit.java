package ai.tractor.game;

/**
 * The four suits of a standard deck.
 * <p>
 * Jokers carry no suit. Whether a suit is trump depends on the round's {@link TrumpInfo}
 * and is never stored here.
 */
public enum Suit {
    /** Spades, ♠. */
    SPADES("♠", "Spades"),
    /** Hearts, ♥. */
    HEARTS("♥", "Hearts"),
    /** Clubs, ♣. */
    CLUBS("♣", "Clubs"),
    /** Diamonds, ♦. */
    DIAMONDS("♦", "Diamonds");

    /** The Unicode symbol representing this suit (e.g., "♣", "♦"). */
    private final String symbol;
    /** Name used in card identities ("Spades_A"). */
    private final String idName;

    Suit(String symbol, String idName) {
        this.symbol = symbol;
        this.idName = idName;
    }

    /**
     * Returns the Unicode symbol of this suit.
     *
     * @return the suit symbol (e.g., "♣", "♦", "♥", "♠")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the name used when building card identities.
     *
     * @return e.g. "Hearts"
     */
    public String getIdName() {
        return idName;
    }

    /**
     * Looks up a suit by its symbol.
     *
     * @param symbol one of ♠ ♥ ♣ ♦
     * @return the matching suit
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static Suit fromSymbol(String symbol) {
        for (Suit suit : values()) {
            if (suit.symbol.equals(symbol)) {
                return suit;
            }
        }
        throw new IllegalArgumentException("Unknown suit symbol: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
