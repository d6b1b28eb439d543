package ai.tractor.game;

/**
 * Enumeration representing the 13 ranks of a standard playing card deck.
 * <p>
 * Each rank is assigned a numeric value (2–14, Ace high) for ordering and comparison,
 * and a short label for string representation (e.g., "A", "K", "10").
 * The rank declared as trump for a round is lifted out of its natural sequence;
 * see {@code CardOrdering} for how the remaining ranks close the gap.
 */
public enum Rank {
    /** Two – the lowest rank (value 2). */
    TWO(2, "2"),
    /** Three – rank value 3. */
    THREE(3, "3"),
    /** Four – rank value 4. */
    FOUR(4, "4"),
    /** Five – rank value 5, worth 5 points. */
    FIVE(5, "5"),
    /** Six – rank value 6. */
    SIX(6, "6"),
    /** Seven – rank value 7. */
    SEVEN(7, "7"),
    /** Eight – rank value 8. */
    EIGHT(8, "8"),
    /** Nine – rank value 9. */
    NINE(9, "9"),
    /** Ten – rank value 10, worth 10 points. */
    TEN(10, "10"),
    /** Jack – rank value 11. */
    JACK(11, "J"),
    /** Queen – rank value 12. */
    QUEEN(12, "Q"),
    /** King – rank value 13, worth 10 points. */
    KING(13, "K"),
    /** Ace – the highest rank (value 14). */
    ACE(14, "A");

    /** Numeric value of the rank, used for ordering and comparisons (2–14). */
    private final int value;
    /** Short string label for display (e.g., "A", "K", "10"). */
    private final String label;

    /**
     * Constructs a Rank with a numeric value and display label.
     *
     * @param value the numeric rank value (2–14)
     * @param label the short string representation of the rank
     */
    Rank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    /**
     * Returns the numeric value of this rank.
     *
     * @return the numeric rank value (2 for Two, 14 for Ace)
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the short string label of this rank.
     *
     * @return the label (e.g., "A", "K", "10")
     */
    public String getLabel() {
        return label;
    }

    /**
     * Returns the points a card of this rank is worth when captured in a trick.
     *
     * @return 5 for Fives, 10 for Tens and Kings, 0 otherwise
     */
    public int getPoints() {
        switch (this) {
            case FIVE:
                return 5;
            case TEN:
            case KING:
                return 10;
            default:
                return 0;
        }
    }

    /**
     * Looks up a rank by its label.
     *
     * @param label e.g. "10", "Q"
     * @return the matching rank
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Rank fromLabel(String label) {
        for (Rank rank : values()) {
            if (rank.label.equalsIgnoreCase(label)) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank label: " + label);
    }

    /**
     * Returns the string representation of this rank.
     *
     * @return the rank label
     */
    @Override
    public String toString() {
        return label;
    }
}
