package ai.tractor.rules;

/**
 * The shape of a card set as a single straight combination.
 * <p>
 * {@link #NOT_A_STRAIGHT_COMBO} is an explicit outcome, not an error: a lead with this
 * shape is either a multi-combo or an exhausting lead, and callers switch on it to route
 * to the multi-combo rules.
 */
public enum ComboType {
    /** One card. */
    SINGLE,
    /** Both copies of one logical card. */
    PAIR,
    /** Two or more pairs adjacent by tractor rank within one tractor context. */
    TRACTOR,
    /** Any other set; only meaningful as a multi-combo. */
    NOT_A_STRAIGHT_COMBO;

    /**
     * @return {@code true} for Single, Pair and Tractor
     */
    public boolean isStraight() {
        return this != NOT_A_STRAIGHT_COMBO;
    }
}
