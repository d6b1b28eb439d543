package ai.tractor.game;

/**
 * The two jokers of each deck. Both are always trump; the big joker ranks highest.
 */
public enum JokerType {
    /** Small (black) joker. */
    SMALL("SJ", "Small"),
    /** Big (red) joker. */
    BIG("BJ", "Big");

    private final String label;
    private final String idName;

    JokerType(String label, String idName) {
        this.label = label;
        this.idName = idName;
    }

    /**
     * @return the short label ("SJ" or "BJ")
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return the name used in card identities ("Big_Joker")
     */
    public String getIdName() {
        return idName;
    }

    @Override
    public String toString() {
        return label;
    }
}
