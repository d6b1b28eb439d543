package ai.tractor.game;

/**
 * The four seats at the table, in counter-clockwise play order.
 */
public enum PlayerId {
    HUMAN("human"),
    BOT1("bot1"),
    BOT2("bot2"),
    BOT3("bot3");

    private final String key;

    PlayerId(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
