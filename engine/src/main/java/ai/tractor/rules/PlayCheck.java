package ai.tractor.rules;

/**
 * Whether a play is legal and, if not, why.
 *
 * @param legal whether the play is allowed
 * @param reason why the play was rejected; {@code "ok"} for legal plays
 */
public record PlayCheck(boolean legal, String reason) {

    private static final PlayCheck OK = new PlayCheck(true, "ok");

    public static PlayCheck ok() {
        return OK;
    }

    public static PlayCheck rejected(String reason) {
        return new PlayCheck(false, reason);
    }
}
