package ai.tractor.game;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One round of plays, one per player, resolved to a single winner.
 * <p>
 * The first entry of {@link #getPlays()} is the lead. The winning player starts out as the
 * leader and is updated by the caller as stronger plays arrive; points accumulate from
 * every card played into the trick.
 */
public final class Trick {
    private final PlayerId leadingPlayerId;
    private final List<Play> plays;
    private final PlayerId winningPlayerId;
    private final int points;
    private final boolean finalTrick;

    public Trick(PlayerId leadingPlayerId, List<Play> plays, PlayerId winningPlayerId, int points, boolean finalTrick) {
        this.leadingPlayerId = Objects.requireNonNull(leadingPlayerId, "leadingPlayerId");
        this.plays = List.copyOf(Objects.requireNonNull(plays, "plays"));
        this.winningPlayerId = winningPlayerId == null ? leadingPlayerId : winningPlayerId;
        this.points = points;
        this.finalTrick = finalTrick;
    }

    /**
     * Creates an in-progress trick whose winner is the leader and whose points are
     * summed from the plays.
     */
    public static Trick of(PlayerId leadingPlayerId, List<Play> plays) {
        int points = 0;
        for (Play play : plays) {
            points += play.getPoints();
        }
        return new Trick(leadingPlayerId, plays, leadingPlayerId, points, false);
    }

    public PlayerId getLeadingPlayerId() {
        return leadingPlayerId;
    }

    public List<Play> getPlays() {
        return plays;
    }

    public PlayerId getWinningPlayerId() {
        return winningPlayerId;
    }

    public int getPoints() {
        return points;
    }

    public boolean isFinalTrick() {
        return finalTrick;
    }

    /**
     * @return {@code true} if nobody has played into this trick yet
     */
    public boolean isEmpty() {
        return plays.isEmpty();
    }

    /**
     * Returns the cards of the lead, or an empty list if nobody has played yet.
     */
    public List<Card> getLeadingCombo() {
        if (plays.isEmpty()) {
            return Collections.emptyList();
        }
        return plays.get(0).getCards();
    }

    @Override
    public String toString() {
        return "Trick(lead=" + leadingPlayerId + ", plays=" + plays + ", winner=" + winningPlayerId
                + ", points=" + points + ")";
    }
}
