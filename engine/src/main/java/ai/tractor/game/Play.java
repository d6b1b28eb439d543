package ai.tractor.game;

import java.util.List;
import java.util.Objects;

/**
 * The cards one player put into a trick.
 */
public final class Play {
    private final PlayerId playerId;
    private final List<Card> cards;

    public Play(PlayerId playerId, List<Card> cards) {
        this.playerId = Objects.requireNonNull(playerId, "playerId");
        this.cards = List.copyOf(Objects.requireNonNull(cards, "cards"));
    }

    public PlayerId getPlayerId() {
        return playerId;
    }

    public List<Card> getCards() {
        return cards;
    }

    public int getPoints() {
        int points = 0;
        for (Card card : cards) {
            points += card.getPoints();
        }
        return points;
    }

    @Override
    public String toString() {
        return playerId + ":" + cards;
    }
}
