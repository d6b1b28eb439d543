package ai.tractor.game;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A seat and the cards it currently holds.
 */
public final class Player {
    private final PlayerId id;
    private final List<Card> hand;

    public Player(PlayerId id, List<Card> hand) {
        this.id = Objects.requireNonNull(id, "id");
        this.hand = List.copyOf(Objects.requireNonNull(hand, "hand"));
    }

    public PlayerId getId() {
        return id;
    }

    /**
     * @return an unmodifiable view of the hand
     */
    public List<Card> getHand() {
        return Collections.unmodifiableList(hand);
    }

    @Override
    public String toString() {
        return id + "(" + hand.size() + " cards)";
    }
}
