package ai.tractor.game;

import java.util.ArrayList;
import java.util.List;

/**
 * The 108-card double deck: two copies of each of the 52 regular cards plus two small
 * and two big jokers.
 * <p>
 * The deck is built once in a stable order (deck 0 then deck 1, suits then ranks, jokers
 * last). Dealing is owned by the caller; the engine only uses the deck to enumerate the
 * cards that exist.
 */
public final class Deck {
    /** Number of physical cards in the double deck. */
    public static final int SIZE = 108;

    private static final List<Card> CARDS = build();

    private Deck() {
    }

    /**
     * Returns every card of the double deck, in build order.
     */
    public static List<Card> allCards() {
        return CARDS;
    }

    /**
     * Returns both copies of every card that belongs to a plain suit under the given
     * trump. Trump-rank cards of that suit are excluded because they play as trump.
     *
     * @param suit a non-trump suit
     * @param trumpInfo the round's trump declaration
     * @return the cards in deck order
     */
    public static List<Card> plainSuitCards(Suit suit, TrumpInfo trumpInfo) {
        List<Card> out = new ArrayList<>();
        for (Card card : CARDS) {
            if (card.getSuit() == suit && !trumpInfo.isTrump(card)) {
                out.add(card);
            }
        }
        return out;
    }

    private static List<Card> build() {
        List<Card> cards = new ArrayList<>(SIZE);
        for (int deckId = 0; deckId <= 1; deckId++) {
            for (Suit suit : Suit.values()) {
                for (Rank rank : Rank.values()) {
                    cards.add(Card.of(rank, suit, deckId));
                }
            }
            cards.add(Card.joker(JokerType.SMALL, deckId));
            cards.add(Card.joker(JokerType.BIG, deckId));
        }
        return List.copyOf(cards);
    }
}
