package ai.tractor.rules;

import ai.tractor.game.Card;
import ai.tractor.game.Deck;
import ai.tractor.game.Suit;
import ai.tractor.game.TrumpInfo;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The cards of one plain suit that a player cannot account for: every copy of the suit
 * minus the cards already played, the player's own hand and whatever kitty the player has
 * seen. Only these cards can still beat a combo led in that suit.
 * <p>
 * Built once per lead and shared by every component of a multi-combo.
 */
public final class UnseenCards {
    private final Suit suit;
    private final TrumpInfo trumpInfo;
    private final List<Card> cards;

    public UnseenCards(
            Suit suit,
            Collection<Card> playedCards,
            Collection<Card> ownHand,
            Collection<Card> visibleKitty,
            TrumpInfo trumpInfo) {
        this.suit = Objects.requireNonNull(suit, "suit");
        this.trumpInfo = Objects.requireNonNull(trumpInfo, "trumpInfo");
        if (!trumpInfo.isPlainSuit(suit)) {
            throw new IllegalArgumentException("Unseen cards are only tracked for plain suits, not " + suit);
        }
        Set<String> seen = new HashSet<>();
        seen.addAll(Combo.idsOf(playedCards));
        seen.addAll(Combo.idsOf(ownHand));
        seen.addAll(Combo.idsOf(visibleKitty));

        List<Card> unseen = new ArrayList<>();
        for (Card card : Deck.plainSuitCards(suit, trumpInfo)) {
            if (!seen.contains(card.getId())) {
                unseen.add(card);
            }
        }
        this.cards = List.copyOf(unseen);
    }

    public Suit getSuit() {
        return suit;
    }

    public List<Card> getCards() {
        return cards;
    }

    /**
     * Returns {@code true} if nothing among the unseen cards can beat the combo. A combo of
     * another suit, or of trump, is never judged unbeatable here.
     */
    public boolean isUnbeatable(Combo combo) {
        if (MultiComboAnalyzer.plainSuitOf(combo.getCards(), trumpInfo) != suit) {
            return false;
        }
        return switch (combo.getType()) {
            case SINGLE -> !hasHigherSingle(combo.getValue());
            case PAIR -> !hasHigherPair(combo.getValue());
            case TRACTOR -> !hasHigherTractor(combo.pairCount(), combo.getValue());
            case NOT_A_STRAIGHT_COMBO -> false;
        };
    }

    boolean hasHigherSingle(int value) {
        for (Card card : cards) {
            if (CardOrdering.strength(card, trumpInfo) > value) {
                return true;
            }
        }
        return false;
    }

    boolean hasHigherPair(int value) {
        for (List<Card> pair : ComboClassifier.pairsIn(cards)) {
            if (CardOrdering.strength(pair.get(0), trumpInfo) > value) {
                return true;
            }
        }
        return false;
    }

    boolean hasHigherTractor(int pairCount, int value) {
        for (Combo tractor : TractorDetector.findAllTractors(cards, trumpInfo)) {
            if (tractor.pairCount() == pairCount && tractor.getValue() > value) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "UnseenCards(" + suit + ", " + cards.size() + " cards)";
    }
}
