package ai.tractor.rules;

import ai.tractor.game.Card;
import ai.tractor.game.Suit;
import ai.tractor.game.TrumpInfo;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decomposes card sets into their strongest non-overlapping mix of combos.
 * <p>
 * Tractors are claimed first, longest first, then pairs, then the leftover cards as
 * singles. Among combos of one type and length the higher one is claimed first. The same
 * decomposition backs both the leading multi-combo check and the structure a follower
 * must match, so the two can never disagree.
 */
public final class MultiComboAnalyzer {
    private static final Comparator<Combo> CLAIM_ORDER = Comparator
            .comparingInt((Combo c) -> typePriority(c.getType()))
            .thenComparingInt(Combo::size)
            .thenComparingInt(Combo::getValue)
            .reversed();

    private MultiComboAnalyzer() {
    }

    /**
     * Decomposes a card set. Every card ends up in exactly one component.
     *
     * @param cards any cards
     * @param trumpInfo the round's trump declaration
     * @return the decomposition; empty components for an empty input
     */
    public static ComboStructure analyzeComboStructure(List<Card> cards, TrumpInfo trumpInfo) {
        List<Combo> candidates = new ArrayList<>(ComboClassifier.identifyCombos(cards, trumpInfo));
        candidates.sort(CLAIM_ORDER);

        Set<String> claimed = new HashSet<>();
        List<Combo> components = new ArrayList<>();
        for (Combo combo : candidates) {
            if (!combo.overlaps(claimed)) {
                components.add(combo);
                claimed.addAll(Combo.idsOf(combo.getCards()));
            }
        }
        return new ComboStructure(components, !cards.isEmpty() && allTrump(cards, trumpInfo));
    }

    /**
     * Recognizes a leading multi-combo: cards of one plain suit that split into two or
     * more components.
     *
     * @return the decomposition, or empty if the cards are not such a multi-combo
     */
    public static Optional<ComboStructure> detectLeadingMultiCombo(List<Card> cards, TrumpInfo trumpInfo) {
        if (cards.size() < 2 || plainSuitOf(cards, trumpInfo) == null) {
            return Optional.empty();
        }
        ComboStructure structure = analyzeComboStructure(cards, trumpInfo);
        return structure.size() >= 2 ? Optional.of(structure) : Optional.empty();
    }

    /**
     * Checks whether an available structure is at least as strong as a required one: same
     * length, and no fewer pairs or tractor pairs.
     */
    public static boolean matchesRequiredComponents(ComboStructure available, ComboStructure required) {
        return available.totalLength() == required.totalLength()
                && available.totalPairs() >= required.totalPairs()
                && available.tractorPairs() >= required.tractorPairs();
    }

    /**
     * Returns the plain suit every card belongs to, or {@code null} if the cards are empty,
     * include a trump, or span several suits.
     */
    public static Suit plainSuitOf(List<Card> cards, TrumpInfo trumpInfo) {
        Suit suit = null;
        for (Card card : cards) {
            if (trumpInfo.isTrump(card)) {
                return null;
            }
            if (suit == null) {
                suit = card.getSuit();
            } else if (suit != card.getSuit()) {
                return null;
            }
        }
        return suit;
    }

    private static boolean allTrump(List<Card> cards, TrumpInfo trumpInfo) {
        for (Card card : cards) {
            if (!trumpInfo.isTrump(card)) {
                return false;
            }
        }
        return true;
    }

    private static int typePriority(ComboType type) {
        return switch (type) {
            case TRACTOR -> 3;
            case PAIR -> 2;
            case SINGLE -> 1;
            case NOT_A_STRAIGHT_COMBO -> 0;
        };
    }
}
