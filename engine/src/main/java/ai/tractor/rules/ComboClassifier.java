package ai.tractor.rules;

import ai.tractor.game.Card;
import ai.tractor.game.TrumpInfo;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies card sets as straight combinations and lists the combinations a set contains.
 */
public final class ComboClassifier {
    private ComboClassifier() {
    }

    /**
     * Classifies a card set. The result does not depend on the order of {@code cards}.
     *
     * @return {@link ComboType#NOT_A_STRAIGHT_COMBO} for the empty list and for any set that
     *     is not exactly one Single, Pair or Tractor
     */
    public static ComboType getComboType(List<Card> cards, TrumpInfo trumpInfo) {
        if (cards.size() == 1) {
            return ComboType.SINGLE;
        }
        if (cards.size() == 2 && isPair(cards.get(0), cards.get(1))) {
            return ComboType.PAIR;
        }
        if (TractorDetector.isValidTractor(cards, trumpInfo)) {
            return ComboType.TRACTOR;
        }
        return ComboType.NOT_A_STRAIGHT_COMBO;
    }

    /**
     * Lists every Single, every Pair and every Tractor in a card set. Combos overlap: a card
     * of a pair also appears as a Single, and a pair of a tractor also appears as a Pair.
     */
    public static List<Combo> identifyCombos(List<Card> cards, TrumpInfo trumpInfo) {
        List<Combo> combos = new ArrayList<>();
        for (Card card : cards) {
            combos.add(new Combo(ComboType.SINGLE, List.of(card), CardOrdering.strength(card, trumpInfo)));
        }
        for (List<Card> pair : pairsIn(cards)) {
            combos.add(new Combo(ComboType.PAIR, pair, CardOrdering.strength(pair.get(0), trumpInfo)));
        }
        combos.addAll(TractorDetector.findAllTractors(cards, trumpInfo));
        return combos;
    }

    /**
     * Returns the non-overlapping pairs of a card set, in order of first appearance.
     */
    public static List<List<Card>> pairsIn(List<Card> cards) {
        Map<String, List<Card>> byCommonId = new LinkedHashMap<>();
        for (Card card : cards) {
            byCommonId.computeIfAbsent(card.getCommonId(), k -> new ArrayList<>()).add(card);
        }
        List<List<Card>> pairs = new ArrayList<>();
        for (List<Card> copies : byCommonId.values()) {
            for (int i = 0; i + 1 < copies.size(); i += 2) {
                pairs.add(List.of(copies.get(i), copies.get(i + 1)));
            }
        }
        return pairs;
    }

    /**
     * Returns {@code true} if the two cards are distinct copies of one logical card.
     */
    public static boolean isPair(Card a, Card b) {
        return a.isIdenticalTo(b) && !a.getId().equals(b.getId());
    }
}
