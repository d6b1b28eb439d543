package ai.tractor.rules;

import ai.tractor.game.Card;
import ai.tractor.game.TrumpInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Finds tractors: two or more pairs whose {@link CardOrdering#tractorRank tractor ranks}
 * are consecutive within one {@link TractorContext}.
 * <p>
 * <strong>Supported shapes:</strong>
 * <ul>
 *   <li><strong>Regular:</strong> 6♠6♠ 7♠7♠.</li>
 *   <li><strong>Rank-skip:</strong> 6♠6♠ 8♠8♠ when 7 is the trump rank.</li>
 *   <li><strong>Trump cross-suit:</strong> 2♠2♠ 2♥2♥ when 2 is the trump rank and Hearts
 *       the trump suit.</li>
 *   <li><strong>Joker:</strong> SJ SJ BJ BJ.</li>
 * </ul>
 * A pair is always two copies of one logical card. Two off-suit trump-rank pairs share a
 * tractor rank, so they never line up with each other; each of them may line up with the
 * trump-suit trump-rank pair, and every such choice is reported.
 */
public final class TractorDetector {

    /** The shape of a tractor, for logs and UI hints. */
    public enum TractorKind {
        JOKER("Joker tractor"),
        TRUMP_CROSS_SUIT("Trump cross-suit tractor"),
        RANK_SKIP("Rank-skip tractor"),
        REGULAR("Regular same-suit tractor"),
        NOT_A_TRACTOR("Not a tractor");

        private final String label;

        TractorKind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private TractorDetector() {
    }

    /**
     * Returns every tractor in a card set, including overlapping sub-runs.
     *
     * @param cards any cards, in any order
     * @param trumpInfo the round's trump declaration
     * @return the tractors, grouped by context and ordered by starting tractor rank
     */
    public static List<Combo> findAllTractors(List<Card> cards, TrumpInfo trumpInfo) {
        Map<TractorContext, List<Card>> byContext = new EnumMap<>(TractorContext.class);
        for (Card card : cards) {
            byContext.computeIfAbsent(CardOrdering.tractorContext(card, trumpInfo), k -> new ArrayList<>()).add(card);
        }
        List<Combo> tractors = new ArrayList<>();
        for (List<Card> contextCards : byContext.values()) {
            tractors.addAll(findTractorsInContext(contextCards, trumpInfo));
        }
        return tractors;
    }

    /**
     * Returns every tractor among cards that all share one tractor context.
     */
    static List<Combo> findTractorsInContext(List<Card> cards, TrumpInfo trumpInfo) {
        List<Map.Entry<Integer, List<List<Card>>>> levels = new ArrayList<>(pairLevels(cards, trumpInfo).entrySet());
        List<Combo> tractors = new ArrayList<>();
        for (int start = 0; start < levels.size(); start++) {
            for (int end = start + 1; end < levels.size(); end++) {
                if (levels.get(end).getKey() - levels.get(end - 1).getKey() != 1) {
                    break;
                }
                List<List<List<Card>>> choices = new ArrayList<>();
                for (int i = start; i <= end; i++) {
                    choices.add(levels.get(i).getValue());
                }
                for (List<Card> tractorCards : crossProduct(choices)) {
                    tractors.add(new Combo(ComboType.TRACTOR, tractorCards, topStrength(tractorCards, trumpInfo)));
                }
            }
        }
        return tractors;
    }

    /**
     * Groups the pairs of a card set by tractor rank, lowest rank first. Each level holds
     * the pairs found there, two copies of one logical card each.
     */
    static TreeMap<Integer, List<List<Card>>> pairLevels(List<Card> cards, TrumpInfo trumpInfo) {
        TreeMap<Integer, List<List<Card>>> levels = new TreeMap<>();
        for (List<Card> pair : ComboClassifier.pairsIn(cards)) {
            levels.computeIfAbsent(CardOrdering.tractorRank(pair.get(0), trumpInfo), k -> new ArrayList<>()).add(pair);
        }
        return levels;
    }

    /**
     * Returns {@code true} if some detected tractor uses exactly the given cards.
     */
    public static boolean isValidTractor(List<Card> cards, TrumpInfo trumpInfo) {
        if (cards.size() < 4 || cards.size() % 2 != 0) {
            return false;
        }
        for (Combo tractor : findAllTractors(cards, trumpInfo)) {
            if (tractor.hasSameCards(cards)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Names the shape of a tractor.
     *
     * @return the kind, or {@link TractorKind#NOT_A_TRACTOR} if the cards are not one tractor
     */
    public static TractorKind describe(List<Card> cards, TrumpInfo trumpInfo) {
        if (!isValidTractor(cards, trumpInfo)) {
            return TractorKind.NOT_A_TRACTOR;
        }
        TractorContext context = CardOrdering.tractorContext(cards.get(0), trumpInfo);
        if (context == TractorContext.JOKER) {
            return TractorKind.JOKER;
        }
        if (context == TractorContext.TRUMP_RANK) {
            return TractorKind.TRUMP_CROSS_SUIT;
        }
        int trumpRank = trumpInfo.getTrumpRank().getValue();
        boolean below = false;
        boolean above = false;
        for (Card card : cards) {
            below |= card.getRank().getValue() < trumpRank;
            above |= card.getRank().getValue() > trumpRank;
        }
        return below && above ? TractorKind.RANK_SKIP : TractorKind.REGULAR;
    }

    private static List<List<Card>> crossProduct(List<List<List<Card>>> choices) {
        List<List<Card>> results = Collections.singletonList(Collections.emptyList());
        for (List<List<Card>> levelPairs : choices) {
            List<List<Card>> next = new ArrayList<>();
            for (List<Card> prefix : results) {
                for (List<Card> pair : levelPairs) {
                    List<Card> extended = new ArrayList<>(prefix);
                    extended.addAll(pair);
                    next.add(extended);
                }
            }
            results = next;
        }
        return results;
    }

    private static int topStrength(List<Card> cards, TrumpInfo trumpInfo) {
        int best = Integer.MIN_VALUE;
        for (Card card : cards) {
            best = Math.max(best, CardOrdering.strength(card, trumpInfo));
        }
        return best;
    }
}
