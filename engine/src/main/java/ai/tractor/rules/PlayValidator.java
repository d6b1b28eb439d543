package ai.tractor.rules;

import ai.tractor.game.Card;
import ai.tractor.game.GameState;
import ai.tractor.game.PlayerId;
import ai.tractor.game.Suit;
import ai.tractor.game.TrumpInfo;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a set of cards may be played into the current trick.
 * <p>
 * <strong>Leading</strong> accepts any Single, Pair or Tractor; a same-suit multi-combo
 * whose components nobody can beat; or an exhausting lead (all the leader's remaining
 * cards of one plain suit, or several different trump cards).
 * <p>
 * <strong>Following</strong> checks, in order:
 * <ol>
 *   <li>The play has as many cards as the lead.</li>
 *   <li>If the follower can form the lead's combo type from the led suit, the play must be
 *       one such combo.</li>
 *   <li>Otherwise, with enough cards of the led suit, only those cards may be played, with
 *       as many pairs as the lead where available and no needlessly broken pair.</li>
 *   <li>With too few cards of the led suit, all of them must be played and the rest may
 *       be anything.</li>
 *   <li>With none, anything of the right length goes.</li>
 * </ol>
 * A multi-combo lead is followed by exhausting the led suit, or by a play of the led suit
 * whose structure is as strong as the lead allows.
 * <p>
 * Illegal plays are reported as {@code false} and never throw.
 */
public final class PlayValidator {
    private static final Logger log = LoggerFactory.getLogger(PlayValidator.class);

    private PlayValidator() {
    }

    /**
     * @return {@code true} if {@code playerId} may play {@code played} from {@code hand}
     */
    public static boolean isValidPlay(List<Card> played, List<Card> hand, PlayerId playerId, GameState state) {
        return check(played, hand, playerId, state).legal();
    }

    /**
     * Like {@link #isValidPlay} but keeps the reason for a rejection.
     */
    public static PlayCheck check(List<Card> played, List<Card> hand, PlayerId playerId, GameState state) {
        PlayCheck result = basicChecks(played, hand);
        if (result.legal()) {
            List<Card> lead = state.getLeadingCombo();
            result = lead.isEmpty()
                    ? checkLead(played, hand, playerId, state)
                    : checkFollow(played, lead, hand, state.getTrumpInfo());
        }
        if (!result.legal() && log.isDebugEnabled()) {
            log.debug("Rejected {} from {}: {}", played, playerId, result.reason());
        }
        return result;
    }

    private static PlayCheck basicChecks(List<Card> played, List<Card> hand) {
        if (played.isEmpty()) {
            return PlayCheck.rejected("no cards played");
        }
        Set<String> playedIds = Combo.idsOf(played);
        if (playedIds.size() != played.size()) {
            return PlayCheck.rejected("the same card was played twice");
        }
        if (!Combo.idsOf(hand).containsAll(playedIds)) {
            return PlayCheck.rejected("played cards are not all in hand");
        }
        return PlayCheck.ok();
    }

    static PlayCheck checkLead(List<Card> played, List<Card> hand, PlayerId playerId, GameState state) {
        TrumpInfo trumpInfo = state.getTrumpInfo();
        if (ComboClassifier.getComboType(played, trumpInfo).isStraight()) {
            return PlayCheck.ok();
        }

        String multiComboReason = null;
        Optional<ComboStructure> multiCombo = MultiComboAnalyzer.detectLeadingMultiCombo(played, trumpInfo);
        if (multiCombo.isPresent()) {
            Suit suit = MultiComboAnalyzer.plainSuitOf(played, trumpInfo);
            LeadingMultiComboValidation validation = UnbeatableComboEvaluator.validateLeadingMultiCombo(
                    multiCombo.get().components(), suit, state, playerId);
            if (validation.valid()) {
                return PlayCheck.ok();
            }
            multiComboReason = String.join("; ", validation.invalidReasons());
        }

        if (isExhaustingLead(played, hand, trumpInfo)) {
            return PlayCheck.ok();
        }
        return PlayCheck.rejected(multiComboReason != null
                ? "multi-combo can be beaten: " + multiComboReason
                : "not a single, pair, tractor or valid multi-combo");
    }

    private static boolean isExhaustingLead(List<Card> played, List<Card> hand, TrumpInfo trumpInfo) {
        if (played.size() < 2 || !distinctLogicalCards(played)) {
            return false;
        }
        Suit suit = MultiComboAnalyzer.plainSuitOf(played, trumpInfo);
        if (suit != null) {
            return relevantCards(hand, suit, trumpInfo).size() == played.size();
        }
        for (Card card : played) {
            if (!trumpInfo.isTrump(card)) {
                return false;
            }
        }
        return true;
    }

    static PlayCheck checkFollow(List<Card> played, List<Card> lead, List<Card> hand, TrumpInfo trumpInfo) {
        if (played.size() != lead.size()) {
            return PlayCheck.rejected("must play " + lead.size() + " cards, not " + played.size());
        }
        Suit leadSuit = trumpInfo.isTrump(lead.get(0)) ? null : lead.get(0).getSuit();
        List<Card> relevant = relevantCards(hand, leadSuit, trumpInfo);
        ComboType leadType = ComboClassifier.getComboType(lead, trumpInfo);
        if (!leadType.isStraight()) {
            return checkMultiComboFollow(played, lead, relevant, trumpInfo);
        }

        Set<String> relevantIds = Combo.idsOf(relevant);
        List<Card> playedRelevant = new ArrayList<>();
        for (Card card : played) {
            if (relevantIds.contains(card.getId())) {
                playedRelevant.add(card);
            }
        }

        if (relevant.size() >= lead.size()) {
            boolean canMatch = false;
            for (Combo combo : ComboClassifier.identifyCombos(relevant, trumpInfo)) {
                if (combo.getType() == leadType && combo.size() == lead.size()) {
                    canMatch = true;
                    if (combo.hasSameCards(played)) {
                        return PlayCheck.ok();
                    }
                }
            }
            if (canMatch) {
                return PlayCheck.rejected("must follow with a matching " + leadType);
            }
            if (playedRelevant.size() != played.size()) {
                return PlayCheck.rejected("must follow the led suit");
            }
            return checkPairs(playedRelevant, relevant, lead, trumpInfo);
        }

        if (!relevant.isEmpty()) {
            if (playedRelevant.size() != relevant.size()) {
                return PlayCheck.rejected("must play every remaining card of the led suit");
            }
            return checkPairs(playedRelevant, relevant, lead, trumpInfo);
        }
        return PlayCheck.ok();
    }

    /**
     * Applies tractor-following priority to the led-suit part of a play.
     * <p>
     * A straight lead is all pairs, and the led-suit part is either exactly the lead's
     * length or every led-suit card held. Playing the required number of whole pairs
     * therefore leaves no room to split one, so this count also keeps same-suit pairs
     * together.
     */
    private static PlayCheck checkPairs(
            List<Card> playedRelevant, List<Card> relevant, List<Card> lead, TrumpInfo trumpInfo) {
        int leadPairs = MultiComboAnalyzer.analyzeComboStructure(lead, trumpInfo).totalPairs();
        int relevantPairs = ComboClassifier.pairsIn(relevant).size();
        int required = Math.min(Math.min(leadPairs, relevantPairs), playedRelevant.size() / 2);
        int playedPairs = ComboClassifier.pairsIn(playedRelevant).size();
        if (playedPairs < required) {
            return PlayCheck.rejected("must play " + required + " pair(s) of the led suit, played " + playedPairs);
        }
        return PlayCheck.ok();
    }

    private static PlayCheck checkMultiComboFollow(
            List<Card> played, List<Card> lead, List<Card> relevant, TrumpInfo trumpInfo) {
        Set<String> playedIds = Combo.idsOf(played);
        if (playedIds.containsAll(Combo.idsOf(relevant))) {
            return PlayCheck.ok();
        }
        if (relevant.size() < lead.size()) {
            return PlayCheck.rejected("must play every remaining card of the led suit");
        }
        if (!Combo.idsOf(relevant).containsAll(playedIds)) {
            return PlayCheck.rejected("must follow the led suit");
        }

        ComboStructure leadStructure = MultiComboAnalyzer.analyzeComboStructure(lead, trumpInfo);
        ComboStructure best = MultiComboAnalyzer.analyzeComboStructure(relevant, trumpInfo);
        ComboStructure actual = MultiComboAnalyzer.analyzeComboStructure(played, trumpInfo);
        // What the follower could fit into a play of the lead's length.
        int pairBudget = lead.size() / 2;
        int requiredPairs = Math.min(leadStructure.totalPairs(), Math.min(best.totalPairs(), pairBudget));
        int requiredTractorPairs = Math.min(
                leadStructure.tractorPairs(), maxTractorPairsWithin(best.tractorSizes(), pairBudget));
        if (actual.totalPairs() < requiredPairs) {
            return PlayCheck.rejected("must play " + requiredPairs + " pair(s), played " + actual.totalPairs());
        }
        if (actual.tractorPairs() < requiredTractorPairs) {
            return PlayCheck.rejected("must play " + requiredTractorPairs + " tractor pair(s), played "
                    + actual.tractorPairs());
        }
        return PlayCheck.ok();
    }

    /**
     * Returns the most tractor pairs that fit into {@code pairBudget} pairs, taking from each
     * tractor either nothing or a run of at least two of its pairs.
     *
     * @param tractorSizes pair counts of the tractors held
     * @param pairBudget pairs available in the play
     */
    static int maxTractorPairsWithin(List<Integer> tractorSizes, int pairBudget) {
        boolean[] reachable = new boolean[pairBudget + 1];
        reachable[0] = true;
        for (int size : tractorSizes) {
            boolean[] next = reachable.clone();
            for (int used = 0; used <= pairBudget; used++) {
                if (!reachable[used]) {
                    continue;
                }
                for (int take = 2; take <= size && used + take <= pairBudget; take++) {
                    next[used + take] = true;
                }
            }
            reachable = next;
        }
        for (int pairs = pairBudget; pairs > 0; pairs--) {
            if (reachable[pairs]) {
                return pairs;
            }
        }
        return 0;
    }

    /**
     * Returns the cards of {@code hand} that follow a lead: cards of the plain suit, or all
     * trump cards when {@code suit} is {@code null}.
     */
    public static List<Card> relevantCards(List<Card> hand, Suit suit, TrumpInfo trumpInfo) {
        List<Card> relevant = new ArrayList<>();
        for (Card card : hand) {
            boolean trump = trumpInfo.isTrump(card);
            if (suit == null ? trump : !trump && card.getSuit() == suit) {
                relevant.add(card);
            }
        }
        return relevant;
    }

    private static boolean distinctLogicalCards(List<Card> cards) {
        Set<String> commonIds = new HashSet<>();
        for (Card card : cards) {
            if (!commonIds.add(card.getCommonId())) {
                return false;
            }
        }
        return true;
    }
}
