package ai.tractor.rules;

import ai.tractor.game.Card;
import ai.tractor.game.Play;
import ai.tractor.game.PlayerId;
import ai.tractor.game.Trick;
import ai.tractor.game.TrumpInfo;
import java.util.List;

/**
 * Resolves which play currently wins a trick.
 * <p>
 * Only plays entirely in the led suit, or entirely in trump, can win. A play must match the
 * lead's shape to compete, and a trump play that matches the shape beats any plain play.
 * Between two competing plays of one kind, the higher top card wins and the earlier play
 * keeps ties.
 */
public final class TrickEvaluator {
    private TrickEvaluator() {
    }

    /**
     * Returns {@code true} if {@code proposed} takes the trick from {@code currentWinner}.
     *
     * @param proposed a legal follow
     * @param currentWinner the play currently winning; the lead itself at first
     * @param lead the cards that opened the trick
     * @param trumpInfo the round's trump declaration
     */
    public static boolean beats(List<Card> proposed, List<Card> currentWinner, List<Card> lead, TrumpInfo trumpInfo) {
        boolean leadTrump = trumpInfo.isTrump(lead.get(0));
        boolean proposedTrump = allTrump(proposed, trumpInfo);
        boolean proposedInSuit = !leadTrump && MultiComboAnalyzer.plainSuitOf(proposed, trumpInfo) == lead.get(0).getSuit();
        if (!proposedTrump && !proposedInSuit) {
            return false;
        }
        if (!matchesShape(proposed, lead, trumpInfo)) {
            return false;
        }
        boolean winnerTrump = allTrump(currentWinner, trumpInfo);
        if (proposedTrump && !winnerTrump) {
            return true;
        }
        if (!proposedTrump && winnerTrump) {
            return false;
        }
        return topStrength(proposed, trumpInfo) > topStrength(currentWinner, trumpInfo);
    }

    /**
     * Folds the plays of a trick in order and returns the player holding it.
     */
    public static PlayerId winningPlayer(Trick trick, TrumpInfo trumpInfo) {
        List<Play> plays = trick.getPlays();
        if (plays.isEmpty()) {
            return trick.getLeadingPlayerId();
        }
        List<Card> lead = plays.get(0).getCards();
        Play winner = plays.get(0);
        for (int i = 1; i < plays.size(); i++) {
            Play play = plays.get(i);
            if (beats(play.getCards(), winner.getCards(), lead, trumpInfo)) {
                winner = play;
            }
        }
        return winner.getPlayerId();
    }

    private static boolean matchesShape(List<Card> proposed, List<Card> lead, TrumpInfo trumpInfo) {
        ComboType leadType = ComboClassifier.getComboType(lead, trumpInfo);
        if (leadType.isStraight()) {
            return ComboClassifier.getComboType(proposed, trumpInfo) == leadType && proposed.size() == lead.size();
        }
        return MultiComboAnalyzer.matchesRequiredComponents(
                MultiComboAnalyzer.analyzeComboStructure(proposed, trumpInfo),
                MultiComboAnalyzer.analyzeComboStructure(lead, trumpInfo));
    }

    /**
     * Strength of the top card of the play's leading component: the longest tractor, else
     * the highest pair, else the highest single.
     */
    private static int topStrength(List<Card> cards, TrumpInfo trumpInfo) {
        ComboStructure structure = MultiComboAnalyzer.analyzeComboStructure(cards, trumpInfo);
        return structure.components().get(0).getValue();
    }

    private static boolean allTrump(List<Card> cards, TrumpInfo trumpInfo) {
        for (Card card : cards) {
            if (!trumpInfo.isTrump(card)) {
                return false;
            }
        }
        return true;
    }
}
