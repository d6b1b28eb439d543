package ai.tractor.rules;

import ai.tractor.game.Card;
import ai.tractor.game.GameState;
import ai.tractor.game.PlayerId;
import ai.tractor.game.Suit;
import ai.tractor.game.TrumpInfo;
import java.util.List;

/**
 * Entry points of the rules engine for the game flow, the AI and the UI.
 * <p>
 * Every method is a pure function of its arguments and may be called from any thread.
 */
public final class PlayRules {
    private PlayRules() {
    }

    public static boolean isValidPlay(List<Card> played, List<Card> hand, PlayerId playerId, GameState state) {
        return PlayValidator.isValidPlay(played, hand, playerId, state);
    }

    public static PlayCheck checkPlay(List<Card> played, List<Card> hand, PlayerId playerId, GameState state) {
        return PlayValidator.check(played, hand, playerId, state);
    }

    public static ComboType getComboType(List<Card> cards, TrumpInfo trumpInfo) {
        return ComboClassifier.getComboType(cards, trumpInfo);
    }

    public static boolean isComboUnbeatable(
            Combo combo,
            Suit suit,
            List<Card> playedCards,
            List<Card> ownHand,
            TrumpInfo trumpInfo,
            List<Card> visibleKitty) {
        return UnbeatableComboEvaluator.isComboUnbeatable(combo, suit, playedCards, ownHand, trumpInfo, visibleKitty);
    }

    public static LeadingMultiComboValidation validateLeadingMultiCombo(
            List<Combo> components, Suit suit, GameState state, PlayerId playerId) {
        return UnbeatableComboEvaluator.validateLeadingMultiCombo(components, suit, state, playerId);
    }

    public static LeadingMultiComboValidation validateLeadingMultiCombo(
            List<Card> cards, GameState state, PlayerId playerId) {
        return UnbeatableComboEvaluator.validateLeadingMultiCombo(cards, state, playerId);
    }
}
