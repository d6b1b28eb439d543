package ai.tractor;

import ai.tractor.config.RulesProperties;
import ai.tractor.game.Card;
import ai.tractor.game.GameState;
import ai.tractor.game.PlayerId;
import ai.tractor.game.Suit;
import ai.tractor.game.Trick;
import ai.tractor.game.TrumpInfo;
import ai.tractor.rules.Combo;
import ai.tractor.rules.ComboType;
import ai.tractor.rules.LeadingMultiComboValidation;
import ai.tractor.rules.PlayCheck;
import ai.tractor.rules.PlayRules;
import ai.tractor.rules.TrickEvaluator;
import ai.tractor.rules.UnbeatableComboEvaluator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Spring-facing wrapper around {@link PlayRules} that applies the table options from
 * {@link RulesProperties}.
 */
@Component
public class PlayValidationService {
    private static final Logger log = LoggerFactory.getLogger(PlayValidationService.class);

    private final RulesProperties properties;

    public PlayValidationService(RulesProperties properties) {
        this.properties = properties;
    }

    public boolean isValidPlay(List<Card> played, List<Card> hand, PlayerId playerId, GameState state) {
        return checkPlay(played, hand, playerId, state).legal();
    }

    public PlayCheck checkPlay(List<Card> played, List<Card> hand, PlayerId playerId, GameState state) {
        PlayCheck check = PlayRules.checkPlay(played, hand, playerId, effective(state));
        if (!check.legal() && properties.isTraceRejections()) {
            log.info("Illegal play by {}: {} ({})", playerId, played, check.reason());
        }
        return check;
    }

    public ComboType getComboType(List<Card> cards, TrumpInfo trumpInfo) {
        return PlayRules.getComboType(cards, trumpInfo);
    }

    public LeadingMultiComboValidation validateLeadingMultiCombo(List<Card> cards, GameState state, PlayerId playerId) {
        return PlayRules.validateLeadingMultiCombo(cards, effective(state), playerId);
    }

    /**
     * Whether {@code playerId} can lead {@code combo} in {@code suit} without it being beaten.
     */
    public boolean isComboUnbeatable(Combo combo, Suit suit, PlayerId playerId, GameState state) {
        return UnbeatableComboEvaluator.isComboUnbeatable(combo, suit, effective(state), playerId);
    }

    /**
     * Cards of {@code suit} the AI can lead without being beaten.
     */
    public List<Card> unbeatableCardsInSuit(Suit suit, PlayerId playerId, GameState state) {
        GameState view = effective(state);
        return UnbeatableComboEvaluator.unbeatableCardsInSuit(suit, view.getPlayer(playerId).getHand(), view, playerId);
    }

    public PlayerId winningPlayer(Trick trick, TrumpInfo trumpInfo) {
        return TrickEvaluator.winningPlayer(trick, trumpInfo);
    }

    /**
     * The state as the engine should see it. With the kitty hidden from the round starter
     * this is a non-standard table rule.
     */
    private GameState effective(GameState state) {
        return properties.isKittyVisibleToRoundStarter() ? state : state.withoutKitty();
    }
}
