package ai.tractor.rules;

import ai.tractor.game.PlayerId;
import java.util.List;

/**
 * Outcome of checking a leading multi-combo, with enough detail to explain a rejection.
 *
 * @param valid whether the lead is allowed
 * @param invalidReasons human-readable reasons, empty when valid
 * @param voidStatus which opponents are known to be out of the led suit
 * @param unbeatableStatus which components some opponent might still beat
 */
public record LeadingMultiComboValidation(
        boolean valid,
        List<String> invalidReasons,
        VoidStatus voidStatus,
        UnbeatableStatus unbeatableStatus) {

    public LeadingMultiComboValidation {
        invalidReasons = List.copyOf(invalidReasons);
    }

    /**
     * @param allOpponentsVoid every other player is known to be out of the suit
     * @param voidPlayers the players known to be out of the suit
     */
    public record VoidStatus(boolean allOpponentsVoid, List<PlayerId> voidPlayers) {
        public VoidStatus {
            voidPlayers = List.copyOf(voidPlayers);
        }
    }

    /**
     * @param allUnbeatable no component can be beaten by the unseen cards
     * @param beatableComponents the components that could be beaten
     */
    public record UnbeatableStatus(boolean allUnbeatable, List<BeatableComponent> beatableComponents) {
        public UnbeatableStatus {
            beatableComponents = List.copyOf(beatableComponents);
        }
    }

    public record BeatableComponent(Combo combo, String reason) {
    }
}
