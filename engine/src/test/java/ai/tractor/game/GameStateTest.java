package ai.tractor.game;

import static ai.tractor.unit.helpers.Cards.cards;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.tractor.unit.helpers.GameStateBuilder;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class GameStateTest {

    @Test
    void kittyIsOnlyVisibleToRoundStarter() {
        GameState state = GameStateBuilder.withTrump(Rank.TWO, Suit.HEARTS)
                .kitty(cards("A♦", "K♦"))
                .roundStarter(PlayerId.BOT2)
                .build();

        assertEquals(2, state.getKittyVisibleTo(PlayerId.BOT2).size());
        assertTrue(state.getKittyVisibleTo(PlayerId.HUMAN).isEmpty());
        assertTrue(state.withoutKitty().getKittyVisibleTo(PlayerId.BOT2).isEmpty());
    }

    @Test
    void otherPlayersExcludeSelf() {
        GameState state = GameStateBuilder.withTrump(Rank.TWO, null).build();
        assertEquals(List.of(PlayerId.HUMAN, PlayerId.BOT2, PlayerId.BOT3), state.getOtherPlayerIds(PlayerId.BOT1));
    }

    @Test
    void roundStarterMustBeSeated() {
        assertThrows(IllegalArgumentException.class, () -> new GameState(
                Collections.emptyList(), new TrumpInfo(Rank.TWO, null), null,
                Collections.emptyList(), Collections.emptyList(), 0));
    }

    @Test
    void leadingComboComesFromCurrentTrick() {
        GameState between = GameStateBuilder.withTrump(Rank.TWO, Suit.HEARTS).build();
        assertTrue(between.getLeadingCombo().isEmpty());

        GameState during = GameStateBuilder.withTrump(Rank.TWO, Suit.HEARTS)
                .currentTrick(PlayerId.BOT3, cards("9♣"))
                .build();
        assertEquals(cards("9♣"), during.getLeadingCombo());
    }
}
