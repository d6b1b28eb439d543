package ai.tractor.rules;

import static ai.tractor.unit.helpers.Cards.card;
import static ai.tractor.unit.helpers.Cards.cards;
import static ai.tractor.unit.helpers.Cards.concat;
import static ai.tractor.unit.helpers.Cards.pair;
import static ai.tractor.unit.helpers.Cards.pairs;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.tractor.game.Card;
import ai.tractor.game.Deck;
import ai.tractor.game.GameState;
import ai.tractor.game.PlayerId;
import ai.tractor.game.Rank;
import ai.tractor.game.Suit;
import ai.tractor.game.TrumpInfo;
import ai.tractor.unit.helpers.GameStateBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class UnbeatableComboEvaluatorTest {
    private static final TrumpInfo TRUMP = new TrumpInfo(Rank.TWO, Suit.HEARTS);

    private static Combo single(String name) {
        Card card = card(name);
        return new Combo(ComboType.SINGLE, List.of(card), CardOrdering.strength(card, TRUMP));
    }

    private static Combo pairCombo(String name) {
        List<Card> cards = pair(name);
        return new Combo(ComboType.PAIR, cards, CardOrdering.strength(cards.get(0), TRUMP));
    }

    @Test
    void aceSingleCannotBeBeaten() {
        assertTrue(UnbeatableComboEvaluator.isComboUnbeatable(single("A♦"), Suit.DIAMONDS,
                List.of(), cards("A♦"), TRUMP, List.of()));
    }

    @Test
    void kingSingleFallsToUnseenAce() {
        assertFalse(UnbeatableComboEvaluator.isComboUnbeatable(single("K♦"), Suit.DIAMONDS,
                List.of(), cards("K♦"), TRUMP, List.of()));
        assertTrue(UnbeatableComboEvaluator.isComboUnbeatable(single("K♦"), Suit.DIAMONDS,
                cards("A♦", "A♦#1"), cards("K♦"), TRUMP, List.of()));
    }

    @Test
    void pairNeedsBothCopiesUnseenToBeBeaten() {
        // One ace is held, so no ace pair is possible against the king pair.
        assertTrue(UnbeatableComboEvaluator.isComboUnbeatable(pairCombo("K♠"), Suit.SPADES,
                List.of(), concat(pair("K♠"), cards("A♠")), TRUMP, List.of()));
        assertFalse(UnbeatableComboEvaluator.isComboUnbeatable(pairCombo("K♠"), Suit.SPADES,
                List.of(), pair("K♠"), TRUMP, List.of()));
    }

    @Test
    void tractorOnlyFearsLongerOrEqualHigherTractors() {
        List<Card> tractorCards = pairs("J♣", "Q♣");
        Combo tractor = TractorDetector.findAllTractors(tractorCards, TRUMP).get(0);

        assertFalse(UnbeatableComboEvaluator.isComboUnbeatable(tractor, Suit.CLUBS,
                List.of(), tractorCards, TRUMP, List.of()));
        // With one king gone, no K-A tractor is left.
        assertTrue(UnbeatableComboEvaluator.isComboUnbeatable(tractor, Suit.CLUBS,
                cards("K♣"), tractorCards, TRUMP, List.of()));
    }

    @Test
    void kittyCountsOnlyWhenPassed() {
        List<Card> kitty = cards("A♦#1");
        assertFalse(UnbeatableComboEvaluator.isComboUnbeatable(single("K♦"), Suit.DIAMONDS,
                cards("A♦"), cards("K♦"), TRUMP, List.of()));
        assertTrue(UnbeatableComboEvaluator.isComboUnbeatable(single("K♦"), Suit.DIAMONDS,
                cards("A♦"), cards("K♦"), TRUMP, kitty));
    }

    @Test
    void trumpIsNeverUnbeatable() {
        assertFalse(UnbeatableComboEvaluator.isComboUnbeatable(single("BJ"), null,
                List.of(), cards("BJ", "BJ#1"), TRUMP, List.of()));
    }

    @Test
    void seeingMoreCardsNeverMakesAComboBeatable() {
        Combo queen = single("Q♠");
        List<Card> seen = new ArrayList<>();
        boolean unbeatable = false;
        List<Card> spades = new ArrayList<>(Deck.plainSuitCards(Suit.SPADES, TRUMP));
        Collections.reverse(spades);
        for (Card card : spades) {
            seen.add(card);
            boolean now = UnbeatableComboEvaluator.isComboUnbeatable(queen, Suit.SPADES,
                    seen, cards("Q♠"), TRUMP, List.of());
            assertTrue(now || !unbeatable, "became beatable after seeing " + card);
            unbeatable = now;
        }
        assertTrue(unbeatable);
    }

    @Test
    void multiComboWithHigherCardsPlayedIsValid() {
        // The other A♦ and K♦ are already out, so A♦ and K♦ are both top.
        GameState state = GameStateBuilder.withTrump(Rank.TWO, Suit.HEARTS)
                .hand(PlayerId.HUMAN, cards("A♦", "K♦", "5♠"))
                .completedTrick(PlayerId.BOT1, cards("A♦#1"), cards("K♦#1"), cards("3♦"), cards("4♦"))
                .build();

        LeadingMultiComboValidation result =
                UnbeatableComboEvaluator.validateLeadingMultiCombo(cards("A♦", "K♦"), state, PlayerId.HUMAN);

        assertTrue(result.valid());
        assertTrue(result.invalidReasons().isEmpty());
        assertTrue(result.unbeatableStatus().allUnbeatable());
        assertFalse(result.voidStatus().allOpponentsVoid());
    }

    @Test
    void multiComboWithUnseenAceIsInvalid() {
        GameState state = GameStateBuilder.withTrump(Rank.TWO, Suit.HEARTS)
                .hand(PlayerId.HUMAN, cards("A♦", "K♦", "5♠"))
                .build();

        LeadingMultiComboValidation result =
                UnbeatableComboEvaluator.validateLeadingMultiCombo(cards("A♦", "K♦"), state, PlayerId.HUMAN);

        assertFalse(result.valid());
        assertEquals(1, result.unbeatableStatus().beatableComponents().size());
        assertEquals(card("K♦"), result.unbeatableStatus().beatableComponents().get(0).combo().getCards().get(0));
        assertFalse(result.invalidReasons().isEmpty());
    }

    @Test
    void allOpponentsVoidMakesAnyMultiComboValid() {
        GameState state = GameStateBuilder.withTrump(Rank.TWO, Suit.HEARTS)
                .hand(PlayerId.HUMAN, cards("9♦", "7♦", "5♠"))
                .completedTrick(PlayerId.HUMAN, cards("3♦"), cards("5♣"), cards("6♣"), cards("7♣"))
                .build();

        LeadingMultiComboValidation result =
                UnbeatableComboEvaluator.validateLeadingMultiCombo(cards("9♦", "7♦"), state, PlayerId.HUMAN);

        assertTrue(result.valid());
        assertTrue(result.voidStatus().allOpponentsVoid());
        assertEquals(3, result.voidStatus().voidPlayers().size());
        assertFalse(result.unbeatableStatus().allUnbeatable());
    }

    @Test
    void trumpMultiComboIsRejected() {
        GameState state = GameStateBuilder.withTrump(Rank.TWO, Suit.HEARTS)
                .hand(PlayerId.HUMAN, cards("BJ", "SJ"))
                .build();

        assertFalse(UnbeatableComboEvaluator.validateLeadingMultiCombo(cards("BJ", "SJ"), state, PlayerId.HUMAN).valid());
    }

    @Test
    void unbeatableCardsInSuitUsesRoundStartersKitty() {
        GameState state = GameStateBuilder.withTrump(Rank.TWO, Suit.HEARTS)
                .hand(PlayerId.HUMAN, cards("A♦", "K♦", "Q♦"))
                .kitty(cards("A♦#1"))
                .roundStarter(PlayerId.HUMAN)
                .build();
        List<Card> hand = state.getPlayer(PlayerId.HUMAN).getHand();

        assertEquals(cards("A♦", "K♦"), UnbeatableComboEvaluator.unbeatableCardsInSuit(Suit.DIAMONDS, hand, state, PlayerId.HUMAN));
        assertEquals(cards("A♦"),
                UnbeatableComboEvaluator.unbeatableCardsInSuit(Suit.DIAMONDS, hand, state.withoutKitty(), PlayerId.HUMAN));
        assertTrue(UnbeatableComboEvaluator.unbeatableCardsInSuit(Suit.HEARTS, hand, state, PlayerId.HUMAN).isEmpty());
    }
}
