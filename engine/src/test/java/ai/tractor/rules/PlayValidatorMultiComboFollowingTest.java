package ai.tractor.rules;

import static ai.tractor.unit.helpers.Cards.cards;
import static ai.tractor.unit.helpers.Cards.concat;
import static ai.tractor.unit.helpers.Cards.pair;
import static ai.tractor.unit.helpers.Cards.pairs;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.tractor.game.Card;
import ai.tractor.game.GameState;
import ai.tractor.game.PlayerId;
import ai.tractor.game.Rank;
import ai.tractor.game.Suit;
import ai.tractor.unit.helpers.GameStateBuilder;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Following a multi-combo lead: exhaustion first, then the structure check.
 */
class PlayValidatorMultiComboFollowingTest {

    private static GameState following(List<Card> lead, List<Card> hand) {
        return GameStateBuilder.withTrump(Rank.TWO, Suit.HEARTS)
                .hand(PlayerId.HUMAN, hand)
                .currentTrick(PlayerId.BOT3, lead)
                .build();
    }

    private static boolean follow(List<Card> played, GameState state) {
        return PlayValidator.isValidPlay(played, state.getPlayer(PlayerId.HUMAN).getHand(), PlayerId.HUMAN, state);
    }

    @Test
    void exhaustingTheSuitIsAlwaysLegal() {
        GameState state = following(cards("A♦", "K♦"), cards("3♦", "5♦", "9♣"));
        assertTrue(follow(cards("3♦", "5♦"), state));
    }

    @Test
    void exhaustingTheSuitWithFillers() {
        GameState state = following(cards("A♦", "K♦", "Q♦"), cards("3♦", "9♣", "10♣", "J♣"));

        assertTrue(follow(cards("3♦", "9♣", "10♣"), state));
        assertFalse(follow(cards("9♣", "10♣", "J♣"), state));
    }

    @Test
    void mustStayInSuitWhileHoldingMore() {
        GameState state = following(cards("A♦", "K♦"), cards("3♦", "5♦", "7♦", "9♣"));

        assertTrue(follow(cards("3♦", "5♦"), state));
        assertFalse(follow(cards("3♦", "9♣"), state));
    }

    @Test
    void pairsInTheLeadMustBeMatchedWhenHeld() {
        GameState state = following(concat(pair("9♠"), cards("A♠")), concat(pair("5♠"), cards("7♠", "8♠", "3♣")));

        assertTrue(follow(concat(pair("5♠"), cards("7♠")), state));
        assertFalse(follow(cards("5♠", "7♠", "8♠"), state));
    }

    @Test
    void tractorPairsInTheLeadMustBeMatchedWhenHeld() {
        List<Card> lead = concat(pair("9♠"), pair("10♠"), cards("A♠"));
        List<Card> hand = concat(pair("4♠"), pair("5♠"), pair("Q♠"), cards("3♠"));
        GameState state = following(lead, hand);

        assertTrue(follow(concat(pair("4♠"), pair("5♠"), cards("3♠")), state));
        assertFalse(follow(concat(pair("4♠"), pair("Q♠"), cards("3♠")), state));
    }

    @Test
    void withoutPairsAnyCardsOfTheSuit() {
        GameState state = following(concat(pair("9♠"), cards("A♠")), cards("4♠", "6♠", "8♠", "J♠"));
        assertTrue(follow(cards("4♠", "6♠", "J♠"), state));
    }

    @Test
    void tractorDemandIsCappedByWhatFitsInTheLeadLength() {
        // Lead: a three-pair tractor and a single. The follower's two short tractors cannot
        // both fit into seven cards with a third pair, so two tractor pairs is the most owed.
        List<Card> lead = concat(pairs("3♠", "4♠", "5♠"), cards("K♠"));
        List<Card> hand = concat(pairs("7♠", "8♠", "J♠", "Q♠"), cards("9♠", "10♠", "3♣"));
        GameState state = following(lead, hand);

        assertTrue(follow(concat(pairs("7♠", "8♠", "J♠"), cards("9♠")), state));
        assertFalse(follow(concat(pairs("7♠", "8♠"), cards("9♠", "10♠", "J♠")), state));
        assertTrue(legalFollowCount(hand, lead.size(), state) > 0);
    }

    @Test
    void tractorPairsFitIntoTheBudget() {
        assertEquals(2, PlayValidator.maxTractorPairsWithin(List.of(2, 2), 3));
        assertEquals(4, PlayValidator.maxTractorPairsWithin(List.of(3, 2), 4));
        assertEquals(0, PlayValidator.maxTractorPairsWithin(List.of(3), 1));
        assertEquals(5, PlayValidator.maxTractorPairsWithin(List.of(3, 2), 6));
    }

    private static int legalFollowCount(List<Card> hand, int length, GameState state) {
        List<List<Card>> selections = new ArrayList<>();
        choose(hand, length, 0, new ArrayList<>(), selections);
        int legal = 0;
        for (List<Card> selection : selections) {
            if (follow(selection, state)) {
                legal++;
            }
        }
        return legal;
    }

    private static void choose(List<Card> hand, int length, int start, List<Card> current, List<List<Card>> out) {
        if (current.size() == length) {
            out.add(new ArrayList<>(current));
            return;
        }
        for (int i = start; i < hand.size(); i++) {
            current.add(hand.get(i));
            choose(hand, length, i + 1, current, out);
            current.remove(current.size() - 1);
        }
    }
}
