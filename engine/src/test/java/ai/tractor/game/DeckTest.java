package ai.tractor.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DeckTest {

    @Test
    void doubleDeckHasTwoCopiesOfEveryCard() {
        assertEquals(Deck.SIZE, Deck.allCards().size());

        Set<String> ids = new HashSet<>();
        Map<String, Integer> copies = new HashMap<>();
        for (Card card : Deck.allCards()) {
            ids.add(card.getId());
            copies.merge(card.getCommonId(), 1, Integer::sum);
        }
        assertEquals(108, ids.size());
        assertEquals(54, copies.size());
        for (int count : copies.values()) {
            assertEquals(2, count);
        }
    }

    @Test
    void plainSuitCardsSkipTheTrumpRank() {
        List<Card> spades = Deck.plainSuitCards(Suit.SPADES, new TrumpInfo(Rank.SEVEN, Suit.HEARTS));

        assertEquals(24, spades.size());
        for (Card card : spades) {
            assertEquals(Suit.SPADES, card.getSuit());
            assertFalse(card.getRank() == Rank.SEVEN);
        }
    }
}
