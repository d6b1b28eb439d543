package ai.tractor.rules;

import static ai.tractor.unit.helpers.Cards.card;
import static ai.tractor.unit.helpers.Cards.cards;
import static ai.tractor.unit.helpers.Cards.concat;
import static ai.tractor.unit.helpers.Cards.pair;
import static ai.tractor.unit.helpers.Cards.pairs;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.tractor.game.Card;
import ai.tractor.game.Rank;
import ai.tractor.game.Suit;
import ai.tractor.game.TrumpInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ComboClassifierTest {
    private static final TrumpInfo TRUMP = new TrumpInfo(Rank.TWO, Suit.HEARTS);

    @Test
    void singlesPairsAndTractors() {
        assertEquals(ComboType.SINGLE, ComboClassifier.getComboType(cards("K♠"), TRUMP));
        assertEquals(ComboType.PAIR, ComboClassifier.getComboType(pair("K♠"), TRUMP));
        assertEquals(ComboType.TRACTOR, ComboClassifier.getComboType(pairs("Q♠", "K♠"), TRUMP));
        assertEquals(ComboType.TRACTOR, ComboClassifier.getComboType(pairs("J♠", "Q♠", "K♠"), TRUMP));
    }

    @Test
    void emptyAndLooseSetsAreNotStraight() {
        assertEquals(ComboType.NOT_A_STRAIGHT_COMBO, ComboClassifier.getComboType(List.of(), TRUMP));
        assertEquals(ComboType.NOT_A_STRAIGHT_COMBO, ComboClassifier.getComboType(cards("A♦", "K♦"), TRUMP));
        assertEquals(ComboType.NOT_A_STRAIGHT_COMBO, ComboClassifier.getComboType(pairs("9♠", "J♠"), TRUMP));
        assertEquals(ComboType.NOT_A_STRAIGHT_COMBO,
                ComboClassifier.getComboType(concat(pairs("Q♠", "K♠"), cards("3♠")), TRUMP));
    }

    @Test
    void sameRankDifferentSuitsIsNotAPair() {
        assertEquals(ComboType.NOT_A_STRAIGHT_COMBO, ComboClassifier.getComboType(cards("2♠", "2♣"), TRUMP));
        assertEquals(ComboType.NOT_A_STRAIGHT_COMBO, ComboClassifier.getComboType(cards("SJ", "BJ"), TRUMP));
    }

    @Test
    void sameCopyTwiceIsNotAPair() {
        assertEquals(ComboType.NOT_A_STRAIGHT_COMBO, ComboClassifier.getComboType(List.of(card("K♠"), card("K♠")), TRUMP));
    }

    @Test
    void classificationIgnoresOrder() {
        List<Card> tractor = new ArrayList<>(concat(pair("SJ"), pair("BJ")));
        Random random = new Random(3);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(tractor, random);
            assertEquals(ComboType.TRACTOR, ComboClassifier.getComboType(tractor, TRUMP));
        }
    }

    @Test
    void identifyCombosListsOverlappingCombos() {
        List<Combo> combos = ComboClassifier.identifyCombos(concat(pairs("Q♠", "K♠"), cards("A♠")), TRUMP);

        assertEquals(5, count(combos, ComboType.SINGLE));
        assertEquals(2, count(combos, ComboType.PAIR));
        assertEquals(1, count(combos, ComboType.TRACTOR));
    }

    @Test
    void pairsInIgnoresLoneCopies() {
        assertEquals(1, ComboClassifier.pairsIn(concat(pair("9♣"), cards("10♣", "J♣"))).size());
    }

    private static long count(List<Combo> combos, ComboType type) {
        return combos.stream().filter(c -> c.getType() == type).count();
    }
}
