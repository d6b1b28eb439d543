package ai.tractor.rules;

import ai.tractor.game.Card;
import ai.tractor.game.JokerType;
import ai.tractor.game.Suit;
import ai.tractor.game.TrumpInfo;
import java.util.List;

/**
 * Trump-adjusted ordering of cards.
 * <p>
 * <strong>Strength order</strong>, high to low:
 * <ol>
 *   <li>Big joker</li>
 *   <li>Small joker</li>
 *   <li>Trump rank in the trump suit</li>
 *   <li>Trump rank in the other suits (all equal to each other)</li>
 *   <li>Remaining trump-suit cards by rank</li>
 *   <li>Plain-suit cards by rank, trump rank removed</li>
 * </ol>
 * Only two trump cards, or two cards of one plain suit, are comparable. Anything else is
 * a caller bug and raises {@link IllegalArgumentException}.
 * <p>
 * <strong>Tractor rank</strong> projects each card onto one integer such that two pairs are
 * tractor neighbours iff their tractor ranks differ by one within one
 * {@link TractorContext}. Plain ranks below the trump rank move up one step to close the
 * gap the trump rank leaves, and each suit lives in its own band of a hundred.
 */
public final class CardOrdering {
    /** Tractor rank of the big joker. */
    static final int BIG_JOKER_TRACTOR_RANK = 1020;
    /** Tractor rank of the small joker. */
    static final int SMALL_JOKER_TRACTOR_RANK = 1019;
    /** Tractor rank of the trump rank in the trump suit. */
    static final int TRUMP_SUIT_RANK_TRACTOR_RANK = 1017;
    /** Tractor rank of the trump rank in the other suits. */
    static final int OFF_SUIT_RANK_TRACTOR_RANK = 1016;

    private static final int TRUMP_SUIT_BAND = 1000;

    private CardOrdering() {
    }

    /**
     * Compares two comparable cards.
     *
     * @return -1, 0 or 1
     * @throws IllegalArgumentException if the cards are neither both trump nor of one plain suit
     */
    public static int compareCards(Card a, Card b, TrumpInfo trumpInfo) {
        requireComparable(a, b, trumpInfo);
        return Integer.signum(Integer.compare(strength(a, trumpInfo), strength(b, trumpInfo)));
    }

    /**
     * Returns {@code true} if the two cards may be compared with {@link #compareCards}.
     */
    public static boolean areComparable(Card a, Card b, TrumpInfo trumpInfo) {
        boolean aTrump = trumpInfo.isTrump(a);
        boolean bTrump = trumpInfo.isTrump(b);
        if (aTrump || bTrump) {
            return aTrump && bTrump;
        }
        return a.getSuit() == b.getSuit();
    }

    /**
     * Returns the trump hierarchy level of a card: 5 big joker, 4 small joker, 3 trump rank
     * in trump suit, 2 trump rank off suit, 1 trump suit, 0 plain.
     */
    public static int trumpLevel(Card card, TrumpInfo trumpInfo) {
        if (card.getJoker() == JokerType.BIG) {
            return 5;
        }
        if (card.getJoker() == JokerType.SMALL) {
            return 4;
        }
        if (card.getRank() == trumpInfo.getTrumpRank()) {
            return card.getSuit() == trumpInfo.getTrumpSuit() ? 3 : 2;
        }
        if (trumpInfo.hasTrumpSuit() && card.getSuit() == trumpInfo.getTrumpSuit()) {
            return 1;
        }
        return 0;
    }

    /**
     * Returns a strength value that agrees with {@link #compareCards} on every comparable
     * pair. Values of cards from different plain suits mean nothing relative to each other.
     */
    public static int strength(Card card, TrumpInfo trumpInfo) {
        int level = trumpLevel(card, trumpInfo);
        switch (level) {
            case 0:
                return card.getRank().getValue();
            case 1:
                return 900 + card.getRank().getValue();
            default:
                return 940 + level * 10;
        }
    }

    /**
     * Returns the tractor rank of a card.
     */
    public static int tractorRank(Card card, TrumpInfo trumpInfo) {
        if (card.getJoker() == JokerType.BIG) {
            return BIG_JOKER_TRACTOR_RANK;
        }
        if (card.getJoker() == JokerType.SMALL) {
            return SMALL_JOKER_TRACTOR_RANK;
        }
        if (card.getRank() == trumpInfo.getTrumpRank()) {
            return card.getSuit() == trumpInfo.getTrumpSuit()
                    ? TRUMP_SUIT_RANK_TRACTOR_RANK
                    : OFF_SUIT_RANK_TRACTOR_RANK;
        }
        int rankValue = card.getRank().getValue();
        if (rankValue < trumpInfo.getTrumpRank().getValue()) {
            rankValue++;
        }
        return rankValue + suitBand(card.getSuit(), trumpInfo);
    }

    /**
     * Returns the group of cards a card may form tractors with.
     */
    public static TractorContext tractorContext(Card card, TrumpInfo trumpInfo) {
        if (card.isJoker()) {
            return TractorContext.JOKER;
        }
        if (card.getRank() == trumpInfo.getTrumpRank()) {
            return TractorContext.TRUMP_RANK;
        }
        return TractorContext.of(card.getSuit());
    }

    /**
     * Returns the highest card of a non-empty, mutually comparable set.
     */
    static Card highest(List<Card> cards, TrumpInfo trumpInfo) {
        if (cards.isEmpty()) {
            throw new IllegalArgumentException("highest() of an empty card list");
        }
        Card best = cards.get(0);
        for (int i = 1; i < cards.size(); i++) {
            if (compareCards(cards.get(i), best, trumpInfo) > 0) {
                best = cards.get(i);
            }
        }
        return best;
    }

    private static int suitBand(Suit suit, TrumpInfo trumpInfo) {
        if (suit == trumpInfo.getTrumpSuit()) {
            return TRUMP_SUIT_BAND;
        }
        return switch (suit) {
            case SPADES -> 0;
            case HEARTS -> 100;
            case CLUBS -> 200;
            case DIAMONDS -> 300;
        };
    }

    private static void requireComparable(Card a, Card b, TrumpInfo trumpInfo) {
        if (!areComparable(a, b, trumpInfo)) {
            throw new IllegalArgumentException(
                    "Cannot compare " + a + " with " + b + " under " + trumpInfo
                            + ": only two trumps or two cards of one plain suit are comparable");
        }
    }
}
