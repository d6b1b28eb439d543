package ai.tractor.rules;

import ai.tractor.game.Suit;

/**
 * Groups of cards within which pairs may chain into tractors: the jokers, all trump-rank
 * cards across suits, and each suit's remaining cards.
 */
public enum TractorContext {
    JOKER,
    TRUMP_RANK,
    SPADES,
    HEARTS,
    CLUBS,
    DIAMONDS;

    static TractorContext of(Suit suit) {
        return switch (suit) {
            case SPADES -> SPADES;
            case HEARTS -> HEARTS;
            case CLUBS -> CLUBS;
            case DIAMONDS -> DIAMONDS;
        };
    }
}
