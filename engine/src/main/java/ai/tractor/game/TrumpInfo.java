package ai.tractor.game;

import java.util.Objects;

/**
 * The trump declaration for one round: a trump rank, which is always set, and an
 * optional trump suit ({@code null} while undeclared or when no suit was declared).
 * <p>
 * A card is trump iff it is a joker, its rank is the trump rank, or its suit is the
 * trump suit. Trump status is always derived from this object and never stored on cards.
 */
public final class TrumpInfo {
    private final Rank trumpRank;
    private final Suit trumpSuit;

    public TrumpInfo(Rank trumpRank, Suit trumpSuit) {
        this.trumpRank = Objects.requireNonNull(trumpRank, "trumpRank");
        this.trumpSuit = trumpSuit;
    }

    public Rank getTrumpRank() {
        return trumpRank;
    }

    /**
     * @return the trump suit, or {@code null} if none is declared
     */
    public Suit getTrumpSuit() {
        return trumpSuit;
    }

    public boolean hasTrumpSuit() {
        return trumpSuit != null;
    }

    public boolean isTrump(Card card) {
        return card.isJoker() || card.getRank() == trumpRank || (trumpSuit != null && card.getSuit() == trumpSuit);
    }

    /**
     * Returns {@code true} if {@code suit} is a plain (non-trump) suit under this declaration.
     */
    public boolean isPlainSuit(Suit suit) {
        return suit != null && suit != trumpSuit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrumpInfo)) {
            return false;
        }
        TrumpInfo that = (TrumpInfo) o;
        return trumpRank == that.trumpRank && trumpSuit == that.trumpSuit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(trumpRank, trumpSuit);
    }

    @Override
    public String toString() {
        return "Trump(" + trumpRank + (trumpSuit == null ? "" : trumpSuit.getSymbol()) + ")";
    }
}
