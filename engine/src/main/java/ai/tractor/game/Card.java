package ai.tractor.game;

import java.util.Objects;

/**
 * Represents one physical card of the double deck.
 * <p>
 * A regular card has a {@link Rank} and a {@link Suit}; a joker has neither and carries a
 * {@link JokerType} instead. Because two decks are shuffled together, every logical card
 * exists twice. The two copies share a {@link #getCommonId() commonId} (e.g. "Spades_A")
 * and differ in their {@link #getId() id} (e.g. "Spades_A_0" and "Spades_A_1").
 * <p>
 * Pairs are formed only by two cards with the same commonId, never by equal ranks of
 * different suits. Cards are immutable and compare equal by instance id.
 */
public final class Card {
    /** The suit of this card, or {@code null} for jokers. */
    private final Suit suit;
    /** The rank of this card, or {@code null} for jokers. */
    private final Rank rank;
    /** The joker type, or {@code null} for regular cards. */
    private final JokerType joker;
    /** Which of the two decks this copy came from (0 or 1). */
    private final int deckId;
    /** Identity shared by both copies. */
    private final String commonId;
    /** Unique identity of this physical copy. */
    private final String id;

    private Card(Suit suit, Rank rank, JokerType joker, int deckId) {
        if (deckId != 0 && deckId != 1) {
            throw new IllegalArgumentException("deckId must be 0 or 1: " + deckId);
        }
        this.suit = suit;
        this.rank = rank;
        this.joker = joker;
        this.deckId = deckId;
        this.commonId = joker != null
                ? joker.getIdName() + "_Joker"
                : suit.getIdName() + "_" + rank.getLabel();
        this.id = commonId + "_" + deckId;
    }

    /**
     * Creates a regular card.
     *
     * @param rank the rank (must not be null)
     * @param suit the suit (must not be null)
     * @param deckId 0 or 1
     * @return the card
     */
    public static Card of(Rank rank, Suit suit, int deckId) {
        return new Card(Objects.requireNonNull(suit, "suit"), Objects.requireNonNull(rank, "rank"), null, deckId);
    }

    /**
     * Creates a joker.
     *
     * @param type small or big
     * @param deckId 0 or 1
     * @return the joker
     */
    public static Card joker(JokerType type, int deckId) {
        return new Card(null, null, Objects.requireNonNull(type, "type"), deckId);
    }

    public Suit getSuit() {
        return suit;
    }

    public Rank getRank() {
        return rank;
    }

    public JokerType getJoker() {
        return joker;
    }

    public int getDeckId() {
        return deckId;
    }

    /**
     * Returns the identity shared by both physical copies of this card.
     *
     * @return e.g. "Hearts_10" or "Small_Joker"
     */
    public String getCommonId() {
        return commonId;
    }

    /**
     * Returns the unique identity of this physical copy.
     *
     * @return e.g. "Hearts_10_1"
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the points this card is worth when captured.
     *
     * @return 5, 10 or 0
     */
    public int getPoints() {
        return rank == null ? 0 : rank.getPoints();
    }

    public boolean isJoker() {
        return joker != null;
    }

    /**
     * Checks whether this card and {@code other} are the two copies of one logical card
     * (or the same copy). Only such cards may form a pair.
     *
     * @param other the card to compare with
     * @return {@code true} if both share a commonId
     */
    public boolean isIdenticalTo(Card other) {
        return other != null && commonId.equals(other.commonId);
    }

    /**
     * Returns a short representation of this card.
     * <p>
     * The format is the rank label followed by the suit symbol (e.g., "Q♠", "10♦"),
     * or "SJ"/"BJ" for jokers.
     *
     * @return the short name of the card
     */
    public String shortName() {
        if (joker != null) {
            return joker.getLabel();
        }
        return rank.getLabel() + suit.getSymbol();
    }

    @Override
    public String toString() {
        return shortName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return id.equals(card.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
