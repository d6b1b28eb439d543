package ai.tractor.rules;

import ai.tractor.game.Card;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A straight combination: a Single, Pair or Tractor with its cards and relative strength.
 * <p>
 * The value is the {@link CardOrdering#strength strength} of the combo's top card, so two
 * combos of one type and context compare by value.
 */
public final class Combo {
    private final ComboType type;
    private final List<Card> cards;
    private final int value;

    public Combo(ComboType type, List<Card> cards, int value) {
        this.type = Objects.requireNonNull(type, "type");
        if (!type.isStraight()) {
            throw new IllegalArgumentException("A combo must be a Single, Pair or Tractor: " + type);
        }
        this.cards = List.copyOf(cards);
        this.value = value;
    }

    public ComboType getType() {
        return type;
    }

    public List<Card> getCards() {
        return cards;
    }

    public int getValue() {
        return value;
    }

    public int size() {
        return cards.size();
    }

    /**
     * @return the number of pairs this combo holds (0 for a Single)
     */
    public int pairCount() {
        return type == ComboType.SINGLE ? 0 : cards.size() / 2;
    }

    /**
     * Returns {@code true} if this combo holds exactly the given cards, compared by instance id.
     */
    public boolean hasSameCards(Collection<Card> other) {
        if (other.size() != cards.size()) {
            return false;
        }
        return new HashSet<>(cards).equals(new HashSet<>(other));
    }

    /**
     * Returns {@code true} if any card of this combo is in {@code ids}.
     */
    public boolean overlaps(Set<String> ids) {
        for (Card card : cards) {
            if (ids.contains(card.getId())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collects the instance ids of a card list.
     */
    public static Set<String> idsOf(Collection<Card> cards) {
        Set<String> ids = new HashSet<>();
        for (Card card : cards) {
            ids.add(card.getId());
        }
        return ids;
    }

    @Override
    public String toString() {
        return type + cards.toString();
    }
}
