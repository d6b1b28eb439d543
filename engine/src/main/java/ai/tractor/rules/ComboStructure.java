package ai.tractor.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * A non-overlapping decomposition of a card set into Singles, Pairs and Tractors.
 *
 * @param components the combos, tractors first, then pairs, then singles
 * @param trump whether the decomposed cards are trump
 */
public record ComboStructure(List<Combo> components, boolean trump) {

    public ComboStructure {
        components = List.copyOf(components);
    }

    /** Number of cards covered by the components. */
    public int totalLength() {
        int length = 0;
        for (Combo combo : components) {
            length += combo.size();
        }
        return length;
    }

    /** Pairs counted across pairs and tractors. */
    public int totalPairs() {
        int pairs = 0;
        for (Combo combo : components) {
            pairs += combo.pairCount();
        }
        return pairs;
    }

    /** Pairs that sit inside tractors. */
    public int tractorPairs() {
        int pairs = 0;
        for (Combo combo : components) {
            if (combo.getType() == ComboType.TRACTOR) {
                pairs += combo.pairCount();
            }
        }
        return pairs;
    }

    public int tractorCount() {
        return tractors().size();
    }

    public List<Combo> tractors() {
        List<Combo> tractors = new ArrayList<>();
        for (Combo combo : components) {
            if (combo.getType() == ComboType.TRACTOR) {
                tractors.add(combo);
            }
        }
        return tractors;
    }

    /** Pair counts of each tractor, longest first. */
    public List<Integer> tractorSizes() {
        List<Integer> sizes = new ArrayList<>();
        for (Combo tractor : tractors()) {
            sizes.add(tractor.pairCount());
        }
        return sizes;
    }

    public int singleCount() {
        return totalLength() - 2 * totalPairs();
    }

    /** Number of components. */
    public int size() {
        return components.size();
    }
}
