package ai.tractor.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Public knowledge gathered from the plays of the current round.
 * <p>
 * Every card played so far is public, and a player who does not follow a plain suit that
 * was led has shown they hold no more cards of it. This snapshot records both so that
 * leading multi-combos can be judged against what the other players might still hold.
 * <ul>
 *   <li><strong>Played cards:</strong> every card of every completed trick plus the plays
 *       already made in the current trick.</li>
 *   <li><strong>Suit voids:</strong> a follower whose play contains any card outside the led
 *       plain suit (including trump) is void in that suit.</li>
 *   <li><strong>Trump voids:</strong> a follower who answers a trump lead with any non-trump
 *       card is out of trump.</li>
 * </ul>
 * <p>
 * The snapshot is immutable. Build it with {@link #fromState(GameState)} whenever the trick
 * history changes; it never updates in place.
 */
public final class PlayMemory {
    private final List<Card> playedCards;
    private final Map<PlayerId, Set<Suit>> suitVoids;
    private final Set<PlayerId> trumpVoids;

    public PlayMemory(List<Card> playedCards, Map<PlayerId, Set<Suit>> suitVoids, Set<PlayerId> trumpVoids) {
        this.playedCards = List.copyOf(playedCards);
        Map<PlayerId, Set<Suit>> voids = new EnumMap<>(PlayerId.class);
        for (Map.Entry<PlayerId, Set<Suit>> entry : suitVoids.entrySet()) {
            voids.put(entry.getKey(), Collections.unmodifiableSet(EnumSet.copyOf(withSuitType(entry.getValue()))));
        }
        this.suitVoids = Collections.unmodifiableMap(voids);
        this.trumpVoids = trumpVoids.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(trumpVoids));
    }

    /**
     * A memory with nothing played and no voids.
     */
    public static PlayMemory empty() {
        return new PlayMemory(Collections.emptyList(), Collections.emptyMap(), Collections.emptySet());
    }

    /**
     * Rebuilds the memory from the completed tricks and the trick in progress.
     *
     * @param state the game snapshot; must not be null
     * @return the memory for the round so far
     */
    public static PlayMemory fromState(GameState state) {
        TrumpInfo trumpInfo = state.getTrumpInfo();
        List<Card> played = new ArrayList<>();
        Map<PlayerId, Set<Suit>> voids = new EnumMap<>(PlayerId.class);
        Set<PlayerId> trumpVoids = EnumSet.noneOf(PlayerId.class);

        List<Trick> history = new ArrayList<>(state.getTricks());
        if (state.getCurrentTrick() != null) {
            history.add(state.getCurrentTrick());
        }
        for (Trick trick : history) {
            List<Play> plays = trick.getPlays();
            if (plays.isEmpty()) {
                continue;
            }
            List<Card> lead = plays.get(0).getCards();
            // null when trump was led
            Suit leadSuit = lead.isEmpty() || trumpInfo.isTrump(lead.get(0)) ? null : lead.get(0).getSuit();
            played.addAll(lead);

            for (int i = 1; i < plays.size(); i++) {
                Play play = plays.get(i);
                played.addAll(play.getCards());
                for (Card card : play.getCards()) {
                    boolean trump = trumpInfo.isTrump(card);
                    if (leadSuit != null && (trump || card.getSuit() != leadSuit)) {
                        voids.computeIfAbsent(play.getPlayerId(), k -> EnumSet.noneOf(Suit.class)).add(leadSuit);
                    } else if (leadSuit == null && !trump) {
                        trumpVoids.add(play.getPlayerId());
                    }
                }
            }
        }
        return new PlayMemory(played, voids, trumpVoids);
    }

    /**
     * @return every card played this round, in play order
     */
    public List<Card> getPlayedCards() {
        return playedCards;
    }

    public boolean isVoidIn(PlayerId playerId, Suit suit) {
        Set<Suit> voids = suitVoids.get(playerId);
        return voids != null && voids.contains(suit);
    }

    /**
     * @return the plain suits {@code playerId} is known to be out of; never null
     */
    public Set<Suit> getSuitVoids(PlayerId playerId) {
        return suitVoids.getOrDefault(playerId, Collections.emptySet());
    }

    public boolean isTrumpVoid(PlayerId playerId) {
        return trumpVoids.contains(playerId);
    }

    private static Set<Suit> withSuitType(Set<Suit> suits) {
        return suits.isEmpty() ? EnumSet.noneOf(Suit.class) : suits;
    }

    @Override
    public String toString() {
        return "PlayMemory(played=" + playedCards.size() + ", voids=" + suitVoids + ", trumpVoids=" + trumpVoids + ")";
    }
}
