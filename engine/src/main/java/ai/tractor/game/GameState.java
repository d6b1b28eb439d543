package ai.tractor.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Read-only snapshot of a round in play, as handed to the rules engine.
 * <p>
 * <strong>Contents:</strong>
 * <ul>
 *   <li><strong>Players:</strong> the four seats in play order, each with its current hand.</li>
 *   <li><strong>Trump:</strong> the round's {@link TrumpInfo}.</li>
 *   <li><strong>Current trick:</strong> the trick being played, or {@code null} between tricks.</li>
 *   <li><strong>Completed tricks:</strong> every finished trick of the round, oldest first.</li>
 *   <li><strong>Kitty:</strong> the cards set aside at the deal. Only the round-starting
 *       player has seen them.</li>
 * </ul>
 * <p>
 * The engine never mutates a snapshot; callers must not mutate the lists they passed in
 * while a call is running. All lists are copied on construction.
 */
public final class GameState {
    private final List<Player> players;
    private final TrumpInfo trumpInfo;
    private final Trick currentTrick;
    private final List<Trick> tricks;
    private final List<Card> kittyCards;
    private final int roundStartingPlayerIndex;

    public GameState(
            List<Player> players,
            TrumpInfo trumpInfo,
            Trick currentTrick,
            List<Trick> tricks,
            List<Card> kittyCards,
            int roundStartingPlayerIndex) {
        this.players = List.copyOf(Objects.requireNonNull(players, "players"));
        this.trumpInfo = Objects.requireNonNull(trumpInfo, "trumpInfo");
        this.currentTrick = currentTrick;
        this.tricks = List.copyOf(Objects.requireNonNull(tricks, "tricks"));
        this.kittyCards = List.copyOf(Objects.requireNonNull(kittyCards, "kittyCards"));
        if (roundStartingPlayerIndex < 0 || roundStartingPlayerIndex >= this.players.size()) {
            throw new IllegalArgumentException("roundStartingPlayerIndex out of range: " + roundStartingPlayerIndex);
        }
        this.roundStartingPlayerIndex = roundStartingPlayerIndex;
    }

    public List<Player> getPlayers() {
        return players;
    }

    public TrumpInfo getTrumpInfo() {
        return trumpInfo;
    }

    /**
     * @return the trick in progress, or {@code null}
     */
    public Trick getCurrentTrick() {
        return currentTrick;
    }

    public List<Trick> getTricks() {
        return tricks;
    }

    public List<Card> getKittyCards() {
        return kittyCards;
    }

    public int getRoundStartingPlayerIndex() {
        return roundStartingPlayerIndex;
    }

    /**
     * Returns the cards led into the current trick, or an empty list when the next play
     * is a lead.
     */
    public List<Card> getLeadingCombo() {
        return currentTrick == null ? Collections.emptyList() : currentTrick.getLeadingCombo();
    }

    /**
     * Returns the seat index of {@code playerId}.
     *
     * @throws IllegalArgumentException if the player is not seated in this state
     */
    public int indexOf(PlayerId playerId) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getId() == playerId) {
                return i;
            }
        }
        throw new IllegalArgumentException("Player not in game state: " + playerId);
    }

    public Player getPlayer(PlayerId playerId) {
        return players.get(indexOf(playerId));
    }

    /**
     * Returns every seated player other than {@code playerId}.
     */
    public List<PlayerId> getOtherPlayerIds(PlayerId playerId) {
        List<PlayerId> others = new ArrayList<>();
        for (Player player : players) {
            if (player.getId() != playerId) {
                others.add(player.getId());
            }
        }
        return others;
    }

    /**
     * Returns the kitty as seen by {@code playerId}: the real cards for the round-starting
     * player, who picked them up, and nothing for everyone else.
     */
    public List<Card> getKittyVisibleTo(PlayerId playerId) {
        if (indexOf(playerId) == roundStartingPlayerIndex) {
            return kittyCards;
        }
        return Collections.emptyList();
    }

    /**
     * Returns a copy of this snapshot with an empty kitty, for tables where nobody may use
     * kitty knowledge.
     */
    public GameState withoutKitty() {
        return new GameState(players, trumpInfo, currentTrick, tricks, Collections.emptyList(), roundStartingPlayerIndex);
    }
}
