package ai.tractor.rules;

import ai.tractor.game.Card;
import ai.tractor.game.GameState;
import ai.tractor.game.PlayMemory;
import ai.tractor.game.PlayerId;
import ai.tractor.game.Suit;
import ai.tractor.game.TrumpInfo;
import ai.tractor.rules.LeadingMultiComboValidation.BeatableComponent;
import ai.tractor.rules.LeadingMultiComboValidation.UnbeatableStatus;
import ai.tractor.rules.LeadingMultiComboValidation.VoidStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether led combos are safe from being beaten by cards the leader cannot see.
 * <p>
 * A multi-combo lead is only allowed when every component either cannot be beaten by any
 * unseen card of the suit, or faces opponents who are all known to be out of the suit.
 * Trump multi-combos are never judged unbeatable.
 */
public final class UnbeatableComboEvaluator {
    private static final Logger log = LoggerFactory.getLogger(UnbeatableComboEvaluator.class);

    private UnbeatableComboEvaluator() {
    }

    /**
     * Checks one combo against the cards of {@code suit} the leader has not seen.
     *
     * @param combo the component being led
     * @param suit the led plain suit, or {@code null} for trump
     * @param playedCards every card played this round
     * @param ownHand the leader's hand
     * @param trumpInfo the round's trump declaration
     * @param visibleKitty the kitty if the leader has seen it, otherwise empty
     * @return {@code true} if no unseen card, pair or tractor outranks the combo
     */
    public static boolean isComboUnbeatable(
            Combo combo,
            Suit suit,
            List<Card> playedCards,
            List<Card> ownHand,
            TrumpInfo trumpInfo,
            List<Card> visibleKitty) {
        if (suit == null || !trumpInfo.isPlainSuit(suit)) {
            return false;
        }
        return new UnseenCards(suit, playedCards, ownHand, visibleKitty, trumpInfo).isUnbeatable(combo);
    }

    /**
     * Checks one combo led by {@code playerId} in the given state.
     */
    public static boolean isComboUnbeatable(Combo combo, Suit suit, GameState state, PlayerId playerId) {
        return isComboUnbeatable(
                combo,
                suit,
                PlayMemory.fromState(state).getPlayedCards(),
                state.getPlayer(playerId).getHand(),
                state.getTrumpInfo(),
                state.getKittyVisibleTo(playerId));
    }

    /**
     * Validates the components of a leading multi-combo.
     *
     * @param components the decomposition of the lead
     * @param suit the led plain suit, or {@code null} for trump
     * @param state the round so far
     * @param playerId the leader
     * @return the validation, never null
     */
    public static LeadingMultiComboValidation validateLeadingMultiCombo(
            List<Combo> components, Suit suit, GameState state, PlayerId playerId) {
        TrumpInfo trumpInfo = state.getTrumpInfo();
        if (suit == null || !trumpInfo.isPlainSuit(suit)) {
            List<BeatableComponent> all = new ArrayList<>();
            for (Combo combo : components) {
                all.add(new BeatableComponent(combo, "trump multi-combos are always beatable"));
            }
            return new LeadingMultiComboValidation(
                    false,
                    List.of("Multi-combos may only be led in a plain suit"),
                    new VoidStatus(false, Collections.emptyList()),
                    new UnbeatableStatus(false, all));
        }

        PlayMemory memory = PlayMemory.fromState(state);
        List<PlayerId> opponents = state.getOtherPlayerIds(playerId);
        List<PlayerId> voidPlayers = new ArrayList<>();
        for (PlayerId opponent : opponents) {
            if (memory.isVoidIn(opponent, suit)) {
                voidPlayers.add(opponent);
            }
        }
        boolean allVoid = voidPlayers.size() == opponents.size();

        UnseenCards unseen = new UnseenCards(
                suit,
                memory.getPlayedCards(),
                state.getPlayer(playerId).getHand(),
                state.getKittyVisibleTo(playerId),
                trumpInfo);
        List<BeatableComponent> beatable = new ArrayList<>();
        for (Combo combo : components) {
            if (!unseen.isUnbeatable(combo)) {
                beatable.add(new BeatableComponent(combo, describeThreat(combo)));
            }
        }

        boolean valid = allVoid || beatable.isEmpty();
        List<String> reasons = new ArrayList<>();
        if (!valid) {
            for (BeatableComponent component : beatable) {
                reasons.add(component.combo() + ": " + component.reason());
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Multi-combo lead by {} in {}: valid={}, voidPlayers={}, beatable={}, {}",
                    playerId, suit, valid, voidPlayers, beatable.size(), unseen);
        }
        return new LeadingMultiComboValidation(
                valid,
                reasons,
                new VoidStatus(allVoid, voidPlayers),
                new UnbeatableStatus(beatable.isEmpty(), beatable));
    }

    /**
     * Decomposes {@code cards} and validates the result as a leading multi-combo.
     */
    public static LeadingMultiComboValidation validateLeadingMultiCombo(
            List<Card> cards, GameState state, PlayerId playerId) {
        TrumpInfo trumpInfo = state.getTrumpInfo();
        Suit suit = MultiComboAnalyzer.plainSuitOf(cards, trumpInfo);
        ComboStructure structure = MultiComboAnalyzer.analyzeComboStructure(cards, trumpInfo);
        return validateLeadingMultiCombo(structure.components(), suit, state, playerId);
    }

    /**
     * Returns the cards of {@code suit} in {@code hand} that belong to some combo nobody can
     * beat, in hand order. When every opponent is out of the suit, that is all of them.
     */
    public static List<Card> unbeatableCardsInSuit(Suit suit, List<Card> hand, GameState state, PlayerId playerId) {
        TrumpInfo trumpInfo = state.getTrumpInfo();
        if (suit == null || !trumpInfo.isPlainSuit(suit)) {
            return Collections.emptyList();
        }
        List<Card> suitCards = new ArrayList<>();
        for (Card card : hand) {
            if (!trumpInfo.isTrump(card) && card.getSuit() == suit) {
                suitCards.add(card);
            }
        }
        PlayMemory memory = PlayMemory.fromState(state);
        boolean allVoid = true;
        for (PlayerId opponent : state.getOtherPlayerIds(playerId)) {
            allVoid &= memory.isVoidIn(opponent, suit);
        }
        if (allVoid) {
            return suitCards;
        }

        UnseenCards unseen = new UnseenCards(
                suit, memory.getPlayedCards(), hand, state.getKittyVisibleTo(playerId), trumpInfo);
        Set<Card> safe = new LinkedHashSet<>();
        for (Combo combo : ComboClassifier.identifyCombos(suitCards, trumpInfo)) {
            if (unseen.isUnbeatable(combo)) {
                safe.addAll(combo.getCards());
            }
        }
        List<Card> ordered = new ArrayList<>();
        for (Card card : suitCards) {
            if (safe.contains(card)) {
                ordered.add(card);
            }
        }
        return ordered;
    }

    private static String describeThreat(Combo combo) {
        return switch (combo.getType()) {
            case SINGLE -> "a higher single is still unseen";
            case PAIR -> "a higher pair is still unseen";
            case TRACTOR -> "a higher tractor of " + combo.pairCount() + " pairs is still unseen";
            case NOT_A_STRAIGHT_COMBO -> "not a straight combo";
        };
    }
}
