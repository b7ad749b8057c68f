package com.riskengine.service;

import com.riskengine.dto.CardSet;
import com.riskengine.exception.CardSetException;
import com.riskengine.model.Card;
import com.riskengine.model.CardType;
import com.riskengine.model.GameState;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.Region;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Service responsible for the card economy: recognising sets, valuing them and trading them in.
 */
@Service
@Slf4j
public class CardService {

    public static final int SET_SIZE = 3;
    public static final int FORCED_TRADE_HAND_SIZE = 5;
    public static final int REGION_BONUS = 2;

    /**
     * Classify three cards. Wildcards fill whatever gap makes the set worth the most.
     *
     * @return the set with its value, or empty if the cards do not form one
     */
    public Optional<CardSet> classify(List<Card> cards) {
        if (cards == null || cards.size() != SET_SIZE || !allDistinct(cards)) {
            return Optional.empty();
        }

        Set<CardType> distinctTypes = EnumSet.noneOf(CardType.class);
        int matched = 0;
        for (Card card : cards) {
            if (!card.isWild()) {
                distinctTypes.add(card.getType());
                matched++;
            }
        }

        // No repeated type means the wildcards can complete one of each
        if (distinctTypes.size() == matched) {
            return Optional.of(CardSet.builder()
                    .cards(List.copyOf(cards))
                    .kind(CardSet.Kind.ONE_OF_EACH)
                    .bonus(CardType.MIXED_SET_BONUS)
                    .build());
        }
        if (distinctTypes.size() == 1) {
            return Optional.of(CardSet.builder()
                    .cards(List.copyOf(cards))
                    .kind(CardSet.Kind.THREE_OF_A_KIND)
                    .bonus(distinctTypes.iterator().next().getSetBonus())
                    .build());
        }
        return Optional.empty();
    }

    /**
     * Highest-value set in the hand. Subsets are enumerated as index triples i &lt; j &lt; k in
     * lexicographic order and a later set replaces the current best only if worth strictly more,
     * so ties go to the first one found.
     */
    public Optional<CardSet> findBestTradeableSet(List<Card> hand) {
        CardSet best = null;
        for (int i = 0; i < hand.size(); i++) {
            for (int j = i + 1; j < hand.size(); j++) {
                for (int k = j + 1; k < hand.size(); k++) {
                    Optional<CardSet> candidate = classify(List.of(hand.get(i), hand.get(j), hand.get(k)));
                    if (candidate.isPresent() && (best == null || candidate.get().getBonus() > best.getBonus())) {
                        best = candidate.get();
                    }
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Any five cards always contain a set, so only smaller hands are searched.
     */
    public boolean hasAnyValidSet(List<Card> hand) {
        if (hand.size() >= FORCED_TRADE_HAND_SIZE) return true;
        return findBestTradeableSet(hand).isPresent();
    }

    public boolean isTradeForced(PlayerAccount player) {
        return player.getHandSize() >= FORCED_TRADE_HAND_SIZE;
    }

    /**
     * Trade three cards from the player's hand. The table bonus is added to the player's
     * allowance; the first card, in selection order, bound to a region the player still owns
     * puts {@value #REGION_BONUS} troops straight onto that region.
     *
     * @return the table bonus
     * @throws CardSetException if the cards are not a valid set held by the player
     */
    public int applyTradeIn(GameState state, PlayerAccount player, List<Card> chosen) {
        CardSet set = classify(chosen)
                .orElseThrow(() -> new CardSetException("Not a valid set: " + chosen));
        if (!player.holdsAll(chosen)) {
            throw new CardSetException(player.getName() + " does not hold all of " + chosen);
        }

        state.takeCards(player, chosen);
        state.getDeck().discard(chosen);
        state.grantAllowance(player, set.getBonus());
        state.log(player.getName() + " traded in " + chosen + " for " + set.getBonus() + " troops.");

        for (Card card : chosen) {
            Region region = card.getRegion();
            if (region != null && region.isOwnedBy(player)) {
                state.getMap().reinforce(region, REGION_BONUS);
                state.log("Placed " + REGION_BONUS + " bonus troops in " + region.getName() + ".");
                break;
            }
        }

        log.debug("{} traded {} ({}) for {}", player.getName(), chosen, set.getKind(), set.getBonus());
        return set.getBonus();
    }

    private boolean allDistinct(List<Card> cards) {
        Map<Card, Boolean> seen = new IdentityHashMap<>();
        for (Card card : cards) {
            if (card == null || seen.put(card, Boolean.TRUE) != null) {
                return false;
            }
        }
        return true;
    }
}
