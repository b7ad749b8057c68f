package com.riskengine.model;

import com.riskengine.policy.DecisionPolicy;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A player in the game, human-driven or bot. The policy is fixed when the account is created.
 * <p>
 * Owned regions are not stored here; they are queried from the {@link MapView}. The total
 * garrison is a cache refreshed from the map at the end of every turn.
 * <p>
 * Read-only outside this package: hand, allowance and garrison cache change only through
 * {@link GameState}, the same way regions change only through {@link WorldMap}.
 */
@Getter
public class PlayerAccount {

    private final String name;
    private final DecisionPolicy policy;
    private final List<Card> hand = new ArrayList<>();

    private int allowance;
    private int totalGarrison;

    public PlayerAccount(String name, DecisionPolicy policy) {
        this.name = name;
        this.policy = policy;
    }

    public List<Card> getHand() {
        return Collections.unmodifiableList(hand);
    }

    public int getHandSize() {
        return hand.size();
    }

    public boolean holdsAll(Collection<Card> cards) {
        return cards.stream().allMatch(c -> hand.stream().anyMatch(h -> h == c));
    }

    void addCard(Card card) {
        hand.add(card);
    }

    void addCards(Collection<Card> cards) {
        hand.addAll(cards);
    }

    /**
     * Removes the given card instances from the hand.
     */
    void removeCards(Collection<Card> cards) {
        for (Card card : cards) {
            hand.removeIf(h -> h == card);
        }
    }

    /**
     * Empties the hand, returning what it held.
     */
    List<Card> surrenderHand() {
        List<Card> cards = new ArrayList<>(hand);
        hand.clear();
        return cards;
    }

    void setAllowance(int allowance) {
        this.allowance = allowance;
    }

    void grantAllowance(int amount) {
        this.allowance += amount;
    }

    void spendAllowance(int amount) {
        this.allowance -= amount;
    }

    int recomputeTotalGarrison(MapView map) {
        this.totalGarrison = map.totalGarrisonOf(this);
        return totalGarrison;
    }

    public String summary(MapView map) {
        return name + " has " + totalGarrison + " troops, " + map.countOwnedBy(this)
                + " regions, and " + hand.size() + " cards.";
    }

    @Override
    public String toString() {
        return name;
    }
}
