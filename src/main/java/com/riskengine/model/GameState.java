package com.riskengine.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one game: the map, the live roster, round and turn position, the deck and the
 * event log. Not thread-safe; one turn engine drives it at a time.
 */
@Getter
public class GameState implements GameView {

    private final WorldMap map;
    private final List<PlayerAccount> roster;
    private final Deck deck;
    private final EventLog eventLog = new EventLog();
    private final List<PlayerAccount> eliminated = new ArrayList<>();

    private int round = 0;
    private int activeIndex = 0;
    private GamePhase phase = GamePhase.SETUP;
    private GameStatus status = GameStatus.SETUP;
    private PlayerAccount winner;

    public GameState(WorldMap map, List<PlayerAccount> players, Deck deck) {
        this.map = map;
        this.roster = new ArrayList<>(players);
        this.deck = deck;
    }

    @Override
    public List<PlayerAccount> getRoster() {
        return Collections.unmodifiableList(roster);
    }

    public List<PlayerAccount> getEliminated() {
        return Collections.unmodifiableList(eliminated);
    }

    @Override
    public PlayerAccount getActivePlayer() {
        if (roster.isEmpty() || activeIndex >= roster.size()) return null;
        return roster.get(activeIndex);
    }

    public void log(String entry) {
        eventLog.append(entry);
    }

    public void startRound() {
        round++;
        activeIndex = 0;
    }

    public void setActiveIndex(int activeIndex) {
        this.activeIndex = activeIndex;
    }

    public void setPhase(GamePhase phase) {
        this.phase = phase;
    }

    public void setStatus(GameStatus status) {
        this.status = status;
    }

    public boolean isInProgress() {
        return status == GameStatus.IN_PROGRESS;
    }

    /**
     * Removes a player from the live roster. If the removed seat came before the active one,
     * the active index shifts down so it keeps pointing at the same player.
     *
     * @return false if the player was not on the roster
     */
    public boolean removeFromRoster(PlayerAccount player) {
        int index = roster.indexOf(player);
        if (index < 0) return false;
        roster.remove(index);
        eliminated.add(player);
        if (index < activeIndex) {
            activeIndex--;
        }
        return true;
    }

    // ── player accounts ─────────────────────────────────────────────────

    public void dealCards(PlayerAccount player, Collection<Card> cards) {
        player.addCards(cards);
    }

    /**
     * Removes the given card instances from the player's hand.
     */
    public void takeCards(PlayerAccount player, Collection<Card> cards) {
        player.removeCards(cards);
    }

    /**
     * Moves every card in {@code from}'s hand to {@code to}.
     *
     * @return the cards that changed hands
     */
    public List<Card> transferHand(PlayerAccount from, PlayerAccount to) {
        List<Card> cards = from.surrenderHand();
        to.addCards(cards);
        return cards;
    }

    public void setAllowance(PlayerAccount player, int allowance) {
        player.setAllowance(allowance);
    }

    public void grantAllowance(PlayerAccount player, int amount) {
        player.grantAllowance(amount);
    }

    public void spendAllowance(PlayerAccount player, int amount) {
        player.spendAllowance(amount);
    }

    /**
     * Refreshes the player's cached total garrison from the map.
     */
    public int refreshGarrison(PlayerAccount player) {
        return player.recomputeTotalGarrison(map);
    }

    public void finish(PlayerAccount winner) {
        this.winner = winner;
        this.status = GameStatus.FINISHED;
        this.phase = GamePhase.GAME_OVER;
    }
}
