package com.riskengine.policy;

import com.riskengine.model.Card;
import com.riskengine.model.CardType;
import com.riskengine.model.Deck;
import com.riskengine.model.GameState;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.WorldMap;
import com.riskengine.service.CardService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PassivePolicy.
 */
class PassivePolicyTest {

    private PassivePolicy policy;
    private PlayerAccount me;
    private GameState game;

    @BeforeEach
    void setUp() {
        policy = new PassivePolicy(new Random(3), new CardService());
        me = new PlayerAccount("Passive", policy);
        PlayerAccount enemy = new PlayerAccount("Enemy", null);
        WorldMap map = WorldMap.builder().region("A", "G").region("B", "G").connectBoth("A", "B").build();
        map.assign(map.findRegion("A").orElseThrow(), me, 9);
        map.assign(map.findRegion("B").orElseThrow(), enemy, 1);
        game = new GameState(map, List.of(me, enemy), new Deck(List.of(), new Random(0)));
    }

    @Test
    @DisplayName("should draft the whole allowance onto an owned region")
    void shouldDraftEverything() {
        PolicyMove move = policy.decideDraft(game, me, 7);

        assertEquals("A", move.getToRegion());
        assertEquals(7, move.getTroops());
    }

    @Test
    @DisplayName("should never attack or fortify")
    void shouldStayPut() {
        assertEquals(PolicyMove.MoveType.END_ATTACK, policy.decideAttack(game, me).getType());
        assertEquals(PolicyMove.MoveType.SKIP_FORTIFY, policy.decideFortify(game, me).getType());
        assertEquals(PolicyType.PASSIVE, policy.getType());
    }

    @Test
    @DisplayName("should trade only when forced")
    void shouldTradeOnlyWhenForced() {
        game.dealCards(me, List.of(new Card(CardType.INFANTRY, null), new Card(CardType.INFANTRY, null),
                new Card(CardType.INFANTRY, null)));

        assertTrue(policy.decideTrade(game, me, false).isEmpty());
        assertEquals(3, policy.decideTrade(game, me, true).orElseThrow().size());
    }

    @Test
    @DisplayName("should move the minimum into a captured region")
    void shouldMoveMinimum() {
        assertEquals(3, policy.decideCaptureMove(game, me, null, null, 3, 8));
    }
}
