package com.riskengine.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GameState — roster bookkeeping while a round is being walked.
 */
class GameStateTest {

    private PlayerAccount p1;
    private PlayerAccount p2;
    private PlayerAccount p3;
    private PlayerAccount p4;
    private GameState state;

    @BeforeEach
    void setUp() {
        p1 = new PlayerAccount("P1", null);
        p2 = new PlayerAccount("P2", null);
        p3 = new PlayerAccount("P3", null);
        p4 = new PlayerAccount("P4", null);
        WorldMap map = WorldMap.builder().region("A", "G").build();
        state = new GameState(map, List.of(p1, p2, p3, p4), new Deck(List.of(), new Random(0)));
        state.setStatus(GameStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("startRound() should advance the round and rewind to the first seat")
    void shouldStartRound() {
        state.setActiveIndex(3);

        state.startRound();

        assertEquals(1, state.getRound());
        assertSame(p1, state.getActivePlayer());
    }

    @Nested
    @DisplayName("removeFromRoster()")
    class RemoveFromRosterTests {

        @Test
        @DisplayName("removing the seat just before the active one should keep the active player")
        void shouldShiftIndexWhenEarlierSeatRemoved() {
            state.setActiveIndex(2);

            assertTrue(state.removeFromRoster(p2));

            assertSame(p3, state.getActivePlayer());
            assertEquals(1, state.getActiveIndex());
        }

        @Test
        @DisplayName("removing the seat just after the active one should leave the index alone")
        void shouldKeepIndexWhenLaterSeatRemoved() {
            state.setActiveIndex(1);

            state.removeFromRoster(p3);

            assertSame(p2, state.getActivePlayer());
            assertEquals(List.of(p1, p2, p4), state.getRoster());
        }

        @Test
        @DisplayName("after removing the next seat, advancing should reach the seat after it")
        void shouldNotSkipAfterRemovingNextSeat() {
            state.setActiveIndex(1);
            state.removeFromRoster(p3);

            state.setActiveIndex(state.getActiveIndex() + 1);

            assertSame(p4, state.getActivePlayer());
        }

        @Test
        @DisplayName("removing the first seat while the last acts should not repeat anyone")
        void shouldNotRepeatAfterRemovingFirstSeat() {
            state.setActiveIndex(3);
            state.removeFromRoster(p1);

            assertSame(p4, state.getActivePlayer());
            state.setActiveIndex(state.getActiveIndex() + 1);
            assertNull(state.getActivePlayer());
        }

        @Test
        @DisplayName("should record elimination order and remove a player only once")
        void shouldRemoveOnce() {
            assertTrue(state.removeFromRoster(p4));
            assertFalse(state.removeFromRoster(p4));

            assertEquals(List.of(p4), state.getEliminated());
            assertEquals(3, state.getRoster().size());
        }
    }

    @Test
    @DisplayName("finish() should record the winner and end the game")
    void shouldFinish() {
        state.finish(p2);

        assertEquals(GameStatus.FINISHED, state.getStatus());
        assertEquals(GamePhase.GAME_OVER, state.getPhase());
        assertSame(p2, state.getWinner());
        assertFalse(state.isInProgress());
    }

    @Nested
    @DisplayName("Player accounts")
    class AccountTests {

        @Test
        @DisplayName("transferHand() should move every card to the receiver")
        void shouldTransferHand() {
            Card first = new Card(CardType.INFANTRY, null);
            Card second = Card.wild();
            state.dealCards(p2, List.of(first, second));
            state.dealCards(p1, List.of(Card.wild()));

            List<Card> moved = state.transferHand(p2, p1);

            assertEquals(List.of(first, second), moved);
            assertEquals(0, p2.getHandSize());
            assertEquals(3, p1.getHandSize());
        }

        @Test
        @DisplayName("allowance writes should go through the game")
        void shouldTrackAllowance() {
            state.setAllowance(p1, 3);
            state.grantAllowance(p1, 10);
            state.spendAllowance(p1, 4);

            assertEquals(9, p1.getAllowance());
            assertEquals(0, p2.getAllowance());
        }

        @Test
        @DisplayName("refreshGarrison() should read the game's map")
        void shouldRefreshGarrison() {
            state.getMap().assign(state.getMap().findRegion("A").orElseThrow(), p3, 5);

            assertEquals(5, state.refreshGarrison(p3));
            assertEquals(5, p3.getTotalGarrison());
        }
    }
}
