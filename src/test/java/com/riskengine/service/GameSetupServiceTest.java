package com.riskengine.service;

import com.riskengine.exception.ConfigurationException;
import com.riskengine.model.GamePhase;
import com.riskengine.model.GameState;
import com.riskengine.model.GameStatus;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.WorldMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GameSetupService — dealing regions and armies.
 */
class GameSetupServiceTest {

    private static WorldMap mapOf(int regions) {
        WorldMap.Builder builder = WorldMap.builder();
        for (int i = 0; i < regions; i++) {
            builder.region("R" + i, "G");
        }
        return builder.build();
    }

    private static List<PlayerAccount> players(int count) {
        List<PlayerAccount> players = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            players.add(new PlayerAccount("P" + i, null));
        }
        return players;
    }

    @Nested
    @DisplayName("Region dealing")
    class RegionTests {

        @Test
        @DisplayName("6 regions and 2 players should give each player 3 regions")
        void shouldSplitEvenly() {
            List<PlayerAccount> players = players(2);
            GameState state = new GameSetupService(new Random(42)).newGame(mapOf(6), players);

            assertEquals(3, state.getMap().countOwnedBy(players.get(0)));
            assertEquals(3, state.getMap().countOwnedBy(players.get(1)));
        }

        @Test
        @DisplayName("7 regions and 2 players should give the first seat the extra region")
        void shouldGiveRemainderToFirstPlayers() {
            GameState state = new GameSetupService(new Random(42)).newGame(mapOf(7), players(2));

            assertEquals(4, state.getMap().countOwnedBy(state.getRoster().get(0)));
            assertEquals(3, state.getMap().countOwnedBy(state.getRoster().get(1)));
        }

        @Test
        @DisplayName("the same seed should deal the same regions")
        void shouldBeReproducible() {
            List<PlayerAccount> first = players(3);
            List<PlayerAccount> second = players(3);
            WorldMap firstMap = mapOf(12);
            WorldMap secondMap = mapOf(12);

            new GameSetupService(new Random(9)).newGame(firstMap, first);
            new GameSetupService(new Random(9)).newGame(secondMap, second);

            for (int i = 0; i < 12; i++) {
                assertEquals(firstMap.getRegions().get(i).getOwner().getName(),
                        secondMap.getRegions().get(i).getOwner().getName());
                assertEquals(firstMap.getRegions().get(i).getGarrison(),
                        secondMap.getRegions().get(i).getGarrison());
            }
        }
    }

    @Nested
    @DisplayName("Seating")
    class SeatingTests {

        @Test
        @DisplayName("seats should be drawn from the injected generator")
        void shouldShuffleSeatsWithSeed() {
            List<PlayerAccount> first = players(6);
            List<PlayerAccount> second = players(6);

            GameState one = new GameSetupService(new Random(5)).newGame(mapOf(12), first);
            GameState two = new GameSetupService(new Random(5)).newGame(mapOf(12), second);

            List<String> expected = new ArrayList<>(List.of("P1", "P2", "P3", "P4", "P5", "P6"));
            Collections.shuffle(expected, new Random(5));
            assertEquals(expected, one.getRoster().stream().map(PlayerAccount::getName).toList());
            assertEquals(expected, two.getRoster().stream().map(PlayerAccount::getName).toList());
            assertEquals("Seating order: " + expected + ".", one.getEventLog().readAll().get(1));
        }

        @Test
        @DisplayName("should seat every player once and leave the caller's list untouched")
        void shouldSeatEveryPlayerOnce() {
            List<PlayerAccount> players = players(4);
            List<PlayerAccount> before = List.copyOf(players);

            GameState state = new GameSetupService(new Random(11)).newGame(mapOf(8), players);

            assertEquals(before, players);
            assertEquals(4, state.getRoster().size());
            assertTrue(state.getRoster().containsAll(players));
        }
    }

    @Nested
    @DisplayName("Starting armies")
    class ArmyTests {

        @ParameterizedTest(name = "{0} players -> {1} armies")
        @CsvSource({"2, 40", "3, 35", "4, 30", "5, 25", "6, 20"})
        @DisplayName("each player should start with the table's army count")
        void shouldPlaceStartingArmies(int playerCount, int armies) {
            List<PlayerAccount> players = players(playerCount);
            GameState state = new GameSetupService(new Random(playerCount)).newGame(mapOf(42), players);

            for (PlayerAccount player : players) {
                assertEquals(armies, state.getMap().totalGarrisonOf(player));
                assertEquals(armies, player.getTotalGarrison());
            }
            assertTrue(state.getMap().getRegions().stream().allMatch(r -> r.getGarrison() >= 1));
        }

        @Test
        @DisplayName("should leave the game in progress, ready to draft, with a full deck")
        void shouldStartGame() {
            GameState state = new GameSetupService(new Random(1)).newGame(mapOf(6), players(2));

            assertEquals(GameStatus.IN_PROGRESS, state.getStatus());
            assertEquals(GamePhase.DRAFT, state.getPhase());
            assertEquals(6, state.getDeck().getDrawPile().size());
            assertEquals("Game started.", state.getEventLog().readAll().get(0));
        }
    }

    @Nested
    @DisplayName("Configuration errors")
    class ConfigurationTests {

        @Test
        @DisplayName("should reject fewer than 2 or more than 6 players")
        void shouldRejectRosterSize() {
            GameSetupService service = new GameSetupService(new Random(1));

            assertThrows(ConfigurationException.class, () -> service.newGame(mapOf(10), players(1)));
            assertThrows(ConfigurationException.class, () -> service.newGame(mapOf(10), players(7)));
            assertThrows(ConfigurationException.class, () -> service.startingArmies(7));
        }

        @Test
        @DisplayName("should reject duplicate names, too small maps and maps already in use")
        void shouldRejectBadSetups() {
            GameSetupService service = new GameSetupService(new Random(1));
            List<PlayerAccount> twins = List.of(new PlayerAccount("Same", null), new PlayerAccount("Same", null));
            WorldMap used = mapOf(4);
            service.newGame(used, players(2));

            assertThrows(ConfigurationException.class, () -> service.newGame(mapOf(4), twins));
            assertThrows(ConfigurationException.class, () -> service.newGame(mapOf(2), players(3)));
            assertThrows(ConfigurationException.class, () -> service.newGame(used, players(2)));
        }
    }
}
