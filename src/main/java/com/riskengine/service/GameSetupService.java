package com.riskengine.service;

import com.riskengine.exception.ConfigurationException;
import com.riskengine.model.Deck;
import com.riskengine.model.GamePhase;
import com.riskengine.model.GameState;
import com.riskengine.model.GameStatus;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.Region;
import com.riskengine.model.WorldMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Service responsible for dealing regions and starting armies and building the deck.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameSetupService {

    static final int MIN_PLAYERS = 2;
    static final int MAX_PLAYERS = 6;

    private final Random random;

    /**
     * Create a game ready for its first round. Seats are drawn at random, so the roster order of
     * the returned state is not the order of {@code players}.
     *
     * @throws ConfigurationException if the roster or map cannot support a game
     */
    public GameState newGame(WorldMap map, List<PlayerAccount> players) {
        validateRoster(map, players);

        List<PlayerAccount> seating = new ArrayList<>(players);
        Collections.shuffle(seating, random);

        GameState state = new GameState(map, seating, Deck.forRegions(map.getRegions(), random));
        state.log("Game started.");
        state.log("Seating order: " + seating + ".");

        assignStartingRegions(state);
        assignStartingArmies(state);

        state.setStatus(GameStatus.IN_PROGRESS);
        state.setPhase(GamePhase.DRAFT);
        log.info("Game started with {} players on {} regions", players.size(), map.getRegions().size());
        return state;
    }

    /**
     * Starting armies per player for the given roster size.
     */
    public int startingArmies(int playerCount) {
        return switch (playerCount) {
            case 2 -> 40;
            case 3 -> 35;
            case 4 -> 30;
            case 5 -> 25;
            case 6 -> 20;
            default -> throw new ConfigurationException("Unsupported player count: " + playerCount
                    + " (must be " + MIN_PLAYERS + "-" + MAX_PLAYERS + ")");
        };
    }

    /**
     * Each player gets regions / players regions; the first (regions mod players) players get one more.
     */
    void assignStartingRegions(GameState state) {
        List<Region> regions = new ArrayList<>(state.getMap().getRegions());
        Collections.shuffle(regions, random);

        List<PlayerAccount> players = state.getRoster();
        int perPlayer = regions.size() / players.size();
        int remainder = regions.size() % players.size();

        int index = 0;
        for (int p = 0; p < players.size(); p++) {
            PlayerAccount player = players.get(p);
            int count = perPlayer + (p < remainder ? 1 : 0);
            for (int i = 0; i < count; i++) {
                Region region = regions.get(index++);
                state.getMap().assign(region, player, 1);
                state.log(player.getName() + " received " + region.getName() + ".");
            }
        }
    }

    /**
     * Tops every player up to the starting army count one troop at a time on a random owned region.
     */
    void assignStartingArmies(GameState state) {
        int armies = startingArmies(state.getRoster().size());
        for (PlayerAccount player : state.getRoster()) {
            List<Region> owned = state.getMap().regionsOwnedBy(player);
            int remaining = armies - state.refreshGarrison(player);
            for (int i = 0; i < remaining; i++) {
                state.getMap().reinforce(owned.get(random.nextInt(owned.size())), 1);
            }
            state.refreshGarrison(player);
            state.log(player.summary(state.getMap()));
        }
    }

    private void validateRoster(WorldMap map, List<PlayerAccount> players) {
        if (players == null || players.size() < MIN_PLAYERS || players.size() > MAX_PLAYERS) {
            throw new ConfigurationException("A game needs " + MIN_PLAYERS + "-" + MAX_PLAYERS
                    + " players, got " + (players == null ? 0 : players.size()));
        }
        Set<String> names = new HashSet<>();
        for (PlayerAccount player : players) {
            if (!names.add(player.getName())) {
                throw new ConfigurationException("Player name already taken: " + player.getName());
            }
        }
        if (map.getRegions().size() < players.size()) {
            throw new ConfigurationException("Map has " + map.getRegions().size()
                    + " regions, fewer than the " + players.size() + " players");
        }
        if (map.getRegions().stream().anyMatch(r -> r.getOwner() != null)) {
            throw new ConfigurationException("Map is already assigned to another game");
        }
    }
}
