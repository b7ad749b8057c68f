package com.riskengine.runner;

import com.riskengine.config.GameProperties;
import com.riskengine.config.MapLoader;
import com.riskengine.config.WorldMapFactory;
import com.riskengine.dto.GameSummary;
import com.riskengine.model.GameState;
import com.riskengine.model.PlayerAccount;
import com.riskengine.model.WorldMap;
import com.riskengine.policy.PolicyFactory;
import com.riskengine.policy.PolicyType;
import com.riskengine.service.CombatService;
import com.riskengine.service.GameSetupService;
import com.riskengine.service.TurnService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Plays one bot-vs-bot game on startup with the configured map and roster.
 */
@Component
@ConditionalOnProperty(prefix = "game.simulation", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SimulationRunner implements CommandLineRunner {

    static final int PROBE_ATTACKERS = 10;
    static final int PROBE_DEFENDERS = 5;

    private final GameProperties properties;
    private final MapLoader mapLoader;
    private final WorldMapFactory worldMapFactory;
    private final PolicyFactory policyFactory;
    private final GameSetupService setupService;
    private final TurnService turnService;
    private final CombatService combatService;

    @Override
    public void run(String... args) {
        GameSummary summary = simulate();
        log.info("Game over: {} after {} rounds, winner {}, eliminated {}",
                summary.getStatus(), summary.getRounds(), summary.getWinner(), summary.getEliminationOrder());

        if (properties.getSimulation().getProbeTrials() > 0) {
            double odds = combatService.estimateWinProbability(PROBE_ATTACKERS, PROBE_DEFENDERS,
                    properties.getSimulation().getProbeTrials());
            log.info("{} attackers beat {} defenders {}% of the time over {} trials",
                    PROBE_ATTACKERS, PROBE_DEFENDERS, odds, properties.getSimulation().getProbeTrials());
        }
    }

    public GameSummary simulate() {
        WorldMap map = worldMapFactory.build(mapLoader.getMap(properties.getMapId()));
        GameState state = setupService.newGame(map, createPlayers(properties.getPlayers()));

        GameSummary summary = turnService.playGame(state);
        if (log.isDebugEnabled()) {
            state.getEventLog().readAll().forEach(log::debug);
        }
        return summary;
    }

    List<PlayerAccount> createPlayers(List<PolicyType> types) {
        List<PlayerAccount> players = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            PolicyType type = types.get(i);
            players.add(new PlayerAccount("P" + (i + 1) + "-" + type, policyFactory.getPolicy(type)));
        }
        return players;
    }
}
