package com.riskengine.config;

import com.riskengine.policy.PolicyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings bound from {@code game.*}.
 */
@Data
@ConfigurationProperties(prefix = "game")
public class GameProperties {

    /** Seed for the shared random source; unset means a fresh seed per run. */
    private Long seed;

    /** Map the simulation runner plays on. */
    private String mapId = "classic";

    /** Roster for the simulation runner, one entry per seat. */
    private List<PolicyType> players = new ArrayList<>(List.of(
            PolicyType.GREEDY, PolicyType.GREEDY, PolicyType.RANDOM, PolicyType.PASSIVE));

    /** Rounds before a game is abandoned; 0 disables the limit. */
    private int maxRounds = 500;

    /** Rejected proposals tolerated per phase before the engine ends it. */
    private int maxInvalidMoves = 3;

    private Simulation simulation = new Simulation();

    @Data
    public static class Simulation {

        private boolean enabled = true;

        /** Trials for the combat odds printed after the game. */
        private int probeTrials = 10_000;
    }
}
