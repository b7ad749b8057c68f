package com.riskengine.policy;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Factory for decision policies by type.
 */
@Service
@RequiredArgsConstructor
public class PolicyFactory {

    private final PassivePolicy passivePolicy;
    private final RandomPolicy randomPolicy;
    private final GreedyPolicy greedyPolicy;

    /**
     * Bots are stateless and shared; every scripted policy is a fresh instance that falls back
     * to the passive bot.
     */
    public DecisionPolicy getPolicy(PolicyType type) {
        if (type == null) {
            type = PolicyType.GREEDY;
        }

        return switch (type) {
            case PASSIVE -> passivePolicy;
            case RANDOM -> randomPolicy;
            case GREEDY -> greedyPolicy;
            case SCRIPTED -> new ScriptedPolicy(passivePolicy);
        };
    }
}
