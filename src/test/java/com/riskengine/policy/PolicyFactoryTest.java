package com.riskengine.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PolicyFactory.
 */
@ExtendWith(MockitoExtension.class)
class PolicyFactoryTest {

    @Mock
    private PassivePolicy passivePolicy;

    @Mock
    private RandomPolicy randomPolicy;

    @Mock
    private GreedyPolicy greedyPolicy;

    @InjectMocks
    private PolicyFactory factory;

    @Test
    @DisplayName("should map each bot type to its shared instance")
    void shouldReturnBots() {
        assertSame(passivePolicy, factory.getPolicy(PolicyType.PASSIVE));
        assertSame(randomPolicy, factory.getPolicy(PolicyType.RANDOM));
        assertSame(greedyPolicy, factory.getPolicy(PolicyType.GREEDY));
    }

    @Test
    @DisplayName("should default to GREEDY when no type is given")
    void shouldDefaultToGreedy() {
        assertSame(greedyPolicy, factory.getPolicy(null));
    }

    @Test
    @DisplayName("should create a fresh scripted policy each time")
    void shouldCreateScriptedPolicies() {
        DecisionPolicy first = factory.getPolicy(PolicyType.SCRIPTED);
        DecisionPolicy second = factory.getPolicy(PolicyType.SCRIPTED);

        assertInstanceOf(ScriptedPolicy.class, first);
        assertNotSame(first, second);
    }
}
