package com.riskengine.policy;

import com.riskengine.model.Card;
import com.riskengine.model.GameView;
import com.riskengine.model.PlayerAccount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ScriptedPolicy queues and fallback.
 */
@ExtendWith(MockitoExtension.class)
class ScriptedPolicyTest {

    @Mock
    private DecisionPolicy fallback;

    @Mock
    private GameView game;

    private ScriptedPolicy policy;
    private PlayerAccount self;

    @BeforeEach
    void setUp() {
        policy = new ScriptedPolicy(fallback);
        self = new PlayerAccount("Host", policy);
    }

    @Test
    @DisplayName("should replay queued moves in order before asking the fallback")
    void shouldReplayThenFallBack() {
        PolicyMove fallbackMove = PolicyMove.endAttack();
        when(fallback.decideAttack(game, self)).thenReturn(fallbackMove);
        policy.queueAttack("A", "B", 2).queueAttack("B", "C", 1);

        assertEquals("A", policy.decideAttack(game, self).getFromRegion());
        assertEquals("B", policy.decideAttack(game, self).getFromRegion());
        assertSame(fallbackMove, policy.decideAttack(game, self));
        verify(fallback, times(1)).decideAttack(game, self);
    }

    @Test
    @DisplayName("each decision should have its own queue")
    void shouldKeepQueuesApart() {
        policy.queueDraft("A", 3).queueCaptureMove(4).queueFortify(PolicyMove.skipFortify());

        assertEquals(4, policy.decideCaptureMove(game, self, null, null, 3, 9));
        assertEquals(PolicyMove.MoveType.SKIP_FORTIFY, policy.decideFortify(game, self).getType());
        assertEquals("A", policy.decideDraft(game, self, 3).getToRegion());
        assertTrue(policy.isExhausted());
        verifyNoInteractions(fallback);
    }

    @Test
    @DisplayName("a queued decline should be handed over as an empty trade")
    void shouldReplayDecline() {
        List<Card> cards = List.of(Card.wild(), Card.wild(), Card.wild());
        policy.queueDecline().queueTrade(cards);

        assertEquals(Optional.empty(), policy.decideTrade(game, self, false));
        assertEquals(cards, policy.decideTrade(game, self, false).orElseThrow());
    }

    @Test
    @DisplayName("getType() should return SCRIPTED")
    void shouldReturnScriptedType() {
        assertEquals(PolicyType.SCRIPTED, policy.getType());
    }
}
