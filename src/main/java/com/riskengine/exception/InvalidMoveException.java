package com.riskengine.exception;

import com.riskengine.model.GamePhase;
import lombok.Getter;

/**
 * Thrown when a decision policy proposes a move that violates ownership, adjacency
 * or troop-count rules. Nothing has been mutated when this is raised.
 */
@Getter
public class InvalidMoveException extends IllegalArgumentException {

    private final String playerName;
    private final GamePhase phase;

    public InvalidMoveException(String playerName, GamePhase phase, String message) {
        super(message);
        this.playerName = playerName;
        this.phase = phase;
    }
}
