package com.riskengine.model;

/**
 * Represents the current status of a game.
 */
public enum GameStatus {
    SETUP,
    IN_PROGRESS,
    FINISHED,
    ABANDONED       // Round limit reached without a winner
}
