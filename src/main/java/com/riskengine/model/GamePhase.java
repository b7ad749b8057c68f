package com.riskengine.model;

/**
 * Represents the current phase within a player's turn.
 */
public enum GamePhase {
    SETUP,              // Regions dealt and starting armies placed
    DRAFT,              // Trades and reinforcement placement
    ATTACK,             // Player may attack adjacent enemy regions
    FORTIFY,            // One voluntary regroup move
    END,                // Totals recomputed, earned card drawn
    GAME_OVER
}
