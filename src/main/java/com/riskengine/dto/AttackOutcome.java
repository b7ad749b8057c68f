package com.riskengine.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Result of an attack applied to the board, including capture and elimination info.
 */
@Data
@Builder
public class AttackOutcome {
    private String fromRegion;
    private String toRegion;
    private int troopsCommitted;
    private int attackerLosses;
    private int defenderLosses;
    private boolean captured;
    private int troopsMovedIn;
    private String eliminatedPlayer;
    private boolean gameOver;
}
