package com.riskengine.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a battle fought to the end: exactly one side is left with zero troops.
 */
@Data
@Builder
public class BattleResult {
    private int remainingAttackers;
    private int remainingDefenders;
    private int rounds;

    public boolean isAttackerVictory() {
        return remainingDefenders == 0;
    }
}
