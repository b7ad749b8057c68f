package com.riskengine.dto;

import lombok.Builder;
import lombok.Data;

/**
 * One throw of the dice: both sides' dice sorted highest first and the troops each side lost.
 */
@Data
@Builder
public class DiceRound {
    private int[] attackerDice;
    private int[] defenderDice;
    private int attackerLosses;
    private int defenderLosses;
}
