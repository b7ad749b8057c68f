package com.riskengine.service;

import com.riskengine.dto.BattleResult;
import com.riskengine.dto.DiceRound;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Service responsible for dice resolution: single throws, full battles and Monte Carlo odds.
 * Depends only on troop counts and the dice source, never on the board.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CombatService {

    static final int MAX_ATTACK_DICE = 3;
    static final int MAX_DEFENSE_DICE = 2;

    static final int PILOT_TRIALS = 400;
    static final double TARGET_ERROR_TRIALS = 154_000;

    private final DiceRoller diceRoller;

    /**
     * Fight until one side has no troops left. Every throw uses as many dice as each side's
     * current count allows.
     *
     * @throws IllegalArgumentException if either count is not positive
     */
    public BattleResult resolveBattle(int attackerTroops, int defenderTroops) {
        if (attackerTroops <= 0 || defenderTroops <= 0) {
            throw new IllegalArgumentException("Both sides need troops to fight: attackers="
                    + attackerTroops + ", defenders=" + defenderTroops);
        }

        int attackers = attackerTroops;
        int defenders = defenderTroops;
        int rounds = 0;
        while (attackers > 0 && defenders > 0) {
            DiceRound round = rollRound(Math.min(MAX_ATTACK_DICE, attackers), Math.min(MAX_DEFENSE_DICE, defenders));
            attackers -= round.getAttackerLosses();
            defenders -= round.getDefenderLosses();
            rounds++;
        }

        log.debug("Battle {} vs {} ended {} vs {} after {} rounds",
                attackerTroops, defenderTroops, attackers, defenders, rounds);
        return BattleResult.builder()
                .remainingAttackers(attackers)
                .remainingDefenders(defenders)
                .rounds(rounds)
                .build();
    }

    /**
     * A single throw. Attacker dice are rolled before defender dice. Highest dice are paired;
     * the attacker must beat the defender outright, ties go to the defender.
     */
    public DiceRound rollRound(int attackDice, int defendDice) {
        int[] attackerRoll = rollDice(attackDice);
        int[] defenderRoll = rollDice(defendDice);

        int attackerLosses = 0;
        int defenderLosses = 0;

        int comparisons = Math.min(attackerRoll.length, defenderRoll.length);
        for (int i = 0; i < comparisons; i++) {
            if (attackerRoll[i] > defenderRoll[i]) {
                defenderLosses++;
            } else {
                attackerLosses++;
            }
        }

        return DiceRound.builder()
                .attackerDice(attackerRoll)
                .defenderDice(defenderRoll)
                .attackerLosses(attackerLosses)
                .defenderLosses(defenderLosses)
                .build();
    }

    /**
     * Fraction of {@code trials} independent battles the attacker wins, as a percentage with
     * two decimals.
     */
    public double estimateWinProbability(int attackerTroops, int defenderTroops, int trials) {
        if (trials <= 0) {
            throw new IllegalArgumentException("Trial count must be positive: " + trials);
        }
        int wins = countWins(attackerTroops, defenderTroops, trials);
        return Math.round(wins * 10_000.0 / trials) / 100.0;
    }

    /**
     * Two-stage estimate aiming at roughly half a percentage point of error: a short pilot
     * sizes the main run from its own variance.
     */
    public double estimateWinProbability(int attackerTroops, int defenderTroops) {
        double pilot = (double) countWins(attackerTroops, defenderTroops, PILOT_TRIALS) / PILOT_TRIALS;
        double p0;
        if (pilot < 0.48) {
            p0 = pilot + 0.02;
        } else if (pilot > 0.52) {
            p0 = pilot - 0.02;
        } else {
            p0 = 0.5;
        }
        int trials = Math.max(1, (int) (TARGET_ERROR_TRIALS * p0 * (1 - p0)));
        log.debug("Pilot estimate {} for {} vs {}, running {} trials", pilot, attackerTroops, defenderTroops, trials);
        return estimateWinProbability(attackerTroops, defenderTroops, trials);
    }

    private int countWins(int attackerTroops, int defenderTroops, int trials) {
        int wins = 0;
        for (int i = 0; i < trials; i++) {
            if (resolveBattle(attackerTroops, defenderTroops).isAttackerVictory()) {
                wins++;
            }
        }
        return wins;
    }

    int[] rollDice(int count) {
        int[] dice = new int[count];
        for (int i = 0; i < count; i++) {
            dice[i] = diceRoller.roll();
        }
        Arrays.sort(dice);
        reverseArray(dice);
        return dice;
    }

    void reverseArray(int[] arr) {
        for (int i = 0; i < arr.length / 2; i++) {
            int temp = arr[i];
            arr[i] = arr[arr.length - 1 - i];
            arr[arr.length - 1 - i] = temp;
        }
    }
}
