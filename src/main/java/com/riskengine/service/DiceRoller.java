package com.riskengine.service;

/**
 * Source of six-sided die rolls. Injected so simulations are reproducible and tests can
 * script exact sequences.
 */
@FunctionalInterface
public interface DiceRoller {

    /**
     * @return a value in 1..6
     */
    int roll();
}
