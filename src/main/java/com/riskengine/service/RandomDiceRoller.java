package com.riskengine.service;

import java.util.Random;

/**
 * Dice backed by an injected {@link Random}; seed the generator to replay a game.
 */
public class RandomDiceRoller implements DiceRoller {

    private final Random random;

    public RandomDiceRoller(Random random) {
        this.random = random;
    }

    @Override
    public int roll() {
        return random.nextInt(6) + 1;
    }
}
