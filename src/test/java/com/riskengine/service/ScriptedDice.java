package com.riskengine.service;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Dice that return a fixed sequence, attacker dice first within each throw.
 */
class ScriptedDice implements DiceRoller {

    private final Deque<Integer> values = new ArrayDeque<>();

    static ScriptedDice of(int... faces) {
        ScriptedDice dice = new ScriptedDice();
        dice.add(faces);
        return dice;
    }

    void add(int... faces) {
        for (int face : faces) {
            values.add(face);
        }
    }

    int remaining() {
        return values.size();
    }

    @Override
    public int roll() {
        Integer face = values.poll();
        if (face == null) {
            throw new IllegalStateException("Scripted dice ran out");
        }
        return face;
    }
}
