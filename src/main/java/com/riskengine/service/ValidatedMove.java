package com.riskengine.service;

import com.riskengine.model.Region;

/**
 * A policy move after validation, with region names resolved. {@code end} marks a legal
 * "end phase" answer.
 */
public record ValidatedMove(Region from, Region to, int troops, boolean end) {

    private static final ValidatedMove END = new ValidatedMove(null, null, 0, true);

    public static ValidatedMove endPhase() {
        return END;
    }
}
