package com.riskengine.exception;

/**
 * A trade-in was attempted with cards that do not form a valid set.
 * Callers are expected to validate first, so this signals an engine fault.
 */
public class CardSetException extends IllegalStateException {

    public CardSetException(String message) {
        super(message);
    }
}
