package com.riskengine.exception;

/**
 * A map description could not be read or references names it never defines.
 */
public class MapLoadException extends RuntimeException {

    public MapLoadException(String message) {
        super(message);
    }

    public MapLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
