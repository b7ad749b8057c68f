package com.riskengine.exception;

/**
 * Game setup cannot proceed with the given roster or map.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }
}
