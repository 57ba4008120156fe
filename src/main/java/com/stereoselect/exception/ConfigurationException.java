package com.stereoselect.exception;

/**
 * Unsupported or out-of-range run parameters, raised before any processing
 */
public class ConfigurationException extends SelectionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
