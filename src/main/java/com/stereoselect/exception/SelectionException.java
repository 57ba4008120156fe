package com.stereoselect.exception;

/**
 * Base class of the errors raised by footprint selection
 */
public class SelectionException extends RuntimeException {

    public SelectionException(String message) {
        super(message);
    }

    public SelectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
