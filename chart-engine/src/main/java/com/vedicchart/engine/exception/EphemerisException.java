package com.vedicchart.engine.exception;

/**
 * The ephemeris collaborator could not be reached or answered with an error.
 */
public class EphemerisException extends RuntimeException {

    public EphemerisException(String message) {
        super(message);
    }

    public EphemerisException(String message, Throwable cause) {
        super(message, cause);
    }
}
