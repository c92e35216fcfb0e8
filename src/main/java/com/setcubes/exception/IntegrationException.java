package com.setcubes.exception;

/**
 * Exception thrown when a caller hands the engine inconsistent input.
 * Typically a universe that is not eight cards, or a line using a token
 * the round's pool does not hold. Player mistakes are never reported this way.
 */
public class IntegrationException extends SetCubesException {

    public IntegrationException(String message) {
        super(message);
    }

    public IntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
