package com.setcubes.exception;

/**
 * Base exception for the SetCubes engine.
 */
public class SetCubesException extends RuntimeException {

    public SetCubesException(String message) {
        super(message);
    }

    public SetCubesException(String message, Throwable cause) {
        super(message, cause);
    }
}
