package com.example.depositaccrual.exception;

/**
 * Thrown when the position store file cannot be read or written
 */
public class PositionStorageException extends RuntimeException {

    public PositionStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
