package com.example.depositaccrual.exception;

/**
 * Thrown when a request violates a business rule
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
