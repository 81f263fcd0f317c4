package com.example.rental.domain.exception;

/**
 * Base class for business rule violations raised by the domain layer.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
