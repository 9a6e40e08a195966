package com.qasandbox.domain;

/**
 * Base type for rule violations raised by the domain core.
 * Callers map subclasses to transport-level errors.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }
}
