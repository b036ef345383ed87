package com.faktura.billing.service;

/**
 * Another writer changed the invoice or its dunning state in between. Retrying the whole
 * operation is safe.
 */
public class ConcurrencyConflictException extends RuntimeException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
