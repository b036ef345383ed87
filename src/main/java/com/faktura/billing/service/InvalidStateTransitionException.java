package com.faktura.billing.service;

/**
 * The requested operation is not allowed in the invoice's or reminder's current state.
 */
public class InvalidStateTransitionException extends IllegalStateException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
