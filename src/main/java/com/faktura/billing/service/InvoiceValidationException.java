package com.faktura.billing.service;

/**
 * Malformed input (non-positive amount, missing field). Raised before any state change.
 */
public class InvoiceValidationException extends IllegalArgumentException {

    public InvoiceValidationException(String message) {
        super(message);
    }
}
