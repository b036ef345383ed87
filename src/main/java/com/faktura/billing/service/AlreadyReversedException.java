package com.faktura.billing.service;

/**
 * The invoice already has a cancellation.
 */
public class AlreadyReversedException extends InvalidStateTransitionException {

    public AlreadyReversedException(String invoiceNumber) {
        super("Invoice " + invoiceNumber + " has already been cancelled");
    }
}
