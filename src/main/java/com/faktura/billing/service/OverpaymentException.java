package com.faktura.billing.service;

import java.math.BigDecimal;

/**
 * A payment exceeds the tolerated share of the outstanding balance.
 */
public class OverpaymentException extends InvoiceValidationException {

    private final BigDecimal maximumAllowed;

    public OverpaymentException(BigDecimal amount, BigDecimal maximumAllowed) {
        super("Payment amount (" + amount + ") exceeds the maximum accepted amount (" + maximumAllowed + ")");
        this.maximumAllowed = maximumAllowed;
    }

    public BigDecimal getMaximumAllowed() {
        return maximumAllowed;
    }
}
