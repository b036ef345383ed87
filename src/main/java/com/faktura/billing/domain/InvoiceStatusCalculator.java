package com.faktura.billing.domain;

import com.faktura.billing.domain.Invoice.InvoiceStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Single source of truth for an invoice's payment status.
 *
 * Rules, in order:
 * 1. paid amount >= amount                 -> PAID
 * 2. past the due date                     -> OVERDUE (also when partially paid)
 * 3. 0 < paid amount < amount              -> PARTIALLY_PAID
 * 4. otherwise                             -> OPEN
 *
 * A partially paid invoice past its due date is reported OVERDUE, never PARTIALLY_PAID.
 */
public final class InvoiceStatusCalculator {

    private InvoiceStatusCalculator() {
    }

    public static InvoiceStatus deriveStatus(BigDecimal amount, BigDecimal paidAmount,
                                             LocalDate dueDate, LocalDate today) {
        if (amount == null || paidAmount == null || dueDate == null || today == null) {
            throw new IllegalArgumentException("Status derivation requires amount, paid amount, due date and day");
        }
        if (amount.signum() < 0 || paidAmount.signum() < 0) {
            throw new IllegalArgumentException(
                "Amounts must not be negative (amount=" + amount + ", paid=" + paidAmount + ")");
        }

        if (paidAmount.compareTo(amount) >= 0) {
            return InvoiceStatus.PAID;
        }
        if (today.isAfter(dueDate)) {
            return InvoiceStatus.OVERDUE;
        }
        if (paidAmount.signum() > 0) {
            return InvoiceStatus.PARTIALLY_PAID;
        }
        return InvoiceStatus.OPEN;
    }
}
