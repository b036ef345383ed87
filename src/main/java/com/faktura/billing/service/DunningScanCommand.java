package com.faktura.billing.service;

import java.time.LocalDate;

/**
 * Request to run one dunning scan.
 *
 * @param asOfDate    business day the scan evaluates invoices against
 * @param triggeredBy "scheduler" for the nightly job, otherwise the user starting the scan
 */
public record DunningScanCommand(LocalDate asOfDate, String triggeredBy) {

    public DunningScanCommand {
        if (asOfDate == null) {
            throw new InvoiceValidationException("Scan date is required");
        }
        if (triggeredBy == null || triggeredBy.isBlank()) {
            triggeredBy = "system";
        }
    }
}
