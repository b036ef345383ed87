package com.faktura.billing.service;

import com.faktura.billing.domain.ReminderEntry;

import java.util.List;

/**
 * Summary of one dunning scan.
 *
 * @param issued   reminders created by this scan
 * @param failures invoices that could not be evaluated, the scan carried on with the rest
 */
public record DunningScanResult(Long runId, int scanned, int skipped, List<ReminderEntry> issued,
                                List<Failure> failures) {

    public record Failure(Long invoiceId, String error) {}

    public int escalated() {
        return issued.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
