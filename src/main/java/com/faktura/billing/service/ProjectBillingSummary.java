package com.faktura.billing.service;

import com.faktura.billing.domain.Invoice;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read-only rollup of a project's down payments against its final settlement.
 *
 * @param settlement                   the current final settlement invoice, null if none was issued yet
 * @param settlementTotal              amount billed by the settlement on top of the down payments
 * @param projectTotal                 down payments plus settlement amount
 * @param difference                   settlement amount minus down payments
 * @param downPaymentsExceedSettlement true when more was billed in advance than the settlement states
 * @param netInvoiced                  sum of all documents, reversals counted negative
 */
public record ProjectBillingSummary(
    String projectId,
    List<Invoice> downPayments,
    Invoice settlement,
    BigDecimal totalDownPayments,
    BigDecimal settlementTotal,
    BigDecimal projectTotal,
    BigDecimal difference,
    boolean downPaymentsExceedSettlement,
    BigDecimal netInvoiced,
    BigDecimal totalPaid,
    BigDecimal outstanding) {

    public boolean hasSettlement() {
        return settlement != null;
    }
}
