package com.faktura.billing.service;

import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.Money;
import com.faktura.billing.repository.InvoiceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rolls up the down payment (Abschlag) invoices of a project against its final settlement
 * (Schlussrechnung).
 *
 * A final settlement bills what is left after the down payments, so its amount is owed in full
 * and the project total is down payments plus settlement. Cancelled invoices are left out of the
 * rollup. Down payments exceeding the settlement are reported and logged, not prevented.
 */
@Service
@Transactional(readOnly = true)
public class ProjectBillingService {

    private static final Logger log = LoggerFactory.getLogger(ProjectBillingService.class);

    private final InvoiceRepository invoiceRepository;

    public ProjectBillingService(InvoiceRepository invoiceRepository) {
        this.invoiceRepository = invoiceRepository;
    }

    public ProjectBillingSummary summarize(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new InvoiceValidationException("Project id is required");
        }

        List<Invoice> invoices = invoiceRepository.findByProjectIdOrderByIssueDateAscIdAsc(projectId);

        // Reversal documents carry the project id of their original
        Set<Long> cancelledIds = invoices.stream()
            .filter(Invoice::isCancellation)
            .filter(i -> i.getRelatedInvoice() != null)
            .map(i -> i.getRelatedInvoice().getId())
            .collect(Collectors.toSet());

        List<Invoice> active = invoices.stream()
            .filter(i -> !i.isReversalDocument())
            .filter(i -> !cancelledIds.contains(i.getId()))
            .toList();

        List<Invoice> downPayments = active.stream()
            .filter(i -> i.getType() == InvoiceType.DOWN_PAYMENT)
            .toList();
        Invoice settlement = active.stream()
            .filter(i -> i.getType() == InvoiceType.FINAL_SETTLEMENT)
            .max(Comparator.comparing(Invoice::getIssueDate).thenComparing(Invoice::getId,
                Comparator.nullsFirst(Comparator.naturalOrder())))
            .orElse(null);

        BigDecimal totalDownPayments = sum(downPayments.stream().map(Invoice::getAmount).toList());
        BigDecimal settlementTotal = settlement != null ? settlement.getAmount() : Money.ZERO;
        BigDecimal projectTotal = totalDownPayments.add(settlementTotal);
        BigDecimal difference = settlementTotal.subtract(totalDownPayments);
        boolean exceeds = settlement != null && totalDownPayments.compareTo(settlementTotal) > 0;

        if (exceeds) {
            log.warn("Project {}: down payments {} exceed final settlement {} ({})",
                projectId, totalDownPayments, settlementTotal, settlement.getInvoiceNumber());
        }

        BigDecimal netInvoiced = sum(invoices.stream().map(Invoice::getSignedAmount).toList());
        BigDecimal totalPaid = sum(active.stream().map(Invoice::getPaidAmount).toList());
        BigDecimal outstanding = sum(active.stream().map(Invoice::getBalance).toList());

        return new ProjectBillingSummary(projectId, downPayments, settlement, totalDownPayments,
            settlementTotal, projectTotal, difference, exceeds, netInvoiced, totalPaid, outstanding);
    }

    private BigDecimal sum(List<BigDecimal> amounts) {
        return amounts.stream().reduce(Money.ZERO, BigDecimal::add);
    }
}
