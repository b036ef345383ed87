package com.faktura.billing.service;

import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceStatus;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.Money;
import com.faktura.billing.domain.Payment;
import com.faktura.billing.domain.Payment.PaymentMethod;
import com.faktura.billing.repository.InvoiceRepository;
import com.faktura.billing.repository.PaymentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Service for applying customer payments to invoices.
 *
 * Overpayment handling:
 * - Up to 110% of the outstanding balance is accepted. If the invoice ends up overpaid,
 *   the result carries a warning and the overpaid amount for manual review.
 * - Anything above that is rejected with {@link OverpaymentException}.
 *
 * The invoice row is locked for the whole operation, so two concurrent payments
 * cannot both pass the "not yet paid" check.
 */
@Service
@Transactional
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    // Accepted share of the outstanding balance, in percent
    static final BigDecimal OVERPAYMENT_TOLERANCE_PERCENT = BigDecimal.valueOf(110);

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final AuditService auditService;

    public PaymentService(InvoiceRepository invoiceRepository,
                          PaymentRepository paymentRepository,
                          AuditService auditService) {
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.auditService = auditService;
    }

    /**
     * Payment data as entered by the user or delivered by a payment gateway.
     */
    public record PaymentRequest(LocalDate date, BigDecimal amount, PaymentMethod method,
                                 String reference) {}

    /**
     * Outcome of a successful payment.
     *
     * @param overpaymentWarning true when the invoice is now paid beyond its amount
     * @param overpaidAmount     paid amount minus invoice amount, zero when not overpaid
     */
    public record PaymentResult(Invoice invoice, Payment payment, InvoiceStatus status,
                                boolean overpaymentWarning, BigDecimal overpaidAmount) {}

    /**
     * Applies a payment to an invoice.
     *
     * @param invoiceId The invoice being paid
     * @param request   The payment
     * @param today     Business day used to derive the resulting status
     * @param actor     The user recording the payment
     * @return The stored payment and the invoice's new state
     */
    public PaymentResult applyPayment(Long invoiceId, PaymentRequest request, LocalDate today, String actor) {
        validateRequest(request);

        Invoice invoice = invoiceRepository.findByIdForUpdate(invoiceId)
            .orElseThrow(() -> new InvoiceNotFoundException(invoiceId));

        if (invoice.isReversalDocument()) {
            throw new InvalidStateTransitionException(
                "Payments cannot be applied to " + invoice.getType() + " " + invoice.getInvoiceNumber());
        }
        if (invoiceRepository.existsReversalOfType(invoice.getId(), InvoiceType.CANCELLATION)) {
            throw new InvalidStateTransitionException(
                "Invoice " + invoice.getInvoiceNumber() + " has been cancelled");
        }
        if (invoice.getStatus(today) == InvoiceStatus.PAID) {
            throw new InvalidStateTransitionException(
                "Invoice " + invoice.getInvoiceNumber() + " is already paid");
        }

        BigDecimal amount = Money.normalize(request.amount());
        BigDecimal maximum = Money.percentOf(invoice.getBalance(), OVERPAYMENT_TOLERANCE_PERCENT);
        if (amount.compareTo(maximum) > 0) {
            throw new OverpaymentException(amount, maximum);
        }

        Payment payment = paymentRepository.save(
            new Payment(invoice, request.date(), amount, request.method(), request.reference()));

        invoice.setPaidAmount(invoice.getPaidAmount().add(amount));
        try {
            invoice = invoiceRepository.saveAndFlush(invoice);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(
                "Invoice " + invoice.getInvoiceNumber() + " was modified concurrently", e);
        }

        InvoiceStatus status = invoice.getStatus(today);
        BigDecimal overpaid = Money.subtractFloorZero(invoice.getPaidAmount(), invoice.getAmount());
        boolean overpaymentWarning = overpaid.signum() > 0;

        if (overpaymentWarning) {
            log.warn("Invoice {} overpaid by {} (paid {} of {}), flagged for review",
                invoice.getInvoiceNumber(), overpaid, invoice.getPaidAmount(), invoice.getAmount());
        }
        log.info("Applied payment of {} to invoice {}, status now {}",
            amount, invoice.getInvoiceNumber(), status);

        auditService.logEvent(actor, "PAYMENT_APPLIED", "Invoice", invoice.getId(),
            "Applied " + request.method() + " payment of " + amount + " to invoice "
                + invoice.getInvoiceNumber() + (overpaymentWarning ? " (overpaid by " + overpaid + ")" : ""));

        return new PaymentResult(invoice, payment, status, overpaymentWarning, overpaid);
    }

    // Query methods

    @Transactional(readOnly = true)
    public List<Payment> findPayments(Long invoiceId) {
        Invoice invoice = invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new InvoiceNotFoundException(invoiceId));
        return paymentRepository.findByInvoiceOrderByPaymentDateAscIdAsc(invoice);
    }

    @Transactional(readOnly = true)
    public List<Payment> findPaymentsBetween(LocalDate from, LocalDate to) {
        return paymentRepository.findByPaymentDateBetweenOrderByPaymentDateDesc(from, to);
    }

    private void validateRequest(PaymentRequest request) {
        if (request == null) {
            throw new InvoiceValidationException("Payment is required");
        }
        if (request.amount() == null || !Money.isPositive(Money.normalize(request.amount()))) {
            throw new InvoiceValidationException("Payment amount must be positive");
        }
        if (request.date() == null) {
            throw new InvoiceValidationException("Payment date is required");
        }
        if (request.method() == null) {
            throw new InvoiceValidationException("Payment method is required");
        }
    }
}
