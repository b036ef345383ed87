package com.faktura.billing.service;

import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceStatus;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.Money;
import com.faktura.billing.repository.InvoiceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Service for reversing documents: cancellations (Storno) and credit notes (Gutschrift).
 *
 * Both are new invoices linked to the original and settle themselves on creation.
 *
 * Cancellation: at most one per original. The original keeps its amount and paid amount and
 * is only marked as cancelled through the link; it then takes no further payments, credit
 * notes or reminders.
 *
 * Credit note: a full credit on a paid original reopens it (paid amount back to zero);
 * otherwise the credit reduces the original's paid amount, never below zero.
 */
@Service
@Transactional
public class ReversalService {

    private static final Logger log = LoggerFactory.getLogger(ReversalService.class);

    private final InvoiceRepository invoiceRepository;
    private final InvoiceNumberGenerator numberGenerator;
    private final AuditService auditService;

    public ReversalService(InvoiceRepository invoiceRepository,
                           InvoiceNumberGenerator numberGenerator,
                           AuditService auditService) {
        this.invoiceRepository = invoiceRepository;
        this.numberGenerator = numberGenerator;
        this.auditService = auditService;
    }

    /**
     * Cancels an invoice by creating its Storno document.
     *
     * @param originalId The invoice to cancel
     * @param reason     Why the invoice is cancelled, printed on the document
     * @param today      Issue date of the cancellation
     * @param actor      The user cancelling
     * @return The new cancellation document
     */
    public Invoice createCancellation(Long originalId, String reason, LocalDate today, String actor) {
        if (reason == null || reason.isBlank()) {
            throw new InvoiceValidationException("A reason is required to cancel an invoice");
        }

        Invoice original = loadReversible(originalId);
        if (isCancelled(original)) {
            throw new AlreadyReversedException(original.getInvoiceNumber());
        }

        Invoice cancellation = newReversalDocument(original, InvoiceType.CANCELLATION,
            original.getAmount(), reason, today);
        cancellation = saveDocument(cancellation, original);

        log.info("Cancelled invoice {} with {} ({})", original.getInvoiceNumber(),
            cancellation.getInvoiceNumber(), reason);
        auditService.logEvent(actor, "INVOICE_CANCELLED", "Invoice", original.getId(),
            "Cancelled invoice " + original.getInvoiceNumber() + " with " + cancellation.getInvoiceNumber()
                + ": " + reason);

        return cancellation;
    }

    /**
     * Issues a credit note against an invoice and adjusts the original's paid amount.
     *
     * @param originalId The invoice being credited
     * @param amount     Credited amount, at most the original amount
     * @param reason     Why the credit is granted
     * @param today      Issue date of the credit note
     * @param actor      The user issuing the credit
     * @return The new credit note
     */
    public Invoice createCreditNote(Long originalId, BigDecimal amount, String reason, LocalDate today,
                                    String actor) {
        if (amount == null || !Money.isPositive(Money.normalize(amount))) {
            throw new InvoiceValidationException("Credit amount must be positive");
        }
        BigDecimal creditAmount = Money.normalize(amount);

        Invoice original = loadReversible(originalId);
        if (creditAmount.compareTo(original.getAmount()) > 0) {
            throw new InvoiceValidationException("Credit amount (" + creditAmount
                + ") cannot exceed original invoice amount (" + original.getAmount() + ")");
        }
        if (isCancelled(original)) {
            throw new InvalidStateTransitionException(
                "Invoice " + original.getInvoiceNumber() + " has been cancelled and cannot be credited");
        }

        Invoice creditNote = newReversalDocument(original, InvoiceType.CREDIT_NOTE, creditAmount, reason, today);
        creditNote = saveDocument(creditNote, original);

        BigDecimal previousPaid = original.getPaidAmount();
        if (creditAmount.compareTo(original.getAmount()) == 0
            && original.getStatus(today) == InvoiceStatus.PAID) {
            // Full credit reopens the invoice
            original.setPaidAmount(Money.ZERO);
        } else if (Money.isPositive(previousPaid)) {
            original.setPaidAmount(Money.subtractFloorZero(previousPaid, creditAmount));
        }

        if (original.getPaidAmount().compareTo(previousPaid) != 0) {
            try {
                original = invoiceRepository.saveAndFlush(original);
            } catch (OptimisticLockingFailureException e) {
                throw new ConcurrencyConflictException(
                    "Invoice " + original.getInvoiceNumber() + " was modified concurrently", e);
            }
        }

        log.info("Credited {} on invoice {} with {}, paid amount {} -> {}, status {}",
            creditAmount, original.getInvoiceNumber(), creditNote.getInvoiceNumber(),
            previousPaid, original.getPaidAmount(), original.getStatus(today));
        auditService.logEvent(actor, "CREDIT_NOTE_CREATED", "Invoice", original.getId(),
            "Credit note " + creditNote.getInvoiceNumber() + " over " + creditAmount + " for invoice "
                + original.getInvoiceNumber() + (reason != null ? ": " + reason : ""));

        return creditNote;
    }

    // Query methods

    @Transactional(readOnly = true)
    public List<Invoice> findReversals(Long originalId) {
        Invoice original = invoiceRepository.findById(originalId)
            .orElseThrow(() -> new InvoiceNotFoundException(originalId));
        return invoiceRepository.findByRelatedInvoiceOrderByIssueDateAscIdAsc(original);
    }

    @Transactional(readOnly = true)
    public boolean isCancelled(Long originalId) {
        return invoiceRepository.existsReversalOfType(originalId, InvoiceType.CANCELLATION);
    }

    private boolean isCancelled(Invoice original) {
        return invoiceRepository.existsByRelatedInvoiceAndType(original, InvoiceType.CANCELLATION);
    }

    private Invoice loadReversible(Long originalId) {
        Invoice original = invoiceRepository.findByIdForUpdate(originalId)
            .orElseThrow(() -> new InvoiceNotFoundException(originalId));
        if (original.isReversalDocument()) {
            throw new InvalidStateTransitionException(
                "Cannot reverse " + original.getType() + " " + original.getInvoiceNumber());
        }
        return original;
    }

    // Numbers and the single cancellation per invoice are unique in the database; a concurrent
    // reversal that got there first surfaces here
    private Invoice saveDocument(Invoice document, Invoice original) {
        try {
            return invoiceRepository.save(document);
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException("Could not store " + document.getType() + " "
                + document.getInvoiceNumber() + " for invoice " + original.getInvoiceNumber()
                + ", another reversal was created concurrently", e);
        }
    }

    private Invoice newReversalDocument(Invoice original, InvoiceType type, BigDecimal amount,
                                        String reason, LocalDate today) {
        String number = numberGenerator.nextNumber(type, today);
        Invoice document = new Invoice(number, original.getCustomerName(), type, amount, today, today);
        document.setCustomerEmail(original.getCustomerEmail());
        document.setProjectId(original.getProjectId());
        // Reversal documents settle themselves
        document.setPaidAmount(amount);
        document.setRelatedInvoice(original);
        document.setRelatedAmount(original.getAmount());
        document.setReversalReason(reason);
        return document;
    }
}
