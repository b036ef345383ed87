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
import java.util.Optional;

/**
 * Service for creating and reading invoices.
 *
 * Cancellations and credit notes are not created here but through {@link ReversalService},
 * payments through {@link PaymentService}.
 */
@Service
@Transactional
public class InvoiceService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceService.class);

    private final InvoiceRepository invoiceRepository;
    private final InvoiceNumberGenerator numberGenerator;
    private final AuditService auditService;

    public InvoiceService(InvoiceRepository invoiceRepository,
                          InvoiceNumberGenerator numberGenerator,
                          AuditService auditService) {
        this.invoiceRepository = invoiceRepository;
        this.numberGenerator = numberGenerator;
        this.auditService = auditService;
    }

    /**
     * Request to issue a new billing document.
     */
    public record NewInvoice(String invoiceNumber, String customerName, String customerEmail,
                             InvoiceType type, BigDecimal amount, LocalDate issueDate,
                             LocalDate dueDate, String projectId) {}

    /**
     * Creates an invoice. A number is generated when none is given.
     */
    public Invoice createInvoice(NewInvoice request, String actor) {
        validate(request);

        String invoiceNumber = request.invoiceNumber();
        if (invoiceNumber == null || invoiceNumber.isBlank()) {
            invoiceNumber = numberGenerator.nextNumber(request.type(), request.issueDate());
        } else if (invoiceRepository.existsByInvoiceNumber(invoiceNumber)) {
            throw new InvoiceValidationException("Invoice number already exists: " + invoiceNumber);
        }

        Invoice invoice = new Invoice(invoiceNumber, request.customerName().trim(), request.type(),
            request.amount(), request.issueDate(), request.dueDate());
        invoice.setCustomerEmail(request.customerEmail());
        invoice.setProjectId(request.projectId());
        try {
            invoice = invoiceRepository.save(invoice);
        } catch (DataIntegrityViolationException e) {
            // Another invoice took the same number between the check and the insert
            throw new ConcurrencyConflictException("Invoice number " + invoiceNumber + " was taken concurrently", e);
        }

        log.info("Created {} invoice {} over {} for {}", invoice.getType(), invoiceNumber,
            invoice.getAmount(), invoice.getCustomerName());
        auditService.logEvent(actor, "INVOICE_CREATED", "Invoice", invoice.getId(),
            "Created invoice " + invoiceNumber + " for " + invoice.getCustomerName()
                + " over " + invoice.getAmount());

        return invoice;
    }

    /**
     * Moves the due date. Status is derived again on the next read; a dunning state that
     * already escalated is left as it is.
     */
    public Invoice changeDueDate(Long invoiceId, LocalDate newDueDate, String actor) {
        if (newDueDate == null) {
            throw new InvoiceValidationException("Due date is required");
        }
        Invoice invoice = invoiceRepository.findByIdForUpdate(invoiceId)
            .orElseThrow(() -> new InvoiceNotFoundException(invoiceId));
        if (invoice.isReversalDocument()) {
            throw new InvalidStateTransitionException(
                "Cannot change the due date of " + invoice.getType() + " " + invoice.getInvoiceNumber());
        }
        if (newDueDate.isBefore(invoice.getIssueDate())) {
            throw new InvoiceValidationException("Due date must not be before the issue date");
        }

        LocalDate previous = invoice.getDueDate();
        invoice.setDueDate(newDueDate);
        try {
            invoice = invoiceRepository.saveAndFlush(invoice);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(
                "Invoice " + invoice.getInvoiceNumber() + " was modified concurrently", e);
        }

        auditService.logEvent(actor, "INVOICE_DUE_DATE_CHANGED", "Invoice", invoice.getId(),
            "Due date of " + invoice.getInvoiceNumber() + " changed from " + previous + " to " + newDueDate);
        return invoice;
    }

    // Query methods

    @Transactional(readOnly = true)
    public Optional<Invoice> findById(Long id) {
        return invoiceRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public Invoice getInvoice(Long id) {
        return invoiceRepository.findById(id).orElseThrow(() -> new InvoiceNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public Optional<Invoice> findByNumber(String invoiceNumber) {
        return invoiceRepository.findByInvoiceNumber(invoiceNumber);
    }

    @Transactional(readOnly = true)
    public InvoiceStatus getStatus(Long invoiceId, LocalDate today) {
        return getInvoice(invoiceId).getStatus(today);
    }

    @Transactional(readOnly = true)
    public List<Invoice> findByProject(String projectId) {
        return invoiceRepository.findByProjectIdOrderByIssueDateAscIdAsc(projectId);
    }

    @Transactional(readOnly = true)
    public List<Invoice> findByCustomer(String customerName) {
        return invoiceRepository.findByCustomerNameOrderByIssueDateDesc(customerName);
    }

    @Transactional(readOnly = true)
    public List<Invoice> findByDateRange(LocalDate startDate, LocalDate endDate) {
        return invoiceRepository.findByDateRange(startDate, endDate);
    }

    @Transactional(readOnly = true)
    public List<Invoice> findOverdue(LocalDate today) {
        return invoiceRepository.findOverdueInvoices(today,
            List.of(InvoiceType.CANCELLATION, InvoiceType.CREDIT_NOTE), InvoiceType.CANCELLATION);
    }

    private void validate(NewInvoice request) {
        if (request == null) {
            throw new InvoiceValidationException("Invoice data is required");
        }
        if (request.customerName() == null || request.customerName().isBlank()) {
            throw new InvoiceValidationException("Customer name is required");
        }
        if (request.type() == null) {
            throw new InvoiceValidationException("Invoice type is required");
        }
        if (request.type().isReversal()) {
            throw new InvoiceValidationException(
                "Cancellations and credit notes are created against an existing invoice");
        }
        if (request.amount() == null || Money.isNegative(request.amount())) {
            throw new InvoiceValidationException("Amount must not be negative");
        }
        if (request.issueDate() == null || request.dueDate() == null) {
            throw new InvoiceValidationException("Issue date and due date are required");
        }
        if (request.dueDate().isBefore(request.issueDate())) {
            throw new InvoiceValidationException("Due date must not be before the issue date");
        }
        if ((request.type() == InvoiceType.DOWN_PAYMENT || request.type() == InvoiceType.FINAL_SETTLEMENT)
            && (request.projectId() == null || request.projectId().isBlank())) {
            throw new InvoiceValidationException(request.type() + " invoices must belong to a project");
        }
    }
}
