package com.faktura.billing.service;

import com.faktura.billing.domain.DunningState;
import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.Money;
import com.faktura.billing.domain.Payment;
import com.faktura.billing.domain.ReminderEntry;
import com.faktura.billing.domain.ReminderLevel;
import com.faktura.billing.repository.InvoiceRepository;
import com.faktura.billing.repository.PaymentRepository;
import com.faktura.billing.repository.ReminderEntryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects what a printed invoice, reminder or reversal document shows.
 * Rendering is left to the caller.
 */
@Service
@Transactional(readOnly = true)
public class DocumentDataService {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final ReminderEntryRepository reminderEntryRepository;
    private final ProjectBillingService projectBillingService;

    public DocumentDataService(InvoiceRepository invoiceRepository,
                               PaymentRepository paymentRepository,
                               ReminderEntryRepository reminderEntryRepository,
                               ProjectBillingService projectBillingService) {
        this.invoiceRepository = invoiceRepository;
        this.paymentRepository = paymentRepository;
        this.reminderEntryRepository = reminderEntryRepository;
        this.projectBillingService = projectBillingService;
    }

    /**
     * DTO for document data.
     *
     * @param reference        number of the invoice a reversal or reminder refers to, null otherwise
     * @param previousInvoices down payments already billed for the project, listed on a final
     *                         settlement for information; they are not part of {@code total}
     * @param total            amount the document asks for (negative for reversal documents)
     */
    public record DocumentData(
        String title,
        String documentNumber,
        LocalDate documentDate,
        LocalDate dueDate,
        String customerName,
        String reference,
        String note,
        List<DocumentLine> lines,
        List<DocumentLine> previousInvoices,
        BigDecimal total
    ) {
        public record DocumentLine(String description, BigDecimal amount) {}
    }

    public DocumentData forInvoice(Long invoiceId) {
        Invoice invoice = invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new InvoiceNotFoundException(invoiceId));
        if (invoice.isReversalDocument()) {
            return forReversal(invoice);
        }

        List<DocumentData.DocumentLine> lines = new ArrayList<>();
        lines.add(new DocumentData.DocumentLine(titleFor(invoice.getType()) + " " + invoice.getInvoiceNumber(),
            invoice.getAmount()));
        BigDecimal total = invoice.getAmount();

        // The settlement amount bills what is left after the down payments, which are only listed
        List<DocumentData.DocumentLine> previousInvoices = new ArrayList<>();
        if (invoice.getType() == InvoiceType.FINAL_SETTLEMENT && invoice.getProjectId() != null) {
            ProjectBillingSummary summary = projectBillingService.summarize(invoice.getProjectId());
            for (Invoice downPayment : summary.downPayments()) {
                previousInvoices.add(new DocumentData.DocumentLine(
                    "Abschlagsrechnung " + downPayment.getInvoiceNumber() + " vom "
                        + DATE_FORMAT.format(downPayment.getIssueDate()),
                    downPayment.getAmount()));
            }
        }

        for (Payment payment : paymentRepository.findByInvoiceOrderByPaymentDateAscIdAsc(invoice)) {
            lines.add(new DocumentData.DocumentLine("Zahlung vom " + DATE_FORMAT.format(payment.getPaymentDate()),
                payment.getAmount().negate()));
            total = total.subtract(payment.getAmount());
        }

        return new DocumentData(titleFor(invoice.getType()), invoice.getInvoiceNumber(), invoice.getIssueDate(),
            invoice.getDueDate(), invoice.getCustomerName(), null, null, lines, previousInvoices,
            Money.normalize(total));
    }

    public DocumentData forReminder(Long reminderId) {
        ReminderEntry reminder = reminderEntryRepository.findById(reminderId)
            .orElseThrow(() -> new ReminderNotFoundException(reminderId));
        DunningState state = reminder.getDunningState();
        Invoice invoice = state.getInvoice();

        List<DocumentData.DocumentLine> lines = new ArrayList<>();
        lines.add(new DocumentData.DocumentLine("Offener Betrag Rechnung " + invoice.getInvoiceNumber(),
            reminder.getPrincipal()));
        for (ReminderEntry entry : state.getHistory()) {
            if (!reminder.getLevel().isAtLeast(entry.getLevel())) {
                continue;
            }
            if (Money.isPositive(entry.getFee())) {
                lines.add(new DocumentData.DocumentLine("Mahngebühr " + titleFor(entry.getLevel()), entry.getFee()));
            }
            if (Money.isPositive(entry.getInterest())) {
                lines.add(new DocumentData.DocumentLine("Verzugszinsen " + titleFor(entry.getLevel()),
                    entry.getInterest()));
            }
        }

        return new DocumentData(titleFor(reminder.getLevel()), invoice.getInvoiceNumber(), reminder.getSentDate(),
            reminder.getPaymentDueDate(), invoice.getCustomerName(), invoice.getInvoiceNumber(), null, lines,
            List.of(), reminder.getTotalAmount());
    }

    private DocumentData forReversal(Invoice document) {
        Invoice original = document.getRelatedInvoice();
        String reference = original != null ? original.getInvoiceNumber() : null;
        String description = document.isCancellation()
            ? "Storno der Rechnung " + reference
            : "Gutschrift zu Rechnung " + reference;

        List<DocumentData.DocumentLine> lines = List.of(
            new DocumentData.DocumentLine(description, document.getSignedAmount()));
        return new DocumentData(titleFor(document.getType()), document.getInvoiceNumber(), document.getIssueDate(),
            null, document.getCustomerName(), reference, document.getReversalReason(), lines, List.of(),
            document.getSignedAmount());
    }

    static String titleFor(InvoiceType type) {
        return switch (type) {
            case STANDARD -> "Rechnung";
            case DOWN_PAYMENT -> "Abschlagsrechnung";
            case FINAL_SETTLEMENT -> "Schlussrechnung";
            case CANCELLATION -> "Stornorechnung";
            case CREDIT_NOTE -> "Gutschrift";
        };
    }

    static String titleFor(ReminderLevel level) {
        return switch (level) {
            case FRIENDLY -> "Zahlungserinnerung";
            case FIRST -> "1. Mahnung";
            case SECOND -> "2. Mahnung";
            case FINAL -> "Letzte Mahnung";
            case LEGAL -> "Mahnverfahren";
            case NONE -> "";
        };
    }
}
