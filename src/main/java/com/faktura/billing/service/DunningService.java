package com.faktura.billing.service;

import com.faktura.billing.config.DunningSettings;
import com.faktura.billing.config.DunningSettingsProvider;
import com.faktura.billing.domain.DunningState;
import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.ReminderEntry;
import com.faktura.billing.domain.ReminderEntry.ReminderStatus;
import com.faktura.billing.domain.ReminderEntry.ResponseType;
import com.faktura.billing.domain.ReminderLevel;
import com.faktura.billing.repository.DunningStateRepository;
import com.faktura.billing.repository.InvoiceRepository;
import com.faktura.billing.repository.ReminderEntryRepository;
import com.faktura.billing.service.DunningPolicy.Decision;
import com.faktura.billing.service.DunningPolicy.DunningCandidate;
import com.faktura.billing.service.DunningPolicy.Escalation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Service driving the per-invoice dunning state machine.
 *
 * Every mutating call locks the invoice row first, so scans and manual triggers for the same
 * invoice run one after the other. The dunning state is versioned and each level can be
 * recorded only once per invoice, so a repeated evaluation never sends a reminder twice.
 */
@Service
@Transactional
public class DunningService {

    private static final Logger log = LoggerFactory.getLogger(DunningService.class);

    private static final Set<ReminderStatus> FINAL_STATUSES = EnumSet.of(ReminderStatus.PAID, ReminderStatus.CANCELLED);
    private static final Set<ReminderStatus> OPEN_STATUSES =
        EnumSet.of(ReminderStatus.PENDING, ReminderStatus.SENT, ReminderStatus.ACKNOWLEDGED);

    private final InvoiceRepository invoiceRepository;
    private final DunningStateRepository dunningStateRepository;
    private final ReminderEntryRepository reminderEntryRepository;
    private final DunningPolicy dunningPolicy;
    private final DunningSettingsProvider settingsProvider;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;

    public DunningService(InvoiceRepository invoiceRepository,
                          DunningStateRepository dunningStateRepository,
                          ReminderEntryRepository reminderEntryRepository,
                          DunningPolicy dunningPolicy,
                          DunningSettingsProvider settingsProvider,
                          AuditService auditService,
                          ApplicationEventPublisher eventPublisher) {
        this.invoiceRepository = invoiceRepository;
        this.dunningStateRepository = dunningStateRepository;
        this.reminderEntryRepository = reminderEntryRepository;
        this.dunningPolicy = dunningPolicy;
        this.settingsProvider = settingsProvider;
        this.auditService = auditService;
        this.eventPublisher = eventPublisher;
    }

    public enum Result {
        ESCALATED,
        NOT_DUE,
        NOT_ELIGIBLE,
        TERMINAL,
        ALREADY_RECORDED
    }

    /**
     * Result of evaluating one invoice.
     *
     * @param reminder the new reminder when {@code result} is ESCALATED, otherwise null
     */
    public record EscalationOutcome(Long invoiceId, Result result, ReminderLevel level,
                                    ReminderEntry reminder, String reason) {}

    /**
     * Evaluates one invoice against the reminder schedule and escalates it by one level if due.
     * Used by the batch scan and whenever a caller wants an invoice re-checked.
     */
    public EscalationOutcome evaluate(Long invoiceId, LocalDate today) {
        Invoice invoice = invoiceRepository.findByIdForUpdate(invoiceId)
            .orElseThrow(() -> new InvoiceNotFoundException(invoiceId));
        DunningSettings settings = settingsProvider.getSettings();
        DunningCandidate candidate = DunningCandidate.of(invoice, isCancelled(invoice));

        Optional<DunningState> existing = dunningStateRepository.findByInvoice(invoice);
        ReminderLevel current = existing.map(DunningState::getLevel).orElse(ReminderLevel.NONE);

        Decision decision = dunningPolicy.evaluate(candidate, current, settings, today);
        switch (decision.outcome()) {
            case NOT_ELIGIBLE:
                return new EscalationOutcome(invoiceId, Result.NOT_ELIGIBLE, current, null, decision.reason());
            case TERMINAL:
                return new EscalationOutcome(invoiceId, Result.TERMINAL, current, null, decision.reason());
            case NOT_DUE:
                // The state exists from the first day the invoice is overdue
                if (existing.isEmpty()) {
                    dunningStateRepository.save(new DunningState(invoice));
                }
                return new EscalationOutcome(invoiceId, Result.NOT_DUE, current, null, decision.reason());
            default:
                break;
        }

        DunningState state = existing.orElseGet(() -> dunningStateRepository.save(new DunningState(invoice)));
        Escalation escalation = decision.escalation();
        if (state.hasReminderFor(escalation.level())) {
            return new EscalationOutcome(invoiceId, Result.ALREADY_RECORDED, state.getLevel(), null,
                escalation.level() + " already recorded");
        }

        ReminderEntry reminder = record(invoice, state, escalation, today, settings, "system");
        return new EscalationOutcome(invoiceId, Result.ESCALATED, reminder.getLevel(), reminder, null);
    }

    /**
     * Issues the next reminder by hand, without waiting for the schedule.
     *
     * @param level must be the level directly after the current one
     */
    public ReminderEntry issueReminder(Long invoiceId, ReminderLevel level, LocalDate today, String actor) {
        if (level == null || level == ReminderLevel.NONE) {
            throw new InvoiceValidationException("A reminder level is required");
        }
        Invoice invoice = invoiceRepository.findByIdForUpdate(invoiceId)
            .orElseThrow(() -> new InvoiceNotFoundException(invoiceId));
        DunningSettings settings = settingsProvider.getSettings();
        DunningCandidate candidate = DunningCandidate.of(invoice, isCancelled(invoice));

        String ineligible = dunningPolicy.ineligibilityReason(candidate, settings, today);
        if (ineligible != null) {
            throw new InvalidStateTransitionException(ineligible);
        }

        DunningState state = dunningStateRepository.findByInvoice(invoice)
            .orElseGet(() -> dunningStateRepository.save(new DunningState(invoice)));
        if (state.hasReminderFor(level)) {
            throw new InvalidStateTransitionException(
                level + " has already been sent for invoice " + invoice.getInvoiceNumber());
        }
        if (level != state.getLevel().next()) {
            throw new InvalidStateTransitionException("Cannot escalate invoice " + invoice.getInvoiceNumber()
                + " from " + state.getLevel() + " to " + level);
        }

        Escalation escalation = dunningPolicy.escalationFor(candidate, level, settings, today);
        return record(invoice, state, escalation, today, settings, actor);
    }

    /**
     * Updates the delivery or settlement status of a reminder. PAID and CANCELLED are final.
     * Reminder status never changes the invoice's money.
     */
    public ReminderEntry updateReminderStatus(Long reminderId, ReminderStatus status, String actor) {
        if (status == null) {
            throw new InvoiceValidationException("Reminder status is required");
        }
        ReminderEntry reminder = reminderEntryRepository.findById(reminderId)
            .orElseThrow(() -> new ReminderNotFoundException(reminderId));
        if (FINAL_STATUSES.contains(reminder.getStatus()) && reminder.getStatus() != status) {
            throw new InvalidStateTransitionException(
                "Reminder " + reminderId + " is " + reminder.getStatus() + " and cannot become " + status);
        }

        ReminderStatus previous = reminder.getStatus();
        reminder.setStatus(status);
        reminder = reminderEntryRepository.save(reminder);

        auditService.logEvent(actor, "REMINDER_STATUS_CHANGED", "ReminderEntry", reminder.getId(),
            "Reminder " + reminder.getLevel() + " status " + previous + " -> " + status);
        return reminder;
    }

    /**
     * Records how the customer reacted to a reminder.
     */
    public ReminderEntry recordResponse(Long reminderId, ResponseType type, LocalDate date, String notes,
                                        String actor) {
        if (type == null || date == null) {
            throw new InvoiceValidationException("Response type and date are required");
        }
        ReminderEntry reminder = reminderEntryRepository.findById(reminderId)
            .orElseThrow(() -> new ReminderNotFoundException(reminderId));
        reminder.recordResponse(type, date, notes);
        if (reminder.getStatus() == ReminderStatus.PENDING || reminder.getStatus() == ReminderStatus.SENT) {
            reminder.setStatus(ReminderStatus.ACKNOWLEDGED);
        }
        reminder = reminderEntryRepository.save(reminder);

        auditService.logEvent(actor, "REMINDER_RESPONSE", "ReminderEntry", reminder.getId(),
            "Customer response " + type + " on " + date + (notes != null ? ": " + notes : ""));
        return reminder;
    }

    // Query methods

    @Transactional(readOnly = true)
    public Optional<DunningState> findState(Long invoiceId) {
        return dunningStateRepository.findByInvoiceId(invoiceId);
    }

    @Transactional(readOnly = true)
    public List<ReminderEntry> findHistory(Long invoiceId) {
        return reminderEntryRepository.findByInvoiceId(invoiceId);
    }

    /**
     * Reminders recorded but not yet delivered, oldest first. With automatic sending switched
     * off this is the queue of reminders to send by hand.
     */
    @Transactional(readOnly = true)
    public List<ReminderEntry> findPendingReminders() {
        return reminderEntryRepository.findByStatusOrderBySentDateAsc(ReminderStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public ReminderLevel currentLevel(Long invoiceId) {
        return findState(invoiceId).map(DunningState::getLevel).orElse(ReminderLevel.NONE);
    }

    private boolean isCancelled(Invoice invoice) {
        return invoiceRepository.existsReversalOfType(invoice.getId(), InvoiceType.CANCELLATION);
    }

    private ReminderEntry record(Invoice invoice, DunningState state, Escalation escalation, LocalDate today,
                                 DunningSettings settings, String actor) {
        BigDecimal totalFees = state.getTotalFees().add(escalation.fee());
        BigDecimal totalInterest = state.getTotalInterest().add(escalation.interest());
        BigDecimal totalAmount = escalation.principal().add(totalFees).add(totalInterest);

        ReminderEntry reminder = new ReminderEntry(escalation.level(), today,
            today.plusDays(settings.paymentGraceDays()), escalation.daysOverdue(),
            escalation.principal(), escalation.fee(), escalation.interest(), totalAmount);

        state.getHistory().stream()
            .filter(previous -> OPEN_STATUSES.contains(previous.getStatus()))
            .forEach(previous -> previous.setStatus(ReminderStatus.ESCALATED));
        state.append(reminder);

        try {
            reminder = reminderEntryRepository.save(reminder);
            dunningStateRepository.saveAndFlush(state);
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw new ConcurrencyConflictException(
                "Dunning state of invoice " + invoice.getInvoiceNumber() + " was modified concurrently", e);
        }

        log.info("Invoice {} escalated to {} ({} days overdue, fee {}, interest {})",
            invoice.getInvoiceNumber(), escalation.level(), escalation.daysOverdue(),
            escalation.fee(), escalation.interest());
        auditService.logEvent(actor, "REMINDER_ISSUED", "Invoice", invoice.getId(),
            escalation.level() + " for invoice " + invoice.getInvoiceNumber() + ": fee " + escalation.fee()
                + ", interest " + escalation.interest() + ", total " + totalAmount);

        eventPublisher.publishEvent(new ReminderIssuedEvent(reminder.getId(), invoice.getId(),
            invoice.getInvoiceNumber(), reminder.getLevel(), today, reminder.getFee(), reminder.getInterest(),
            reminder.getTotalAmount(), settings.automaticSending()));
        return reminder;
    }
}
