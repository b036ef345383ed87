package com.faktura.billing.service;

import com.faktura.billing.domain.DunningState;
import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.ReminderEntry;
import com.faktura.billing.domain.ReminderEntry.ReminderStatus;
import com.faktura.billing.repository.ReminderEntryRepository;
import com.faktura.billing.service.EmailService.EmailResult;
import com.faktura.billing.service.ReminderTemplateService.RenderedReminder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;

/**
 * Sends reminder emails and marks the reminders as sent.
 *
 * Runs in its own transaction: a failed delivery leaves the reminder PENDING and never
 * touches the escalation that created it.
 */
@Service
public class ReminderNotificationService {

    private static final Logger log = LoggerFactory.getLogger(ReminderNotificationService.class);

    private final ReminderEntryRepository reminderEntryRepository;
    private final ReminderTemplateService templateService;
    private final EmailService emailService;
    private final Clock clock;

    public ReminderNotificationService(ReminderEntryRepository reminderEntryRepository,
                                       ReminderTemplateService templateService,
                                       EmailService emailService,
                                       Clock clock) {
        this.reminderEntryRepository = reminderEntryRepository;
        this.templateService = templateService;
        this.emailService = emailService;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public EmailResult send(Long reminderId, String actor) {
        ReminderEntry reminder = reminderEntryRepository.findById(reminderId)
            .orElseThrow(() -> new ReminderNotFoundException(reminderId));
        if (reminder.getStatus() != ReminderStatus.PENDING && reminder.getStatus() != ReminderStatus.SENT) {
            throw new InvalidStateTransitionException(
                "Reminder " + reminderId + " is " + reminder.getStatus() + " and cannot be sent");
        }

        DunningState state = reminder.getDunningState();
        Invoice invoice = state.getInvoice();
        RenderedReminder rendered = templateService.render(invoice, reminder, feesUpTo(state, reminder));

        EmailResult result = emailService.sendReminder(invoice, rendered.subject(), rendered.body(), actor);
        if (result.success()) {
            reminder.markSent(clock.instant());
            reminderEntryRepository.save(reminder);
            log.info("Reminder {} ({}) for invoice {} sent", reminderId, reminder.getLevel(),
                invoice.getInvoiceNumber());
        } else {
            log.warn("Reminder {} for invoice {} not sent: {} ({})", reminderId, invoice.getInvoiceNumber(),
                result.status(), result.message());
        }
        return result;
    }

    private BigDecimal feesUpTo(DunningState state, ReminderEntry reminder) {
        return state.getHistory().stream()
            .filter(entry -> reminder.getLevel().isAtLeast(entry.getLevel()))
            .map(ReminderEntry::getFee)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
