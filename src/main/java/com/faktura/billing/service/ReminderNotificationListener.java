package com.faktura.billing.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Sends a reminder once the escalation that created it has been committed.
 */
@Component
public class ReminderNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(ReminderNotificationListener.class);

    private final ReminderNotificationService notificationService;

    public ReminderNotificationListener(ReminderNotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onReminderIssued(ReminderIssuedEvent event) {
        if (!event.automaticSending()) {
            log.debug("Automatic sending disabled, reminder {} for invoice {} stays pending",
                event.reminderId(), event.invoiceNumber());
            return;
        }
        try {
            notificationService.send(event.reminderId(), "system");
        } catch (Exception e) {
            log.error("Failed to send {} for invoice {}: {}", event.level(), event.invoiceNumber(),
                e.getMessage(), e);
        }
    }
}
