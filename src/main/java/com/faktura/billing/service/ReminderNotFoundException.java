package com.faktura.billing.service;

public class ReminderNotFoundException extends IllegalArgumentException {

    public ReminderNotFoundException(Long reminderId) {
        super("Reminder not found: " + reminderId);
    }
}
