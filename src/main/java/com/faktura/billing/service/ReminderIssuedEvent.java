package com.faktura.billing.service;

import com.faktura.billing.domain.ReminderLevel;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Published when a reminder has been recorded for an invoice. Listeners run after the
 * escalation is committed.
 */
public record ReminderIssuedEvent(
    Long reminderId,
    Long invoiceId,
    String invoiceNumber,
    ReminderLevel level,
    LocalDate sentDate,
    BigDecimal fee,
    BigDecimal interest,
    BigDecimal totalAmount,
    boolean automaticSending) {}
