package com.faktura.billing.service;

import com.faktura.billing.domain.DayCount;
import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.Money;
import com.faktura.billing.domain.ReminderEntry;
import com.faktura.billing.domain.ReminderEntry.ReminderStatus;
import com.faktura.billing.domain.ReminderLevel;
import com.faktura.billing.repository.InvoiceRepository;
import com.faktura.billing.repository.ReminderEntryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Overview figures for the dunning dashboard.
 */
@Service
@Transactional(readOnly = true)
public class ReminderStatisticsService {

    private final InvoiceRepository invoiceRepository;
    private final ReminderEntryRepository reminderEntryRepository;

    public ReminderStatisticsService(InvoiceRepository invoiceRepository,
                                     ReminderEntryRepository reminderEntryRepository) {
        this.invoiceRepository = invoiceRepository;
        this.reminderEntryRepository = reminderEntryRepository;
    }

    public record ReminderStatistics(
        LocalDate asOfDate,
        int totalOverdue,
        BigDecimal totalOutstanding,
        List<LevelLine> byLevel,
        List<AgeBucket> byAge,
        BigDecimal averageDaysOverdue,
        BigDecimal collectionRate       // percent of reminders that ended in payment
    ) {}

    public record LevelLine(ReminderLevel level, int count, BigDecimal amount) {}

    public record AgeBucket(String range, int count, BigDecimal amount) {}

    public ReminderStatistics getStatistics(LocalDate today) {
        List<Invoice> overdue = invoiceRepository.findOverdueInvoices(today,
            EnumSet.of(InvoiceType.CANCELLATION, InvoiceType.CREDIT_NOTE), InvoiceType.CANCELLATION);
        List<ReminderEntry> reminders = reminderEntryRepository.findAll();

        BigDecimal totalOutstanding = Money.ZERO;
        long totalDays = 0;
        int[] ageCounts = new int[4];
        BigDecimal[] ageAmounts = {Money.ZERO, Money.ZERO, Money.ZERO, Money.ZERO};

        for (Invoice invoice : overdue) {
            BigDecimal balance = invoice.getBalance();
            long days = DayCount.daysOverdue(invoice.getDueDate(), today);
            totalOutstanding = totalOutstanding.add(balance);
            totalDays += days;

            int bucket;
            if (days <= 30) {
                bucket = 0;
            } else if (days <= 60) {
                bucket = 1;
            } else if (days <= 90) {
                bucket = 2;
            } else {
                bucket = 3;
            }
            ageCounts[bucket]++;
            ageAmounts[bucket] = ageAmounts[bucket].add(balance);
        }

        List<AgeBucket> byAge = List.of(
            new AgeBucket("0-30", ageCounts[0], ageAmounts[0]),
            new AgeBucket("31-60", ageCounts[1], ageAmounts[1]),
            new AgeBucket("61-90", ageCounts[2], ageAmounts[2]),
            new AgeBucket("90+", ageCounts[3], ageAmounts[3]));

        List<LevelLine> byLevel = new ArrayList<>();
        for (ReminderLevel level : ReminderLevel.values()) {
            if (level == ReminderLevel.NONE) {
                continue;
            }
            List<ReminderEntry> atLevel = reminders.stream().filter(r -> r.getLevel() == level).toList();
            BigDecimal amount = atLevel.stream().map(ReminderEntry::getTotalAmount)
                .reduce(Money.ZERO, BigDecimal::add);
            byLevel.add(new LevelLine(level, atLevel.size(), amount));
        }

        BigDecimal averageDays = overdue.isEmpty()
            ? BigDecimal.ZERO.setScale(1)
            : BigDecimal.valueOf(totalDays).divide(BigDecimal.valueOf(overdue.size()), 1, RoundingMode.HALF_UP);

        long paid = reminders.stream().filter(r -> r.getStatus() == ReminderStatus.PAID).count();
        BigDecimal collectionRate = reminders.isEmpty()
            ? BigDecimal.ZERO.setScale(1)
            : BigDecimal.valueOf(paid * 100).divide(BigDecimal.valueOf(reminders.size()), 1, RoundingMode.HALF_UP);

        return new ReminderStatistics(today, overdue.size(), totalOutstanding, byLevel, byAge,
            averageDays, collectionRate);
    }
}
