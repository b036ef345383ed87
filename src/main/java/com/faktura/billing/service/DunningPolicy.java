package com.faktura.billing.service;

import com.faktura.billing.config.DunningSettings;
import com.faktura.billing.domain.DayCount;
import com.faktura.billing.domain.Invoice;
import com.faktura.billing.domain.Invoice.InvoiceStatus;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.InvoiceStatusCalculator;
import com.faktura.billing.domain.Money;
import com.faktura.billing.domain.ReminderLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Decides whether an invoice's dunning level advances and what the new reminder charges.
 *
 * Rules:
 * - only OVERDUE invoices escalate; paid invoices, reversal documents and cancelled
 *   invoices never do
 * - the level only ever moves to the next one, even when later thresholds are also met
 * - the next level is reached once the days past the due date meet its threshold
 * - LEGAL is terminal
 *
 * Interest = outstanding balance x annual rate x days overdue / 365.
 *
 * Has no side effects; {@link DunningService} applies the decisions.
 */
@Component
public class DunningPolicy {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(DayCount.DAYS_PER_YEAR);

    public enum Outcome {
        ESCALATE,       // Next level is due now
        NOT_DUE,        // Overdue, but the next threshold is not reached yet
        NOT_ELIGIBLE,   // Not overdue, paid, reversed or dunning disabled
        TERMINAL        // Already at the last level
    }

    /**
     * The facts about an invoice the policy looks at.
     */
    public record DunningCandidate(String invoiceNumber, InvoiceType type, BigDecimal amount,
                                   BigDecimal paidAmount, LocalDate dueDate, boolean cancelled) {

        public static DunningCandidate of(Invoice invoice, boolean cancelled) {
            return new DunningCandidate(invoice.getInvoiceNumber(), invoice.getType(), invoice.getAmount(),
                invoice.getPaidAmount(), invoice.getDueDate(), cancelled);
        }

        public BigDecimal outstanding() {
            return Money.subtractFloorZero(amount, paidAmount);
        }
    }

    /**
     * Charges of a reminder at the given level.
     */
    public record Escalation(ReminderLevel level, long daysOverdue, BigDecimal principal,
                             BigDecimal fee, BigDecimal interest) {}

    public record Decision(Outcome outcome, Escalation escalation, String reason) {

        static Decision escalate(Escalation escalation) {
            return new Decision(Outcome.ESCALATE, escalation, null);
        }

        static Decision skip(Outcome outcome, String reason) {
            return new Decision(outcome, null, reason);
        }

        public boolean isEscalation() {
            return outcome == Outcome.ESCALATE;
        }
    }

    /**
     * Evaluates the scheduled escalation of one invoice.
     */
    public Decision evaluate(DunningCandidate candidate, ReminderLevel currentLevel,
                             DunningSettings settings, LocalDate today) {
        String ineligible = ineligibilityReason(candidate, settings, today);
        if (ineligible != null) {
            return Decision.skip(Outcome.NOT_ELIGIBLE, ineligible);
        }
        if (currentLevel.isTerminal()) {
            return Decision.skip(Outcome.TERMINAL, "Invoice " + candidate.invoiceNumber()
                + " already reached " + currentLevel);
        }

        ReminderLevel target = currentLevel.next();
        long daysOverdue = DayCount.daysOverdue(candidate.dueDate(), today);
        int threshold = settings.thresholdFor(target);
        if (daysOverdue < threshold) {
            return Decision.skip(Outcome.NOT_DUE, candidate.invoiceNumber() + " is " + daysOverdue
                + " days overdue, " + target + " needs " + threshold);
        }
        return Decision.escalate(escalationFor(candidate, target, settings, today));
    }

    /**
     * Why the invoice cannot be dunned at all, or null when it can.
     */
    public String ineligibilityReason(DunningCandidate candidate, DunningSettings settings, LocalDate today) {
        if (!settings.enabled()) {
            return "Dunning is disabled";
        }
        if (candidate.type().isReversal()) {
            return candidate.type() + " documents are not dunned";
        }
        if (candidate.cancelled()) {
            return "Invoice " + candidate.invoiceNumber() + " has been cancelled";
        }
        InvoiceStatus status = InvoiceStatusCalculator.deriveStatus(
            candidate.amount(), candidate.paidAmount(), candidate.dueDate(), today);
        if (status != InvoiceStatus.OVERDUE) {
            return "Invoice " + candidate.invoiceNumber() + " is " + status;
        }
        return null;
    }

    /**
     * Fee and interest for a reminder at the target level, issued today.
     */
    public Escalation escalationFor(DunningCandidate candidate, ReminderLevel target,
                                    DunningSettings settings, LocalDate today) {
        long daysOverdue = DayCount.daysOverdue(candidate.dueDate(), today);
        BigDecimal principal = candidate.outstanding();
        BigDecimal fee = settings.feeFor(target);
        BigDecimal interest = settings.chargesInterest(target)
            ? calculateInterest(principal, settings.annualInterestRate(), daysOverdue)
            : Money.ZERO;
        return new Escalation(target, daysOverdue, principal, fee, interest);
    }

    /**
     * Simple default interest on a principal, rounded half-up to cents.
     *
     * @param annualRatePercent e.g. 8.17 for 8.17% p.a.
     */
    public BigDecimal calculateInterest(BigDecimal principal, BigDecimal annualRatePercent, long days) {
        if (days <= 0 || !Money.isPositive(principal) || !Money.isPositive(annualRatePercent)) {
            return Money.ZERO;
        }
        return principal.multiply(annualRatePercent)
            .multiply(BigDecimal.valueOf(days))
            .divide(HUNDRED.multiply(DAYS_PER_YEAR), Money.SCALE, RoundingMode.HALF_UP);
    }
}
