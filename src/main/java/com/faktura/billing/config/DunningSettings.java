package com.faktura.billing.config;

import com.faktura.billing.domain.Money;
import com.faktura.billing.domain.ReminderLevel;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only reminder schedule, fee table and interest configuration.
 *
 * @param enabled            whether the engine escalates at all
 * @param automaticSending   whether issued reminders are emailed without manual action
 * @param thresholds         days past the due date required to reach each level
 * @param fees               flat fee charged when a level is reached
 * @param interestEnabled    whether default interest accrues
 * @param annualInterestRate annual rate in percent, e.g. 8.17
 * @param interestFromLevel  first level that charges interest
 * @param paymentGraceDays   days granted by each reminder to settle
 */
public record DunningSettings(
    boolean enabled,
    boolean automaticSending,
    Map<ReminderLevel, Integer> thresholds,
    Map<ReminderLevel, BigDecimal> fees,
    boolean interestEnabled,
    BigDecimal annualInterestRate,
    ReminderLevel interestFromLevel,
    int paymentGraceDays) {

    public DunningSettings {
        if (thresholds == null || fees == null) {
            throw new IllegalArgumentException("Thresholds and fees are required");
        }
        EnumMap<ReminderLevel, Integer> thresholdCopy = new EnumMap<>(ReminderLevel.class);
        EnumMap<ReminderLevel, BigDecimal> feeCopy = new EnumMap<>(ReminderLevel.class);
        for (ReminderLevel level : ReminderLevel.values()) {
            if (level == ReminderLevel.NONE) {
                continue;
            }
            Integer days = thresholds.get(level);
            if (days == null || days < 0) {
                throw new IllegalArgumentException("Missing or negative threshold for " + level);
            }
            thresholdCopy.put(level, days);
            // The friendly reminder is always free of charge
            feeCopy.put(level, level == ReminderLevel.FRIENDLY ? Money.ZERO : Money.normalize(fees.get(level)));
        }
        ReminderLevel previous = null;
        for (Map.Entry<ReminderLevel, Integer> entry : thresholdCopy.entrySet()) {
            if (previous != null && entry.getValue() < thresholdCopy.get(previous)) {
                throw new IllegalArgumentException("Threshold for " + entry.getKey()
                    + " must not be lower than the one for " + previous);
            }
            previous = entry.getKey();
        }
        if (annualInterestRate == null || annualInterestRate.signum() < 0) {
            throw new IllegalArgumentException("Annual interest rate must not be negative");
        }
        if (interestFromLevel == null || interestFromLevel == ReminderLevel.NONE) {
            interestFromLevel = ReminderLevel.SECOND;
        }
        thresholds = Collections.unmodifiableMap(thresholdCopy);
        fees = Collections.unmodifiableMap(feeCopy);
    }

    public int thresholdFor(ReminderLevel level) {
        return thresholds.get(level);
    }

    public BigDecimal feeFor(ReminderLevel level) {
        return fees.get(level);
    }

    /**
     * Whether reminders of the given level charge interest.
     */
    public boolean chargesInterest(ReminderLevel level) {
        return interestEnabled && level.isAtLeast(interestFromLevel);
    }
}
