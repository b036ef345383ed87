package com.faktura.billing.config;

import com.faktura.billing.domain.ReminderLevel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Builds {@link DunningSettings} from the faktura.dunning.* properties.
 *
 * Defaults follow common German practice: reminders after 7/14/21/30 days,
 * legal action after 45 days, fees of 5/10/15 EUR and default interest
 * of 8.17% p.a. from the second reminder on.
 */
@Component
public class DunningSettingsProvider {

    @Value("${faktura.dunning.enabled:true}")
    private boolean enabled;

    @Value("${faktura.dunning.automatic-sending:false}")
    private boolean automaticSending;

    @Value("${faktura.dunning.schedule.friendly:7}")
    private int friendlyDays;

    @Value("${faktura.dunning.schedule.first-reminder:14}")
    private int firstReminderDays;

    @Value("${faktura.dunning.schedule.second-reminder:21}")
    private int secondReminderDays;

    @Value("${faktura.dunning.schedule.final-notice:30}")
    private int finalNoticeDays;

    @Value("${faktura.dunning.schedule.legal-action:45}")
    private int legalActionDays;

    @Value("${faktura.dunning.fees.first-reminder:5.00}")
    private BigDecimal firstReminderFee;

    @Value("${faktura.dunning.fees.second-reminder:10.00}")
    private BigDecimal secondReminderFee;

    @Value("${faktura.dunning.fees.final-notice:15.00}")
    private BigDecimal finalNoticeFee;

    @Value("${faktura.dunning.fees.legal-action:15.00}")
    private BigDecimal legalActionFee;

    @Value("${faktura.dunning.interest.enabled:true}")
    private boolean interestEnabled;

    @Value("${faktura.dunning.interest.rate:8.17}")
    private BigDecimal interestRate;

    @Value("${faktura.dunning.interest.from-level:SECOND}")
    private ReminderLevel interestFromLevel;

    @Value("${faktura.dunning.payment-grace-days:14}")
    private int paymentGraceDays;

    public DunningSettings getSettings() {
        Map<ReminderLevel, Integer> thresholds = new EnumMap<>(ReminderLevel.class);
        thresholds.put(ReminderLevel.FRIENDLY, friendlyDays);
        thresholds.put(ReminderLevel.FIRST, firstReminderDays);
        thresholds.put(ReminderLevel.SECOND, secondReminderDays);
        thresholds.put(ReminderLevel.FINAL, finalNoticeDays);
        thresholds.put(ReminderLevel.LEGAL, legalActionDays);

        Map<ReminderLevel, BigDecimal> fees = new EnumMap<>(ReminderLevel.class);
        fees.put(ReminderLevel.FIRST, firstReminderFee);
        fees.put(ReminderLevel.SECOND, secondReminderFee);
        fees.put(ReminderLevel.FINAL, finalNoticeFee);
        fees.put(ReminderLevel.LEGAL, legalActionFee);

        return new DunningSettings(enabled, automaticSending, thresholds, fees,
            interestEnabled, interestRate, interestFromLevel, paymentGraceDays);
    }
}
