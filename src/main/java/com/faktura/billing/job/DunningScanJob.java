package com.faktura.billing.job;

import com.faktura.billing.config.DunningSettingsProvider;
import com.faktura.billing.service.DunningScanCommand;
import com.faktura.billing.service.DunningScanResult;
import com.faktura.billing.service.DunningScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Nightly dunning scan. Runs at 6:00 AM by default, after the bank import.
 */
@Component
public class DunningScanJob {

    private static final Logger log = LoggerFactory.getLogger(DunningScanJob.class);

    private final DunningScanService scanService;
    private final DunningSettingsProvider settingsProvider;
    private final Clock clock;

    public DunningScanJob(DunningScanService scanService, DunningSettingsProvider settingsProvider, Clock clock) {
        this.scanService = scanService;
        this.settingsProvider = settingsProvider;
        this.clock = clock;
    }

    @Scheduled(cron = "${faktura.dunning.scan-cron:0 0 6 * * *}")
    public void runScheduledScan() {
        if (!settingsProvider.getSettings().enabled()) {
            log.debug("Dunning disabled, skipping scheduled scan");
            return;
        }
        try {
            DunningScanResult result = scanService.runScan(new DunningScanCommand(LocalDate.now(clock), "scheduler"));
            if (result.hasFailures()) {
                log.warn("Scheduled dunning scan had {} failed invoices", result.failures().size());
            }
        } catch (Exception e) {
            log.error("Scheduled dunning scan failed: {}", e.getMessage(), e);
        }
    }
}
