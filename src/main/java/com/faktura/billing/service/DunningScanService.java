package com.faktura.billing.service;

import com.faktura.billing.domain.DunningRun;
import com.faktura.billing.domain.Invoice.InvoiceType;
import com.faktura.billing.domain.ReminderEntry;
import com.faktura.billing.repository.DunningRunRepository;
import com.faktura.billing.repository.InvoiceRepository;
import com.faktura.billing.service.DunningService.EscalationOutcome;
import com.faktura.billing.service.DunningService.Result;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Runs the dunning engine over all overdue invoices.
 *
 * Not transactional itself: each invoice is evaluated in its own transaction through
 * {@link DunningService}, so one failing invoice neither rolls back nor blocks the others.
 * Running the scan twice for the same day issues nothing new the second time.
 */
@Service
public class DunningScanService {

    private static final Logger log = LoggerFactory.getLogger(DunningScanService.class);

    private static final int MAX_FAILURES_JSON_LENGTH = 4000;

    private final InvoiceRepository invoiceRepository;
    private final DunningRunRepository dunningRunRepository;
    private final DunningService dunningService;
    private final ObjectMapper objectMapper;

    public DunningScanService(InvoiceRepository invoiceRepository,
                              DunningRunRepository dunningRunRepository,
                              DunningService dunningService,
                              ObjectMapper objectMapper) {
        this.invoiceRepository = invoiceRepository;
        this.dunningRunRepository = dunningRunRepository;
        this.dunningService = dunningService;
        this.objectMapper = objectMapper;
    }

    public DunningScanResult runScan(DunningScanCommand command) {
        log.info("Starting dunning scan as of {} (triggered by {})", command.asOfDate(), command.triggeredBy());
        DunningRun run = dunningRunRepository.save(new DunningRun(command.asOfDate(), command.triggeredBy()));

        List<Long> candidateIds = invoiceRepository.findDunningCandidateIds(command.asOfDate(),
            EnumSet.of(InvoiceType.CANCELLATION, InvoiceType.CREDIT_NOTE), InvoiceType.CANCELLATION);

        List<ReminderEntry> issued = new ArrayList<>();
        List<DunningScanResult.Failure> failures = new ArrayList<>();
        int skipped = 0;

        for (Long invoiceId : candidateIds) {
            try {
                EscalationOutcome outcome = dunningService.evaluate(invoiceId, command.asOfDate());
                if (outcome.result() == Result.ESCALATED) {
                    issued.add(outcome.reminder());
                } else {
                    skipped++;
                    log.debug("Invoice {} not escalated: {}", invoiceId, outcome.reason());
                }
            } catch (Exception e) {
                log.error("Failed to evaluate dunning for invoice {}: {}", invoiceId, e.getMessage(), e);
                failures.add(new DunningScanResult.Failure(invoiceId, e.getMessage()));
            }
        }

        run.complete(candidateIds.size(), issued.size(), skipped, failures.size(), serializeFailures(failures));
        run = dunningRunRepository.save(run);

        log.info("Dunning scan as of {} finished: {} scanned, {} escalated, {} skipped, {} failed",
            command.asOfDate(), candidateIds.size(), issued.size(), skipped, failures.size());
        return new DunningScanResult(run.getId(), candidateIds.size(), skipped, issued, failures);
    }

    public Optional<DunningRun> findLastRun() {
        return dunningRunRepository.findTopByOrderByStartedAtDesc();
    }

    public List<DunningRun> findRecentRuns() {
        return dunningRunRepository.findTop20ByOrderByStartedAtDesc();
    }

    private String serializeFailures(List<DunningScanResult.Failure> failures) {
        if (failures.isEmpty()) {
            return null;
        }
        try {
            String json = objectMapper.writeValueAsString(failures);
            return json.length() > MAX_FAILURES_JSON_LENGTH ? json.substring(0, MAX_FAILURES_JSON_LENGTH) : json;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize dunning failures: {}", e.getMessage());
            return failures.size() + " failures, details in log";
        }
    }
}
