package com.faktura.billing.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Tracks one batch dunning scan.
 * Failures of individual invoices are stored as JSON so a run can be inspected afterwards.
 */
@Entity
@Table(name = "dunning_run", indexes = {
    @Index(name = "idx_dunning_run_as_of", columnList = "as_of_date")
})
public class DunningRun {

    public enum RunStatus {
        RUNNING,                // Scan in progress
        COMPLETED,              // Every candidate evaluated without error
        COMPLETED_WITH_ERRORS   // Some invoices failed, see failures_json
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "as_of_date", nullable = false)
    private LocalDate asOfDate;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 25)
    private RunStatus status = RunStatus.RUNNING;

    @Size(max = 50)
    @Column(name = "triggered_by", length = 50)
    private String triggeredBy;

    @Column(name = "scanned_count", nullable = false)
    private int scannedCount;

    @Column(name = "escalated_count", nullable = false)
    private int escalatedCount;

    @Column(name = "skipped_count", nullable = false)
    private int skippedCount;

    @Column(name = "failed_count", nullable = false)
    private int failedCount;

    @Size(max = 4000)
    @Column(name = "failures_json", length = 4000)
    private String failuresJson;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    protected void onCreate() {
        startedAt = Instant.now();
    }

    // Constructors
    protected DunningRun() {
    }

    public DunningRun(LocalDate asOfDate, String triggeredBy) {
        this.asOfDate = asOfDate;
        this.triggeredBy = triggeredBy;
    }

    /**
     * Records the outcome counts and closes the run.
     */
    public void complete(int scanned, int escalated, int skipped, int failed, String failuresJson) {
        this.scannedCount = scanned;
        this.escalatedCount = escalated;
        this.skippedCount = skipped;
        this.failedCount = failed;
        this.failuresJson = failuresJson;
        this.status = failed > 0 ? RunStatus.COMPLETED_WITH_ERRORS : RunStatus.COMPLETED;
        this.completedAt = Instant.now();
    }

    // Getters
    public Long getId() {
        return id;
    }

    public LocalDate getAsOfDate() {
        return asOfDate;
    }

    public RunStatus getStatus() {
        return status;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    public int getScannedCount() {
        return scannedCount;
    }

    public int getEscalatedCount() {
        return escalatedCount;
    }

    public int getSkippedCount() {
        return skippedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public String getFailuresJson() {
        return failuresJson;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
