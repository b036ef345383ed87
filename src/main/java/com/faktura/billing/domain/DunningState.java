package com.faktura.billing.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/**
 * Dunning progress of one invoice. Created the first time the invoice is seen overdue and never
 * deleted: the level only moves forward and the reminder history is append-only.
 */
@Entity
@Table(
    name = "dunning_state",
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_dunning_state_invoice", columnNames = {"invoice_id"})
    })
public class DunningState {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @OneToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "invoice_id", nullable = false, updatable = false)
  private Invoice invoice;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private ReminderLevel level = ReminderLevel.NONE;

  @OneToMany(mappedBy = "dunningState")
  @OrderBy("id ASC")
  private List<ReminderEntry> history = new ArrayList<>();

  @Column(name = "last_reminder_date")
  private LocalDate lastReminderDate;

  @Version private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
    updatedAt = Instant.now();
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  // Constructors
  protected DunningState() {}

  public DunningState(Invoice invoice) {
    this.invoice = invoice;
  }

  /**
   * Appends a reminder and advances the level. The entry must be for the level directly after the
   * current one.
   */
  public void append(ReminderEntry entry) {
    ReminderLevel expected = level.next();
    if (expected == null || entry.getLevel() != expected) {
      throw new IllegalStateException(
          "Reminder level " + entry.getLevel() + " does not follow current level " + level);
    }
    entry.setDunningState(this);
    history.add(entry);
    level = entry.getLevel();
    lastReminderDate = entry.getSentDate();
  }

  /** Whether a reminder for the given level has already been recorded. */
  public boolean hasReminderFor(ReminderLevel target) {
    return history.stream().anyMatch(entry -> entry.getLevel() == target);
  }

  public BigDecimal getTotalFees() {
    return history.stream().map(ReminderEntry::getFee).reduce(Money.ZERO, BigDecimal::add);
  }

  public BigDecimal getTotalInterest() {
    return history.stream().map(ReminderEntry::getInterest).reduce(Money.ZERO, BigDecimal::add);
  }

  // Getters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Invoice getInvoice() {
    return invoice;
  }

  public ReminderLevel getLevel() {
    return level;
  }

  public List<ReminderEntry> getHistory() {
    return Collections.unmodifiableList(history);
  }

  public LocalDate getLastReminderDate() {
    return lastReminderDate;
  }

  public Long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
