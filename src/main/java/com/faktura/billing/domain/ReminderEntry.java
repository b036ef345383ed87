package com.faktura.billing.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One reminder sent for an invoice: the history entry of a {@link DunningState}. Monetary fields
 * are fixed when the reminder is issued; only the delivery status and the customer's response
 * change afterwards.
 */
@Entity
@Table(
    name = "reminder_entry",
    indexes = {@Index(name = "idx_reminder_entry_status", columnList = "status")},
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_reminder_entry_level",
          columnNames = {"dunning_state_id", "level"})
    })
public class ReminderEntry {

  public enum ReminderStatus {
    PENDING,
    SENT,
    ACKNOWLEDGED,
    PAID,
    ESCALATED,
    CANCELLED
  }

  public enum ResponseType {
    PAYMENT,
    DISPUTE,
    PROMISE,
    OTHER
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "dunning_state_id", nullable = false, updatable = false)
  private DunningState dunningState;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, updatable = false, length = 20)
  private ReminderLevel level;

  @NotNull
  @Column(name = "sent_date", nullable = false, updatable = false)
  private LocalDate sentDate;

  // New payment deadline communicated with this reminder
  @NotNull
  @Column(name = "payment_due_date", nullable = false, updatable = false)
  private LocalDate paymentDueDate;

  @Column(name = "days_overdue", nullable = false, updatable = false)
  private long daysOverdue;

  @NotNull
  @Column(nullable = false, updatable = false, precision = 19, scale = 2)
  private BigDecimal principal;

  @NotNull
  @Column(nullable = false, updatable = false, precision = 19, scale = 2)
  private BigDecimal fee;

  @NotNull
  @Column(nullable = false, updatable = false, precision = 19, scale = 2)
  private BigDecimal interest;

  // principal + fees and interest of this and all previous reminders
  @NotNull
  @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
  private BigDecimal totalAmount;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private ReminderStatus status = ReminderStatus.PENDING;

  @Enumerated(EnumType.STRING)
  @Column(name = "response_type", length = 20)
  private ResponseType responseType;

  @Column(name = "response_date")
  private LocalDate responseDate;

  @Size(max = 1000)
  @Column(name = "response_notes", length = 1000)
  private String responseNotes;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  // Constructors
  protected ReminderEntry() {}

  public ReminderEntry(
      ReminderLevel level,
      LocalDate sentDate,
      LocalDate paymentDueDate,
      long daysOverdue,
      BigDecimal principal,
      BigDecimal fee,
      BigDecimal interest,
      BigDecimal totalAmount) {
    this.level = level;
    this.sentDate = sentDate;
    this.paymentDueDate = paymentDueDate;
    this.daysOverdue = daysOverdue;
    this.principal = Money.normalize(principal);
    this.fee = Money.normalize(fee);
    this.interest = Money.normalize(interest);
    this.totalAmount = Money.normalize(totalAmount);
  }

  public void markSent(Instant when) {
    this.status = ReminderStatus.SENT;
    this.sentAt = when;
  }

  public void recordResponse(ResponseType type, LocalDate date, String notes) {
    this.responseType = type;
    this.responseDate = date;
    this.responseNotes = notes;
  }

  // Getters and Setters
  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public DunningState getDunningState() {
    return dunningState;
  }

  void setDunningState(DunningState dunningState) {
    this.dunningState = dunningState;
  }

  public ReminderLevel getLevel() {
    return level;
  }

  public LocalDate getSentDate() {
    return sentDate;
  }

  public LocalDate getPaymentDueDate() {
    return paymentDueDate;
  }

  public long getDaysOverdue() {
    return daysOverdue;
  }

  public BigDecimal getPrincipal() {
    return principal;
  }

  public BigDecimal getFee() {
    return fee;
  }

  public BigDecimal getInterest() {
    return interest;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public ReminderStatus getStatus() {
    return status;
  }

  public void setStatus(ReminderStatus status) {
    this.status = status;
  }

  public ResponseType getResponseType() {
    return responseType;
  }

  public LocalDate getResponseDate() {
    return responseDate;
  }

  public String getResponseNotes() {
    return responseNotes;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
