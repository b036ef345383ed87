package com.faktura.billing.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A billing document issued to a customer.
 *
 * The payment status is never stored: it is derived from amount, paid amount and due date
 * by {@link InvoiceStatusCalculator} every time it is read.
 * Cancellations and credit notes are themselves invoices that point at the original
 * through {@code relatedInvoice}.
 */
@Entity
@Table(name = "invoice", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"invoice_number"})
}, indexes = {
    @Index(name = "idx_invoice_project", columnList = "project_id"),
    @Index(name = "idx_invoice_related", columnList = "related_invoice_id"),
    @Index(name = "idx_invoice_due_date", columnList = "due_date")
})
public class Invoice {

    public enum InvoiceStatus {
        OPEN("invoice.status.open"),
        PARTIALLY_PAID("invoice.status.partiallyPaid"),
        OVERDUE("invoice.status.overdue"),
        PAID("invoice.status.paid");

        private final String labelKey;

        InvoiceStatus(String labelKey) {
            this.labelKey = labelKey;
        }

        /**
         * Message key used by the presentation layer. Never compare labels for state logic.
         */
        public String labelKey() {
            return labelKey;
        }
    }

    public enum InvoiceType {
        STANDARD("invoice.type.standard"),
        DOWN_PAYMENT("invoice.type.downPayment"),         // Abschlagsrechnung
        FINAL_SETTLEMENT("invoice.type.finalSettlement"), // Schlussrechnung
        CANCELLATION("invoice.type.cancellation"),        // Storno
        CREDIT_NOTE("invoice.type.creditNote");           // Gutschrift

        private final String labelKey;

        InvoiceType(String labelKey) {
            this.labelKey = labelKey;
        }

        public String labelKey() {
            return labelKey;
        }

        public boolean isReversal() {
            return this == CANCELLATION || this == CREDIT_NOTE;
        }
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 30)
    @Column(name = "invoice_number", nullable = false, length = 30)
    private String invoiceNumber;

    @NotBlank
    @Size(max = 200)
    @Column(name = "customer_name", nullable = false, length = 200)
    private String customerName;

    @Size(max = 254)
    @Column(name = "customer_email", length = 254)
    private String customerEmail;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "invoice_type", nullable = false, length = 20)
    private InvoiceType type = InvoiceType.STANDARD;

    @NotNull
    @Column(name = "issue_date", nullable = false)
    private LocalDate issueDate;

    @NotNull
    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @NotNull
    @DecimalMin("0.00")
    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount = Money.ZERO;

    @NotNull
    @DecimalMin("0.00")
    @Column(name = "paid_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal paidAmount = Money.ZERO;

    @Size(max = 64)
    @Column(name = "project_id", length = 64)
    private String projectId;

    // For cancellations and credit notes, the invoice being reversed
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "related_invoice_id")
    private Invoice relatedInvoice;

    @Column(name = "related_amount", precision = 19, scale = 2)
    private BigDecimal relatedAmount;

    @Size(max = 500)
    @Column(name = "reversal_reason", length = 500)
    private String reversalReason;

    @Version
    private Long version;

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
    public Invoice() {
    }

    public Invoice(String invoiceNumber, String customerName, InvoiceType type, BigDecimal amount,
                   LocalDate issueDate, LocalDate dueDate) {
        this.invoiceNumber = invoiceNumber;
        this.customerName = customerName;
        this.type = type;
        this.amount = Money.normalize(amount);
        this.issueDate = issueDate;
        this.dueDate = dueDate;
    }

    // Helper methods

    /**
     * Derives the payment status as of the given day.
     */
    public InvoiceStatus getStatus(LocalDate today) {
        return InvoiceStatusCalculator.deriveStatus(amount, paidAmount, dueDate, today);
    }

    /**
     * Returns the outstanding balance (amount minus paid amount), never below zero.
     */
    public BigDecimal getBalance() {
        return Money.subtractFloorZero(amount, paidAmount);
    }

    /**
     * Amount as it counts towards totals: reversal documents offset their original.
     */
    public BigDecimal getSignedAmount() {
        return type.isReversal() ? amount.negate() : amount;
    }

    public boolean isPaid() {
        return paidAmount.compareTo(amount) >= 0;
    }

    public boolean isReversalDocument() {
        return type.isReversal();
    }

    public boolean isCancellation() {
        return type == InvoiceType.CANCELLATION;
    }

    public boolean isCreditNote() {
        return type == InvoiceType.CREDIT_NOTE;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public void setInvoiceNumber(String invoiceNumber) {
        this.invoiceNumber = invoiceNumber;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
    }

    public String getCustomerEmail() {
        return customerEmail;
    }

    public void setCustomerEmail(String customerEmail) {
        this.customerEmail = customerEmail;
    }

    public InvoiceType getType() {
        return type;
    }

    public void setType(InvoiceType type) {
        this.type = type;
    }

    public LocalDate getIssueDate() {
        return issueDate;
    }

    public void setIssueDate(LocalDate issueDate) {
        this.issueDate = issueDate;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public void setDueDate(LocalDate dueDate) {
        this.dueDate = dueDate;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = Money.normalize(amount);
    }

    public BigDecimal getPaidAmount() {
        return paidAmount;
    }

    public void setPaidAmount(BigDecimal paidAmount) {
        this.paidAmount = Money.normalize(paidAmount);
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public Invoice getRelatedInvoice() {
        return relatedInvoice;
    }

    public void setRelatedInvoice(Invoice relatedInvoice) {
        this.relatedInvoice = relatedInvoice;
    }

    public BigDecimal getRelatedAmount() {
        return relatedAmount;
    }

    public void setRelatedAmount(BigDecimal relatedAmount) {
        this.relatedAmount = relatedAmount;
    }

    public String getReversalReason() {
        return reversalReason;
    }

    public void setReversalReason(String reversalReason) {
        this.reversalReason = reversalReason;
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
