package com.faktura.billing.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A payment received against one invoice.
 * Payments are immutable once recorded: corrections go through credit notes.
 */
@Entity
@Table(name = "payment", indexes = {
    @Index(name = "idx_payment_invoice", columnList = "invoice_id"),
    @Index(name = "idx_payment_date", columnList = "payment_date")
})
public class Payment {

    public enum PaymentMethod {
        BANK,
        CASH,
        CARD,
        ONLINE_CARD,
        ONLINE_PAYPAL,
        ONLINE_SEPA
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "invoice_id", nullable = false, updatable = false)
    private Invoice invoice;

    @NotNull
    @Column(name = "payment_date", nullable = false, updatable = false)
    private LocalDate paymentDate;

    @NotNull
    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private PaymentMethod method;

    @Size(max = 255)
    @Column(length = 255, updatable = false)
    private String reference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    // Constructors
    protected Payment() {
    }

    public Payment(Invoice invoice, LocalDate paymentDate, BigDecimal amount,
                   PaymentMethod method, String reference) {
        this.invoice = invoice;
        this.paymentDate = paymentDate;
        this.amount = Money.normalize(amount);
        this.method = method;
        this.reference = reference;
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

    public LocalDate getPaymentDate() {
        return paymentDate;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public PaymentMethod getMethod() {
        return method;
    }

    public String getReference() {
        return reference;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
