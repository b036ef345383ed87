package com.faktura.billing.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Append-only record of a business action on an invoice, payment or reminder.
 */
@Entity
@Table(name = "audit_event", indexes = {
    @Index(name = "idx_audit_event_entity", columnList = "entity_type, entity_id")
})
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Size(max = 100)
    @Column(length = 100, updatable = false)
    private String actor;

    @NotBlank
    @Size(max = 50)
    @Column(name = "event_type", nullable = false, length = 50, updatable = false)
    private String eventType;

    @NotBlank
    @Size(max = 50)
    @Column(name = "entity_type", nullable = false, length = 50, updatable = false)
    private String entityType;

    @Column(name = "entity_id", updatable = false)
    private Long entityId;

    @Size(max = 1000)
    @Column(length = 1000, updatable = false)
    private String summary;

    @PrePersist
    protected void onCreate() {
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }
    }

    // Constructors
    protected AuditEvent() {
    }

    public AuditEvent(String actor, String eventType, String entityType, Long entityId, String summary) {
        this.actor = actor;
        this.eventType = eventType;
        this.entityType = entityType;
        this.entityId = entityId;
        this.summary = summary;
    }

    // Getters
    public Long getId() {
        return id;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public String getActor() {
        return actor;
    }

    public String getEventType() {
        return eventType;
    }

    public String getEntityType() {
        return entityType;
    }

    public Long getEntityId() {
        return entityId;
    }

    public String getSummary() {
        return summary;
    }
}
