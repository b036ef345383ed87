package com.faktura.billing.service;

import com.faktura.billing.domain.AuditEvent;
import com.faktura.billing.repository.AuditEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Writes the audit trail for billing actions.
 * Events join the caller's transaction, so a rolled back action leaves no audit row.
 */
@Service
@Transactional
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    static final int MAX_SUMMARY_LENGTH = 1000;

    private final AuditEventRepository auditEventRepository;

    public AuditService(AuditEventRepository auditEventRepository) {
        this.auditEventRepository = auditEventRepository;
    }

    /**
     * Records an event. Summaries longer than {@link #MAX_SUMMARY_LENGTH} are cut off so that
     * free-text input quoted in them never fails the action being audited.
     */
    public AuditEvent logEvent(String actor, String eventType, String entityType, Long entityId,
                               String summary) {
        AuditEvent event = new AuditEvent(actor, eventType, entityType, entityId, abbreviate(summary));
        log.debug("Audit {} {}#{}: {}", eventType, entityType, entityId, summary);
        return auditEventRepository.save(event);
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> findByEntity(String entityType, Long entityId) {
        return auditEventRepository.findByEntityTypeAndEntityIdOrderByOccurredAtAsc(entityType, entityId);
    }

    static String abbreviate(String summary) {
        if (summary == null || summary.length() <= MAX_SUMMARY_LENGTH) {
            return summary;
        }
        return summary.substring(0, MAX_SUMMARY_LENGTH - 3) + "...";
    }
}
