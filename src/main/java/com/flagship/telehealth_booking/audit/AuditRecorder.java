package com.flagship.telehealth_booking.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Appends audit events inside the caller's transaction.
 *
 * The audit row and the mutation it describes commit or roll back together:
 * MANDATORY propagation refuses to run without an enclosing transaction, so a
 * mutation can never be audited "later".
 *
 * Metadata values are flattened to JSON scalars (instants, ids and enums become
 * strings) before they reach the jsonb column.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditRecorder {

    private final AuditEventRepository repository;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEvent record(UUID actorUserId, UUID consultationId, AuditEventType eventType,
                             Map<String, ?> metadata) {
        AuditEvent event = AuditEvent.create(
                actorUserId,
                consultationId,
                eventType,
                normalize(metadata),
                Instant.now(clock).truncatedTo(ChronoUnit.MILLIS));

        repository.save(AuditEventEntity.fromDomain(event));

        log.debug("Recorded audit event: type={}, consultationId={}, actor={}",
                eventType, consultationId, actorUserId);
        return event;
    }

    private Map<String, Object> normalize(Map<String, ?> metadata) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (metadata == null) {
            return normalized;
        }
        metadata.forEach((key, value) -> {
            if (value == null || value instanceof Boolean || value instanceof Number || value instanceof String) {
                normalized.put(key, value);
            } else if (value instanceof Enum<?> e) {
                normalized.put(key, e.name());
            } else {
                normalized.put(key, value.toString());
            }
        });
        return normalized;
    }
}
