package com.flagship.telehealth_booking.audit;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit record. {@code actorUserId} is null for system-originated
 * events such as provider webhooks.
 */
@Value
public class AuditEvent {
    UUID id;
    UUID actorUserId;
    UUID consultationId;
    AuditEventType eventType;
    Map<String, Object> eventMetadata;
    Instant createdAt;

    public static AuditEvent create(UUID actorUserId, UUID consultationId, AuditEventType eventType,
                                    Map<String, Object> eventMetadata, Instant createdAt) {
        return new AuditEvent(
                UUID.randomUUID(),
                actorUserId,
                consultationId,
                eventType,
                eventMetadata == null ? Map.of() : eventMetadata,
                createdAt
        );
    }
}
