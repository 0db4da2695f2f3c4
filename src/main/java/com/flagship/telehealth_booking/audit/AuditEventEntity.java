package com.flagship.telehealth_booking.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity for audit events. Rows are inserted once and never updated.
 */
@Entity
@Immutable
@Table(
    name = "audit_events",
    indexes = {
        @Index(name = "idx_audit_events_consultation_id", columnList = "consultation_id"),
        @Index(name = "idx_audit_events_created_at", columnList = "created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditEventEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "actor_user_id", updatable = false)
    private UUID actorUserId;

    @Column(name = "consultation_id", updatable = false)
    private UUID consultationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 64)
    private AuditEventType eventType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "event_metadata", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> eventMetadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static AuditEventEntity fromDomain(AuditEvent event) {
        return new AuditEventEntity(
            event.getId(),
            event.getActorUserId(),
            event.getConsultationId(),
            event.getEventType(),
            new LinkedHashMap<>(event.getEventMetadata()),
            event.getCreatedAt()
        );
    }

    public AuditEvent toDomain() {
        return new AuditEvent(
            id,
            actorUserId,
            consultationId,
            eventType,
            eventMetadata == null ? Map.of() : eventMetadata,
            createdAt
        );
    }
}
