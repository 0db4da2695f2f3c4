package com.flagship.telehealth_booking.audit.dto;

import com.flagship.telehealth_booking.audit.AuditEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class AuditEventResponse {
    UUID id;
    UUID actorUserId;
    UUID consultationId;
    String eventType;
    Map<String, Object> eventMetadata;
    Instant createdAt;

    public static AuditEventResponse from(AuditEvent event) {
        return AuditEventResponse.builder()
            .id(event.getId())
            .actorUserId(event.getActorUserId())
            .consultationId(event.getConsultationId())
            .eventType(event.getEventType().name())
            .eventMetadata(event.getEventMetadata())
            .createdAt(event.getCreatedAt())
            .build();
    }
}
