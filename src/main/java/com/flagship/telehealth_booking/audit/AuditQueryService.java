package com.flagship.telehealth_booking.audit;

import com.flagship.telehealth_booking.audit.dto.AuditEventResponse;
import com.flagship.telehealth_booking.audit.dto.AuditPageResponse;
import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.identity.Capability;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.Map;
import java.util.UUID;

/**
 * Admin-only paged reads of the audit trail.
 * Out-of-range page and limit values are clamped rather than rejected.
 */
@Service
@RequiredArgsConstructor
public class AuditQueryService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final AuditEventRepository repository;

    @Transactional(readOnly = true)
    public AuditPageResponse list(Caller caller, String eventType, UUID actorUserId, UUID consultationId,
                                  Integer page, Integer limit) {
        caller.require(Capability.VIEW_AUDIT, "view the audit trail");

        int pageNumber = Math.max(1, page == null ? 1 : page);
        int pageSize = Math.max(1, Math.min(MAX_LIMIT, limit == null ? DEFAULT_LIMIT : limit));

        Page<AuditEventEntity> result = repository.findByFilter(
                parseEventType(eventType),
                actorUserId,
                consultationId,
                PageRequest.of(pageNumber - 1, pageSize));

        return new AuditPageResponse(
                result.getContent().stream()
                        .map(AuditEventEntity::toDomain)
                        .map(AuditEventResponse::from)
                        .toList(),
                new AuditPageResponse.Meta(pageNumber, pageSize, result.getTotalElements(), result.getTotalPages()));
    }

    private AuditEventType parseEventType(String eventType) {
        if (eventType == null || eventType.isBlank()) {
            return null;
        }
        try {
            return AuditEventType.valueOf(eventType.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown event type: " + eventType,
                    Map.of("allowed", Arrays.stream(AuditEventType.values()).map(Enum::name).toList()));
        }
    }
}
