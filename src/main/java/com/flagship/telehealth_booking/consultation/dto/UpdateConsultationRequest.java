package com.flagship.telehealth_booking.consultation.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Partial update of a consultation. Absent fields are left unchanged.
 */
@Value
@Builder
@Jacksonized
public class UpdateConsultationRequest {
    String status;
    UUID doctorId;
    String scheduledStartAt;
    /** The updatedAt the client last saw; a stale value is rejected with CONFLICT. */
    String updatedAt;

    public boolean hasChanges() {
        return status != null || doctorId != null || scheduledStartAt != null;
    }
}
