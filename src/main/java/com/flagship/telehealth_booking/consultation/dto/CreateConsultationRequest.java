package com.flagship.telehealth_booking.consultation.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request body for booking a consultation.
 *
 * Fields are kept as strings so that unknown specialties and malformed instants
 * are reported with the offending field instead of a generic parse error.
 */
@Value
@Builder
@Jacksonized
public class CreateConsultationRequest {
    String specialty;
    /** ISO-8601 instant; optional. */
    String scheduledStartAt;
}
