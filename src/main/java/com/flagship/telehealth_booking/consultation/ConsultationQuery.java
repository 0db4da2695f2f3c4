package com.flagship.telehealth_booking.consultation;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Filters for the consultation list. Null fields match everything.
 */
@Value
@Builder
public class ConsultationQuery {
    UUID patientId;
    UUID doctorId;
    ConsultationStatus status;
    Specialty specialty;
    int limit;
    long offset;
}
