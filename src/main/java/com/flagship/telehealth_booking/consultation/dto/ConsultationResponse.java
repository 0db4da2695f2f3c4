package com.flagship.telehealth_booking.consultation.dto;

import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Consultation as returned by the API. {@code status} is the stored value;
 * {@code effectiveStatus} is what the user should see right now.
 */
@Value
@Builder
public class ConsultationResponse {
    UUID id;
    UUID patientId;
    UUID doctorId;
    String specialty;
    BigDecimal fee;
    ConsultationStatus status;
    ConsultationStatus effectiveStatus;
    Instant scheduledStartAt;
    Instant startedAt;
    Instant endedAt;
    Instant createdAt;
    Instant updatedAt;

    public static ConsultationResponse from(Consultation consultation, ConsultationStatus effectiveStatus) {
        return ConsultationResponse.builder()
            .id(consultation.getId())
            .patientId(consultation.getPatientId())
            .doctorId(consultation.getDoctorId())
            .specialty(consultation.getSpecialty().name())
            .fee(consultation.getSpecialty().getFee())
            .status(consultation.getStatus())
            .effectiveStatus(effectiveStatus)
            .scheduledStartAt(consultation.getScheduledStartAt())
            .startedAt(consultation.getStartedAt())
            .endedAt(consultation.getEndedAt())
            .createdAt(consultation.getCreatedAt())
            .updatedAt(consultation.getUpdatedAt())
            .build();
    }
}
