package com.flagship.telehealth_booking.intake.dto;

import com.flagship.telehealth_booking.intake.PatientIntake;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PatientIntakeResponse {
    UUID id;
    UUID consultationId;
    String nameOrAlias;
    String ageRange;
    String chiefComplaint;
    Instant consentAcceptedAt;
    Instant createdAt;

    public static PatientIntakeResponse from(PatientIntake intake) {
        return PatientIntakeResponse.builder()
            .id(intake.getId())
            .consultationId(intake.getConsultationId())
            .nameOrAlias(intake.getNameOrAlias())
            .ageRange(intake.getAgeRange() == null ? null : intake.getAgeRange().getLabel())
            .chiefComplaint(intake.getChiefComplaint())
            .consentAcceptedAt(intake.getConsentAcceptedAt())
            .createdAt(intake.getCreatedAt())
            .build();
    }
}
