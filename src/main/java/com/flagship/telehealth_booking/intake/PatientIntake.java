package com.flagship.telehealth_booking.intake;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Pre-visit details a patient gives before paying. One per consultation.
 *
 * consentAcceptedAt is stamped on first submission and kept across later edits.
 */
@Value
@Builder(toBuilder = true)
public class PatientIntake {
    UUID id;
    UUID consultationId;
    String nameOrAlias;
    AgeRange ageRange;
    String chiefComplaint;
    Instant consentAcceptedAt;
    Instant createdAt;

    public static PatientIntake submit(UUID consultationId, IntakeAnswers answers, Instant now) {
        return PatientIntake.builder()
            .id(UUID.randomUUID())
            .consultationId(consultationId)
            .nameOrAlias(answers.getNameOrAlias())
            .ageRange(answers.getAgeRange())
            .chiefComplaint(answers.getChiefComplaint())
            .consentAcceptedAt(now)
            .createdAt(now)
            .build();
    }
}
