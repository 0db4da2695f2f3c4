package com.flagship.telehealth_booking.intake;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for patient intakes. Age ranges are stored by label.
 */
@Entity
@Table(
    name = "patient_intakes",
    uniqueConstraints = @UniqueConstraint(name = "uq_patient_intakes_consultation_id", columnNames = "consultation_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PatientIntakeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "consultation_id", nullable = false, updatable = false)
    private UUID consultationId;

    @Column(name = "name_or_alias", nullable = false)
    private String nameOrAlias;

    @Column(name = "age_range", length = 8)
    private String ageRange;

    @Column(name = "chief_complaint", columnDefinition = "TEXT")
    private String chiefComplaint;

    @Column(name = "consent_accepted_at", nullable = false, updatable = false)
    private Instant consentAcceptedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static PatientIntakeEntity fromDomain(PatientIntake intake) {
        return new PatientIntakeEntity(
            intake.getId(),
            intake.getConsultationId(),
            intake.getNameOrAlias(),
            intake.getAgeRange() == null ? null : intake.getAgeRange().getLabel(),
            intake.getChiefComplaint(),
            intake.getConsentAcceptedAt(),
            intake.getCreatedAt()
        );
    }

    public PatientIntake toDomain() {
        return PatientIntake.builder()
            .id(id)
            .consultationId(consultationId)
            .nameOrAlias(nameOrAlias)
            .ageRange(ageRange == null ? null : AgeRange.fromLabel(ageRange).orElse(null))
            .chiefComplaint(chiefComplaint)
            .consentAcceptedAt(consentAcceptedAt)
            .createdAt(createdAt)
            .build();
    }

    void revise(IntakeAnswers answers) {
        this.nameOrAlias = answers.getNameOrAlias();
        this.ageRange = answers.getAgeRange() == null ? null : answers.getAgeRange().getLabel();
        this.chiefComplaint = answers.getChiefComplaint();
    }
}
