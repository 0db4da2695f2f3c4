package com.flagship.telehealth_booking.consultation;

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

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for consultations.
 *
 * No setters: rows are created through {@link #fromDomain} and changed only through
 * the compare-and-set update in {@link ConsultationRepository}. Timestamps come from
 * the domain object (which takes them from the injected clock), not from lifecycle hooks.
 *
 * The partial unique index on (doctor_id, scheduled_start_at) for confirmed statuses
 * lives in the Flyway migration; JPA cannot express it.
 */
@Entity
@Table(
    name = "consultations",
    indexes = {
        @Index(name = "idx_consultations_patient_id", columnList = "patient_id"),
        @Index(name = "idx_consultations_doctor_id", columnList = "doctor_id"),
        @Index(name = "idx_consultations_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConsultationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "patient_id", nullable = false, updatable = false)
    private UUID patientId;

    @Column(name = "doctor_id")
    private UUID doctorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private Specialty specialty;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ConsultationStatus status;

    @Column(name = "scheduled_start_at")
    private Instant scheduledStartAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static ConsultationEntity fromDomain(Consultation consultation) {
        return new ConsultationEntity(
            consultation.getId(),
            consultation.getPatientId(),
            consultation.getDoctorId(),
            consultation.getSpecialty(),
            consultation.getStatus(),
            consultation.getScheduledStartAt(),
            consultation.getStartedAt(),
            consultation.getEndedAt(),
            consultation.getCreatedAt(),
            consultation.getUpdatedAt()
        );
    }

    public Consultation toDomain() {
        return Consultation.builder()
            .id(id)
            .patientId(patientId)
            .doctorId(doctorId)
            .specialty(specialty)
            .status(status)
            .scheduledStartAt(scheduledStartAt)
            .startedAt(startedAt)
            .endedAt(endedAt)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }
}
