package com.flagship.telehealth_booking.consultation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Consultation domain object.
 *
 * Immutable: every change produces a new instance. Status changes go through
 * {@link StatusTransitionValidator#apply}, which owns the startedAt/endedAt stamps;
 * the helpers here only cover assignment and rescheduling.
 */
@Value
@Builder(toBuilder = true)
public class Consultation {
    UUID id;
    UUID patientId;
    UUID doctorId;
    Specialty specialty;
    ConsultationStatus status;
    Instant scheduledStartAt;
    Instant startedAt;
    Instant endedAt;
    Instant createdAt;
    /** Last-write instant; the optimistic concurrency token. */
    Instant updatedAt;

    /**
     * Creates a new consultation in CREATED status.
     */
    public static Consultation book(UUID patientId, Specialty specialty, Instant scheduledStartAt, Instant now) {
        return Consultation.builder()
            .id(UUID.randomUUID())
            .patientId(patientId)
            .specialty(specialty)
            .status(ConsultationStatus.CREATED)
            .scheduledStartAt(scheduledStartAt)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public Consultation assignDoctor(UUID newDoctorId, Instant now) {
        return toBuilder().doctorId(newDoctorId).updatedAt(now).build();
    }

    public Consultation reschedule(Instant newScheduledStartAt, Instant now) {
        return toBuilder().scheduledStartAt(newScheduledStartAt).updatedAt(now).build();
    }

    public boolean isOwnedBy(UUID userId) {
        return patientId.equals(userId);
    }

    public boolean isAssignedTo(UUID userId) {
        return doctorId != null && doctorId.equals(userId);
    }

    public boolean isParticipant(UUID userId) {
        return isOwnedBy(userId) || isAssignedTo(userId);
    }

    public boolean hasConfirmedSlot() {
        return doctorId != null && scheduledStartAt != null;
    }
}
