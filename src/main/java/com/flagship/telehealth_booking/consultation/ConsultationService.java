package com.flagship.telehealth_booking.consultation;

import com.flagship.telehealth_booking.audit.AuditEventType;
import com.flagship.telehealth_booking.audit.AuditRecorder;
import com.flagship.telehealth_booking.common.exception.ConflictException;
import com.flagship.telehealth_booking.common.exception.NotFoundException;
import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.consultation.dto.CreateConsultationRequest;
import com.flagship.telehealth_booking.consultation.dto.UpdateConsultationRequest;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.identity.Capability;
import com.flagship.telehealth_booking.identity.Role;
import com.flagship.telehealth_booking.identity.UserDirectory;
import com.flagship.telehealth_booking.observability.ConsultationMetrics;
import com.flagship.telehealth_booking.slot.SlotLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Consultation use cases: booking, reads, partial updates and status transitions.
 *
 * Every mutating method writes its audit events through {@link AuditRecorder} in the
 * same transaction as the row change, and persists through a compare-and-set on the
 * updatedAt value it read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsultationService {

    public static final int DEFAULT_LIST_LIMIT = 20;
    public static final int MAX_LIST_LIMIT = 100;

    private final ConsultationPersistenceService persistenceService;
    private final StatusTransitionValidator transitionValidator;
    private final TimeWindowPolicy timeWindowPolicy;
    private final ConsultationAccessPolicy accessPolicy;
    private final AuditRecorder auditRecorder;
    private final UserDirectory userDirectory;
    private final SlotLockService slotLockService;
    private final ConsultationMetrics metrics;
    private final Clock clock;

    /**
     * Books a consultation for the calling patient.
     */
    @Transactional
    public Consultation create(Caller caller, CreateConsultationRequest request) {
        caller.require(Capability.BOOK_CONSULTATION, "book consultations");

        Specialty specialty = parseSpecialty(request.getSpecialty());
        Instant scheduledStartAt = parseInstant("scheduledStartAt", request.getScheduledStartAt());
        Instant now = now();
        timeWindowPolicy.requireBookable(scheduledStartAt, now);

        Consultation consultation = persistenceService.insert(
            Consultation.book(caller.getUserId(), specialty, scheduledStartAt, now));

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("specialty", specialty);
        metadata.put("scheduledStartAt", scheduledStartAt);
        auditRecorder.record(caller.getUserId(), consultation.getId(), AuditEventType.CONSULT_CREATED, metadata);

        metrics.incrementConsultationsCreated();
        log.info("Consultation booked: consultationId={}, specialty={}, scheduledStartAt={}",
            consultation.getId(), specialty, scheduledStartAt);
        return consultation;
    }

    @Transactional(readOnly = true)
    public Consultation get(Caller caller, UUID consultationId) {
        Consultation consultation = persistenceService.getById(consultationId);
        accessPolicy.requireVisible(consultation, caller);
        return consultation;
    }

    /**
     * Role-scoped listing: patients see their bookings, doctors their assignments,
     * admins everything.
     */
    @Transactional(readOnly = true)
    public List<Consultation> list(Caller caller, String status, String specialty, Integer limit, Integer offset) {
        ConsultationQuery.ConsultationQueryBuilder query = ConsultationQuery.builder()
            .status(status == null ? null : parseStatus(status))
            .specialty(specialty == null ? null : parseSpecialty(specialty))
            .limit(Math.max(1, Math.min(MAX_LIST_LIMIT, limit == null ? DEFAULT_LIST_LIMIT : limit)))
            .offset(Math.max(0, offset == null ? 0 : offset));

        if (!caller.can(Capability.VIEW_ALL_CONSULTATIONS)) {
            if (caller.is(Role.DOCTOR)) {
                query.doctorId(caller.getUserId());
            } else {
                query.patientId(caller.getUserId());
            }
        }
        return persistenceService.search(query.build());
    }

    /**
     * Applies a partial update. Checks run in a fixed order: existence, access,
     * per-field role, doctor target, status value, transition legality, staleness.
     */
    @Transactional
    public Consultation update(Caller caller, UUID consultationId, UpdateConsultationRequest request) {
        Consultation current = persistenceService.getById(consultationId);
        accessPolicy.requireVisible(current, caller);

        if (request.getStatus() != null) {
            caller.require(Capability.UPDATE_STATUS, "update consultation status");
        }
        if (request.getDoctorId() != null) {
            caller.require(Capability.ASSIGN_DOCTOR, "assign doctors");
            requireDoctor(request.getDoctorId());
        }
        if (request.getScheduledStartAt() != null) {
            caller.require(Capability.RESCHEDULE, "reschedule consultations");
        }

        ConsultationStatus targetStatus = request.getStatus() == null ? null : parseStatus(request.getStatus());
        Instant scheduledStartAt = parseInstant("scheduledStartAt", request.getScheduledStartAt());
        if (targetStatus != null) {
            transitionValidator.validate(current.getStatus(), targetStatus);
        }
        requireFresh(current, parseInstant("updatedAt", request.getUpdatedAt()), request.getUpdatedAt());

        if (!request.hasChanges()) {
            return current;
        }

        Instant now = now();
        Consultation updated = current;
        if (targetStatus != null) {
            updated = transitionValidator.apply(updated, targetStatus, now);
        }
        boolean doctorChanged = request.getDoctorId() != null
            && !request.getDoctorId().equals(current.getDoctorId());
        boolean rescheduled = scheduledStartAt != null
            && !scheduledStartAt.equals(current.getScheduledStartAt());
        if (doctorChanged) {
            updated = updated.assignDoctor(request.getDoctorId(), now);
        }
        if (rescheduled) {
            updated = updated.reschedule(scheduledStartAt, now);
        }
        if (updated == current) {
            return current;
        }

        boolean slotMoved = doctorChanged || rescheduled;
        boolean slotAcquired = slotMoved && updated.hasConfirmedSlot() && reserveSlot(updated);

        UUID actor = caller.getUserId();
        try {
            persistenceService.compareAndSet(current, updated);

            if (targetStatus != null) {
                recordStatusChange(actor, current.getStatus(), updated, Map.of());
            }
            if (doctorChanged) {
                Map<String, Object> metadata = new HashMap<>();
                metadata.put("previousDoctorId", current.getDoctorId());
                metadata.put("doctorId", updated.getDoctorId());
                auditRecorder.record(actor, consultationId, AuditEventType.CONSULT_DOCTOR_ASSIGNED, metadata);
            }
            if (rescheduled) {
                Map<String, Object> metadata = new HashMap<>();
                metadata.put("from", current.getScheduledStartAt());
                metadata.put("to", updated.getScheduledStartAt());
                auditRecorder.record(actor, consultationId, AuditEventType.CONSULT_RESCHEDULED, metadata);
            }
        } catch (RuntimeException e) {
            if (slotAcquired) {
                slotLockService.release(updated.getDoctorId(), updated.getScheduledStartAt(), consultationId);
            }
            throw e;
        }

        // The old key was held under this consultation's id; release only drops our own value
        if (slotMoved && current.hasConfirmedSlot()) {
            slotLockService.release(current.getDoctorId(), current.getScheduledStartAt(), consultationId);
        }
        if (updated.getStatus() == ConsultationStatus.CANCELLED && updated.hasConfirmedSlot()) {
            slotLockService.release(updated.getDoctorId(), updated.getScheduledStartAt(), consultationId);
        }

        log.info("Consultation updated: consultationId={}, status={}, doctorChanged={}, rescheduled={}",
            consultationId, updated.getStatus(), doctorChanged, rescheduled);
        return updated;
    }

    /**
     * Moves {@code current} to {@code to} and records CONSULT_STATUS_CHANGED with
     * {from, to} plus {@code extraMetadata}. Joins the caller's transaction.
     *
     * @param actorUserId null for system-originated transitions
     */
    @Transactional
    public Consultation transition(UUID actorUserId, Consultation current, ConsultationStatus to,
                                   Map<String, Object> extraMetadata) {
        Consultation updated = transitionValidator.apply(current, to, now());
        persistenceService.compareAndSet(current, updated);
        recordStatusChange(actorUserId, current.getStatus(), updated, extraMetadata);
        return updated;
    }

    private void recordStatusChange(UUID actorUserId, ConsultationStatus from, Consultation updated,
                                    Map<String, Object> extraMetadata) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("from", from);
        metadata.put("to", updated.getStatus());
        metadata.putAll(extraMetadata);
        auditRecorder.record(actorUserId, updated.getId(), AuditEventType.CONSULT_STATUS_CHANGED, metadata);
        metrics.recordTransition(from.name(), updated.getStatus().name());
    }

    private void requireDoctor(UUID doctorId) {
        Role role = userDirectory.roleOf(doctorId)
            .orElseThrow(() -> new NotFoundException("Doctor", doctorId));
        if (role != Role.DOCTOR) {
            throw new ValidationException("Assigned user must be a doctor", Map.of("doctorId", doctorId));
        }
    }

    private void requireFresh(Consultation current, Instant clientUpdatedAt, String rawClientUpdatedAt) {
        if (clientUpdatedAt != null && current.getUpdatedAt().isAfter(clientUpdatedAt)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("serverUpdatedAt", current.getUpdatedAt());
            details.put("clientUpdatedAt", rawClientUpdatedAt);
            throw new ConflictException(
                "Consultation was modified by another request. Please refresh and try again.", details);
        }
    }

    /**
     * @return true when this call took the lock and must give it back if the write fails
     */
    private boolean reserveSlot(Consultation updated) {
        SlotLockService.LockOutcome outcome = slotLockService.acquire(
            updated.getDoctorId(), updated.getScheduledStartAt(), updated.getId());
        if (outcome == SlotLockService.LockOutcome.HELD_ELSEWHERE) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("doctorId", updated.getDoctorId());
            details.put("scheduledStartAt", updated.getScheduledStartAt());
            throw new ConflictException("This time slot is being booked by another consultation", details);
        }
        return outcome == SlotLockService.LockOutcome.ACQUIRED;
    }

    private Specialty parseSpecialty(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Specialty is required", Map.of("field", "specialty"));
        }
        try {
            return Specialty.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field", "specialty");
            details.put("validOptions", Arrays.stream(Specialty.values()).map(Enum::name).toList());
            throw new ValidationException("Invalid specialty: " + value, details);
        }
    }

    private ConsultationStatus parseStatus(String value) {
        try {
            return ConsultationStatus.valueOf(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid status value: " + value, Map.of("field", "status"));
        }
    }

    private Instant parseInstant(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim()).truncatedTo(ChronoUnit.MILLIS);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid date format for " + field, Map.of("field", field));
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
