package com.flagship.telehealth_booking.intake;

import com.flagship.telehealth_booking.common.exception.ConflictException;
import com.flagship.telehealth_booking.common.exception.NotFoundException;
import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationAccessPolicy;
import com.flagship.telehealth_booking.consultation.ConsultationPersistenceService;
import com.flagship.telehealth_booking.consultation.ConsultationStatus;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.intake.dto.SubmitIntakeRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Patient intake: the form a patient fills in between booking and payment.
 *
 * The body is checked before the consultation is loaded; then ownership, then the
 * status gate. Only CREATED and PAYMENT_PENDING consultations accept an intake.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatientIntakeService {

    public static final Set<ConsultationStatus> INTAKE_STATUSES =
        EnumSet.of(ConsultationStatus.CREATED, ConsultationStatus.PAYMENT_PENDING);

    static final int MAX_NAME_LENGTH = 255;

    private final PatientIntakeRepository intakeRepository;
    private final ConsultationPersistenceService consultationPersistence;
    private final ConsultationAccessPolicy accessPolicy;
    private final Clock clock;

    /**
     * Creates the intake. A second submission is a CONFLICT naming the existing one.
     */
    @Transactional
    public PatientIntake submit(Caller caller, UUID consultationId, SubmitIntakeRequest request) {
        IntakeAnswers answers = validate(request);
        requireEditable(caller, consultationId);

        Optional<PatientIntakeEntity> existing = intakeRepository.findByConsultationId(consultationId);
        if (existing.isPresent()) {
            throw new ConflictException("Intake already exists for this consultation",
                Map.of("existingIntakeId", existing.get().getId()));
        }

        PatientIntake intake = insert(consultationId, answers);
        log.info("Patient intake submitted: consultationId={}, intakeId={}", consultationId, intake.getId());
        return intake;
    }

    /**
     * Creates or replaces the intake answers. The original consent time is kept.
     */
    @Transactional
    public PatientIntake upsert(Caller caller, UUID consultationId, SubmitIntakeRequest request) {
        IntakeAnswers answers = validate(request);
        requireEditable(caller, consultationId);

        Optional<PatientIntakeEntity> existing = intakeRepository.findByConsultationId(consultationId);
        if (existing.isEmpty()) {
            PatientIntake intake = insert(consultationId, answers);
            log.info("Patient intake submitted: consultationId={}, intakeId={}", consultationId, intake.getId());
            return intake;
        }

        PatientIntakeEntity entity = existing.get();
        entity.revise(answers);
        log.info("Patient intake revised: consultationId={}, intakeId={}", consultationId, entity.getId());
        return entity.toDomain();
    }

    @Transactional(readOnly = true)
    public PatientIntake get(Caller caller, UUID consultationId) {
        Consultation consultation = consultationPersistence.getById(consultationId);
        accessPolicy.requireVisible(consultation, caller);
        return intakeRepository.findByConsultationId(consultationId)
            .map(PatientIntakeEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Patient intake for consultation", consultationId));
    }

    private PatientIntake insert(UUID consultationId, IntakeAnswers answers) {
        PatientIntake intake = PatientIntake.submit(consultationId, answers,
            Instant.now(clock).truncatedTo(ChronoUnit.MILLIS));
        // Flush so a concurrent submission fails here on uq_patient_intakes_consultation_id
        intakeRepository.saveAndFlush(PatientIntakeEntity.fromDomain(intake));
        return intake;
    }

    private void requireEditable(Caller caller, UUID consultationId) {
        Consultation consultation = consultationPersistence.getById(consultationId);
        accessPolicy.requireIntakeAuthor(consultation, caller);

        if (!INTAKE_STATUSES.contains(consultation.getStatus())) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("currentStatus", consultation.getStatus());
            details.put("allowedStatuses", INTAKE_STATUSES.stream().map(Enum::name).toList());
            throw new ValidationException(
                "Cannot submit intake for consultation in " + consultation.getStatus() + " status", details);
        }
    }

    private IntakeAnswers validate(SubmitIntakeRequest request) {
        if (request == null || request.getNameOrAlias() == null || request.getNameOrAlias().isBlank()) {
            throw new ValidationException("Name or alias is required", Map.of("field", "nameOrAlias"));
        }
        String nameOrAlias = request.getNameOrAlias().trim();
        if (nameOrAlias.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Name or alias must be at most " + MAX_NAME_LENGTH + " characters",
                Map.of("field", "nameOrAlias"));
        }
        if (!Boolean.TRUE.equals(request.getConsentAccepted())) {
            throw new ValidationException("Consent acceptance is required", Map.of("field", "consentAccepted"));
        }

        AgeRange ageRange = null;
        if (request.getAgeRange() != null && !request.getAgeRange().isBlank()) {
            ageRange = AgeRange.fromLabel(request.getAgeRange().trim()).orElseThrow(() -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("field", "ageRange");
                details.put("validOptions", AgeRange.labels());
                return new ValidationException(
                    "Invalid age range. Valid options: " + String.join(", ", AgeRange.labels()), details);
            });
        }

        String chiefComplaint = request.getChiefComplaint();
        if (chiefComplaint != null && chiefComplaint.isBlank()) {
            chiefComplaint = null;
        }
        return new IntakeAnswers(nameOrAlias, ageRange, chiefComplaint);
    }
}
