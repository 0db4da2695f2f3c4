package com.flagship.telehealth_booking.consultation;

import com.flagship.telehealth_booking.consultation.dto.ConsultationResponse;
import com.flagship.telehealth_booking.consultation.dto.CreateConsultationRequest;
import com.flagship.telehealth_booking.consultation.dto.UpdateConsultationRequest;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.intake.PatientIntakeService;
import com.flagship.telehealth_booking.intake.dto.PatientIntakeResponse;
import com.flagship.telehealth_booking.intake.dto.SubmitIntakeRequest;
import com.flagship.telehealth_booking.observability.ConsultationMetrics;
import com.flagship.telehealth_booking.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for consultation booking, reads, partial updates and the
 * patient intake attached to each consultation.
 */
@RestController
@RequestMapping("/api/v1/consultations")
@RequiredArgsConstructor
@Slf4j
public class ConsultationController {

    private final ConsultationService consultationService;
    private final PatientIntakeService intakeService;
    private final TimeWindowPolicy timeWindowPolicy;
    private final ConsultationMetrics metrics;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<ConsultationResponse> createConsultation(
            Caller caller,
            @RequestBody CreateConsultationRequest request) {

        long startTime = System.currentTimeMillis();
        try {
            Consultation consultation = consultationService.create(caller, request);
            MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, consultation.getId().toString());

            metrics.recordLatency("create", "success", System.currentTimeMillis() - startTime);
            return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(consultation));

        } catch (RuntimeException e) {
            metrics.recordLatency("create", "error", System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    @GetMapping
    public ResponseEntity<List<ConsultationResponse>> listConsultations(
            Caller caller,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "specialty", required = false) String specialty,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset) {

        List<ConsultationResponse> body = consultationService.list(caller, status, specialty, limit, offset)
            .stream()
            .map(this::toResponse)
            .toList();
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ConsultationResponse> getConsultation(Caller caller, @PathVariable("id") UUID id) {
        MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, id.toString());
        return ResponseEntity.ok(toResponse(consultationService.get(caller, id)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ConsultationResponse> updateConsultation(
            Caller caller,
            @PathVariable("id") UUID id,
            @RequestBody UpdateConsultationRequest request) {

        MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, id.toString());
        long startTime = System.currentTimeMillis();
        try {
            Consultation updated = consultationService.update(caller, id, request);
            metrics.recordLatency("update", "success", System.currentTimeMillis() - startTime);
            return ResponseEntity.ok(toResponse(updated));

        } catch (RuntimeException e) {
            metrics.recordLatency("update", "error", System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    @PostMapping("/{id}/intake")
    public ResponseEntity<PatientIntakeResponse> submitIntake(
            Caller caller,
            @PathVariable("id") UUID id,
            @RequestBody SubmitIntakeRequest request) {

        MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, id.toString());
        long startTime = System.currentTimeMillis();
        try {
            PatientIntakeResponse body = PatientIntakeResponse.from(intakeService.submit(caller, id, request));
            metrics.recordLatency("intake", "success", System.currentTimeMillis() - startTime);
            return ResponseEntity.status(HttpStatus.CREATED).body(body);

        } catch (RuntimeException e) {
            metrics.recordLatency("intake", "error", System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    @PutMapping("/{id}/intake")
    public ResponseEntity<PatientIntakeResponse> upsertIntake(
            Caller caller,
            @PathVariable("id") UUID id,
            @RequestBody SubmitIntakeRequest request) {

        MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, id.toString());
        return ResponseEntity.ok(PatientIntakeResponse.from(intakeService.upsert(caller, id, request)));
    }

    @GetMapping("/{id}/intake")
    public ResponseEntity<PatientIntakeResponse> getIntake(Caller caller, @PathVariable("id") UUID id) {
        MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, id.toString());
        return ResponseEntity.ok(PatientIntakeResponse.from(intakeService.get(caller, id)));
    }

    private ConsultationResponse toResponse(Consultation consultation) {
        return ConsultationResponse.from(consultation,
            timeWindowPolicy.effectiveStatus(consultation, Instant.now(clock)));
    }
}
