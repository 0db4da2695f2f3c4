package com.flagship.telehealth_booking.video;

import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.TimeWindowPolicy;
import com.flagship.telehealth_booking.consultation.dto.ConsultationResponse;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.observability.ConsultationMetrics;
import com.flagship.telehealth_booking.observability.CorrelationContext;
import com.flagship.telehealth_booking.video.dto.JoinResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Video call endpoints: join (lazy room provisioning) and close.
 */
@RestController
@RequestMapping("/api/v1/consultations/{id}")
@RequiredArgsConstructor
@Slf4j
public class JoinController {

    private final JoinOrchestrator joinOrchestrator;
    private final CallTerminationService callTerminationService;
    private final TimeWindowPolicy timeWindowPolicy;
    private final ConsultationMetrics metrics;
    private final Clock clock;

    @PostMapping("/join")
    public ResponseEntity<JoinResponse> join(Caller caller, @PathVariable("id") UUID id) {
        MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, id.toString());
        long startTime = System.currentTimeMillis();
        try {
            JoinResponse response = joinOrchestrator.join(caller, id);
            metrics.recordLatency("join", "success", System.currentTimeMillis() - startTime);
            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLatency("join", "error", duration);
            log.debug("Join failed after {}ms: {}", duration, e.getMessage());
            throw e;
        }
    }

    @PostMapping("/close")
    public ResponseEntity<ConsultationResponse> close(Caller caller, @PathVariable("id") UUID id) {
        MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, id.toString());
        Consultation closed = callTerminationService.close(caller, id);
        return ResponseEntity.ok(ConsultationResponse.from(closed,
            timeWindowPolicy.effectiveStatus(closed, Instant.now(clock))));
    }
}
