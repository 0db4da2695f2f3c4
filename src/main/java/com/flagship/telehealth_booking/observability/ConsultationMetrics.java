package com.flagship.telehealth_booking.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the consultation lifecycle.
 *
 * Metrics exposed:
 * - consultation.created: consultations booked
 * - consultation.transitions: accepted status transitions, tagged from/to
 * - video.rooms.created / video.rooms.compensated: room provisioning and rollback
 * - video.compensation.failures: rooms that could not be deleted after a failed commit
 * - video.tokens.minted: join tokens, tagged owner=true/false
 * - payments.initiated / payments.confirmed: checkout sessions and webhook outcomes
 * - consultation.api.latency: per-operation latency
 */
@Component
public class ConsultationMetrics {

    private final MeterRegistry registry;

    private final Counter consultationsCreated;
    private final Counter roomsCreated;
    private final Counter roomsCompensated;
    private final Counter compensationFailures;

    public ConsultationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.consultationsCreated = Counter.builder("consultation.created")
                .description("Number of consultations booked")
                .register(registry);

        this.roomsCreated = Counter.builder("video.rooms.created")
                .description("Number of provider rooms created on first join")
                .register(registry);

        this.roomsCompensated = Counter.builder("video.rooms.compensated")
                .description("Number of provider rooms deleted after a failed or lost first-join commit")
                .register(registry);

        this.compensationFailures = Counter.builder("video.compensation.failures")
                .description("Number of provider rooms that could not be deleted during compensation")
                .register(registry);
    }

    public void incrementConsultationsCreated() {
        consultationsCreated.increment();
    }

    public void incrementRoomsCreated() {
        roomsCreated.increment();
    }

    public void incrementRoomsCompensated() {
        roomsCompensated.increment();
    }

    public void incrementCompensationFailures() {
        compensationFailures.increment();
    }

    public void recordTransition(String from, String to) {
        registry.counter("consultation.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to)
        ).increment();
    }

    public void recordTokenMinted(boolean owner) {
        registry.counter("video.tokens.minted", "owner", String.valueOf(owner)).increment();
    }

    public void recordPaymentInitiated(String specialty, String status) {
        registry.counter("payments.initiated",
                "specialty", sanitizeTag(specialty),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordPaymentConfirmed(String outcome) {
        registry.counter("payments.confirmed", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * Records operation latency. Uses registry.timer() for meter lookup/creation.
     */
    public void recordLatency(String operation, String status, long durationMs) {
        Timer timer = registry.timer("consultation.api.latency",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status));
        timer.record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
