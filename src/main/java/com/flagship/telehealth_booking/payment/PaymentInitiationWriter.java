package com.flagship.telehealth_booking.payment;

import com.flagship.telehealth_booking.audit.AuditEventType;
import com.flagship.telehealth_booking.audit.AuditRecorder;
import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationService;
import com.flagship.telehealth_booking.consultation.ConsultationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Database side of payment initiation, run after the provider session exists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentInitiationWriter {

    private final PaymentPersistenceService paymentPersistence;
    private final ConsultationService consultationService;
    private final AuditRecorder auditRecorder;

    /**
     * Inserts the PENDING payment, moves CREATED or PAYMENT_FAILED consultations to
     * PAYMENT_PENDING and records PAYMENT_INITIATED, all in one transaction.
     */
    @Transactional
    public Payment recordPending(UUID actorUserId, Consultation consultation, Payment pending) {
        Payment saved = paymentPersistence.insert(pending);

        ConsultationStatus status = consultation.getStatus();
        if (status == ConsultationStatus.CREATED || status == ConsultationStatus.PAYMENT_FAILED) {
            consultationService.transition(actorUserId, consultation, ConsultationStatus.PAYMENT_PENDING,
                Map.of("paymentId", saved.getId()));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("paymentId", saved.getId());
        metadata.put("amount", saved.getAmount());
        metadata.put("currency", saved.getCurrency());
        metadata.put("specialty", consultation.getSpecialty());
        metadata.put("providerCheckoutId", saved.getProviderCheckoutId());
        auditRecorder.record(actorUserId, consultation.getId(), AuditEventType.PAYMENT_INITIATED, metadata);

        log.info("Payment initiated: paymentId={}, consultationId={}, amount={} {}",
            saved.getId(), consultation.getId(), saved.getAmount(), saved.getCurrency());
        return saved;
    }
}
