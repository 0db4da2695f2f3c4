package com.flagship.telehealth_booking.payment;

import com.flagship.telehealth_booking.audit.AuditEventType;
import com.flagship.telehealth_booking.audit.AuditRecorder;
import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationPersistenceService;
import com.flagship.telehealth_booking.consultation.ConsultationService;
import com.flagship.telehealth_booking.consultation.ConsultationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies provider outcomes to a payment and its consultation. Webhooks have no
 * user behind them, so every audit event here has a null actor.
 *
 * Each method is one transaction and returns {@link ConfirmationResult#ALREADY_PROCESSED}
 * without writing if the payment is no longer PENDING.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentConfirmationWriter {

    private final PaymentPersistenceService paymentPersistence;
    private final ConsultationPersistenceService consultationPersistence;
    private final ConsultationService consultationService;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    /**
     * Marks the payment PAID and the consultation PAID. Throws
     * DataIntegrityViolationException when the doctor's slot is already confirmed
     * by another consultation; the whole transaction then rolls back.
     */
    @Transactional
    public ConfirmationResult confirmPaid(Payment payment, String providerPaymentId) {
        if (!paymentPersistence.complete(payment, PaymentStatus.PAID, providerPaymentId, now())) {
            return ConfirmationResult.ALREADY_PROCESSED;
        }

        Consultation consultation = consultationPersistence.getById(payment.getConsultationId());
        moveIfPending(consultation, ConsultationStatus.PAID, payment);
        recordConfirmed(payment, PaymentStatus.PAID, providerPaymentId);
        return ConfirmationResult.PAID;
    }

    /**
     * The money was taken but the slot is gone: keep the payment PAID, fail the
     * consultation so the patient picks another slot.
     */
    @Transactional
    public ConfirmationResult confirmPaidSlotTaken(Payment payment, String providerPaymentId) {
        if (!paymentPersistence.complete(payment, PaymentStatus.PAID, providerPaymentId, now())) {
            return ConfirmationResult.ALREADY_PROCESSED;
        }

        Consultation consultation = consultationPersistence.getById(payment.getConsultationId());
        moveIfPending(consultation, ConsultationStatus.PAYMENT_FAILED, payment);
        recordConfirmed(payment, PaymentStatus.PAID, providerPaymentId);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("paymentId", payment.getId());
        metadata.put("providerCheckoutId", payment.getProviderCheckoutId());
        metadata.put("providerPaymentId", providerPaymentId);
        metadata.put("doctorId", consultation.getDoctorId());
        metadata.put("scheduledStartAt", consultation.getScheduledStartAt());
        auditRecorder.record(null, consultation.getId(), AuditEventType.PAYMENT_CONFLICT_SLOT_TAKEN, metadata);

        log.warn("Slot conflict: payment {} succeeded but consultation {} could not be confirmed",
            payment.getId(), consultation.getId());
        return ConfirmationResult.SLOT_TAKEN;
    }

    @Transactional
    public ConfirmationResult confirmFailed(Payment payment, String providerPaymentId) {
        if (!paymentPersistence.complete(payment, PaymentStatus.FAILED, providerPaymentId, now())) {
            return ConfirmationResult.ALREADY_PROCESSED;
        }

        Consultation consultation = consultationPersistence.getById(payment.getConsultationId());
        moveIfPending(consultation, ConsultationStatus.PAYMENT_FAILED, payment);
        recordConfirmed(payment, PaymentStatus.FAILED, providerPaymentId);
        return ConfirmationResult.FAILED;
    }

    private void moveIfPending(Consultation consultation, ConsultationStatus to, Payment payment) {
        if (consultation.getStatus() != ConsultationStatus.PAYMENT_PENDING) {
            log.warn("Consultation {} is {} rather than PAYMENT_PENDING; payment {} recorded without a status change",
                consultation.getId(), consultation.getStatus(), payment.getId());
            return;
        }
        consultationService.transition(null, consultation, to, Map.of("paymentId", payment.getId()));
    }

    private void recordConfirmed(Payment payment, PaymentStatus outcome, String providerPaymentId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("paymentId", payment.getId());
        metadata.put("outcome", outcome);
        metadata.put("providerCheckoutId", payment.getProviderCheckoutId());
        metadata.put("providerPaymentId", providerPaymentId);
        auditRecorder.record(null, payment.getConsultationId(), AuditEventType.PAYMENT_CONFIRMED, metadata);
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
