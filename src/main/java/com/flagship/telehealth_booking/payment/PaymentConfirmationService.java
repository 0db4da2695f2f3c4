package com.flagship.telehealth_booking.payment;

import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationPersistenceService;
import com.flagship.telehealth_booking.observability.ConsultationMetrics;
import com.flagship.telehealth_booking.observability.CorrelationContext;
import com.flagship.telehealth_booking.payment.gateway.CheckoutOutcome;
import com.flagship.telehealth_booking.payment.gateway.PaymentGateway;
import com.flagship.telehealth_booking.payment.gateway.WebhookResult;
import com.flagship.telehealth_booking.slot.SlotLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Handles checkout webhooks: verifies the delivery, then records the outcome on
 * the matching PENDING payment and its consultation.
 *
 * Redeliveries are harmless: a payment that already left PENDING is not touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentConfirmationService {

    private final PaymentGateway paymentGateway;
    private final PaymentPersistenceService paymentPersistence;
    private final PaymentConfirmationWriter confirmationWriter;
    private final ConsultationPersistenceService consultationPersistence;
    private final SlotLockService slotLockService;
    private final ConsultationMetrics metrics;

    /**
     * @throws ValidationException if the signature does not verify
     */
    public ConfirmationResult handleWebhook(String payload, String signatureHeader) {
        WebhookResult result = paymentGateway.handleWebhook(payload, signatureHeader);
        if (!result.isVerified()) {
            throw new ValidationException("Invalid webhook signature");
        }
        if (!result.isActionable()) {
            return ConfirmationResult.IGNORED;
        }

        Optional<Payment> found = paymentPersistence.findByCheckoutId(result.getSessionId());
        if (found.isEmpty()) {
            log.warn("No payment found for checkout session {}", result.getSessionId());
            return ConfirmationResult.UNKNOWN_SESSION;
        }

        Payment payment = found.get();
        MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, payment.getConsultationId().toString());
        if (!payment.isPending()) {
            log.info("Payment {} already {}, ignoring {}", payment.getId(), payment.getStatus(), result.getEventType());
            return ConfirmationResult.ALREADY_PROCESSED;
        }

        try {
            ConfirmationResult outcome = apply(payment, result);
            metrics.recordPaymentConfirmed(outcome.name());
            log.info("Payment {} confirmed: outcome={}, event={}", payment.getId(), outcome, result.getEventType());
            return outcome;
        } finally {
            releaseSlotLock(payment);
        }
    }

    private ConfirmationResult apply(Payment payment, WebhookResult result) {
        if (result.getOutcome() == CheckoutOutcome.FAILED) {
            return confirmationWriter.confirmFailed(payment, result.getProviderPaymentId());
        }
        try {
            return confirmationWriter.confirmPaid(payment, result.getProviderPaymentId());
        } catch (DataIntegrityViolationException e) {
            log.info("Confirmed slot already taken for consultation {}: {}",
                payment.getConsultationId(), e.getMostSpecificCause().getMessage());
            return confirmationWriter.confirmPaidSlotTaken(payment, result.getProviderPaymentId());
        }
    }

    private void releaseSlotLock(Payment payment) {
        try {
            consultationPersistence.findById(payment.getConsultationId())
                .filter(Consultation::hasConfirmedSlot)
                .ifPresent(c -> slotLockService.release(c.getDoctorId(), c.getScheduledStartAt(), c.getId()));
        } catch (RuntimeException e) {
            log.warn("Failed to release slot lock for consultation {}: {}", payment.getConsultationId(), e.getMessage());
        }
    }
}
