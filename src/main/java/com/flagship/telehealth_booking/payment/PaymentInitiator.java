package com.flagship.telehealth_booking.payment;

import com.flagship.telehealth_booking.common.exception.ConflictException;
import com.flagship.telehealth_booking.common.exception.ForbiddenException;
import com.flagship.telehealth_booking.common.exception.ProviderException;
import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationAccessPolicy;
import com.flagship.telehealth_booking.consultation.ConsultationPersistenceService;
import com.flagship.telehealth_booking.consultation.ConsultationStatus;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.identity.Role;
import com.flagship.telehealth_booking.observability.ConsultationMetrics;
import com.flagship.telehealth_booking.payment.gateway.CheckoutRequest;
import com.flagship.telehealth_booking.payment.gateway.CreateSessionResult;
import com.flagship.telehealth_booking.payment.gateway.PaymentGateway;
import com.flagship.telehealth_booking.payment.gateway.PaymentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Starts hosted checkouts and answers payment-status polls.
 *
 * Ownership and state are checked before the provider is called. The provider
 * session is created first and the PENDING row second; if the row cannot be
 * written the session is expired so it cannot be paid.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentInitiator {

    private static final Set<ConsultationStatus> PAYABLE_STATUSES = EnumSet.of(
        ConsultationStatus.CREATED, ConsultationStatus.PAYMENT_PENDING, ConsultationStatus.PAYMENT_FAILED);

    private final ConsultationPersistenceService consultationPersistence;
    private final ConsultationAccessPolicy accessPolicy;
    private final PaymentPersistenceService paymentPersistence;
    private final PaymentInitiationWriter initiationWriter;
    private final PaymentGateway paymentGateway;
    private final PaymentProperties paymentProperties;
    private final ConsultationMetrics metrics;
    private final Clock clock;

    public CheckoutSession initiate(Caller caller, UUID consultationId) {
        if (consultationId == null) {
            throw new ValidationException("consultationId is required", Map.of("field", "consultationId"));
        }
        Consultation consultation = consultationPersistence.getById(consultationId);
        accessPolicy.requireOwner(consultation, caller);

        paymentPersistence.findActive(consultationId).ifPresent(existing -> {
            throw new ConflictException(
                "A payment is already in progress or completed for this consultation",
                Map.of("paymentId", existing.getId()));
        });

        if (!PAYABLE_STATUSES.contains(consultation.getStatus())) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("currentStatus", consultation.getStatus());
            details.put("allowedStatuses", PAYABLE_STATUSES.stream().map(Enum::name).toList());
            throw new ValidationException(
                "Cannot pay for consultation with status " + consultation.getStatus(), details);
        }

        UUID paymentId = UUID.randomUUID();
        String idempotencyKey = UUID.randomUUID().toString();
        BigDecimal amount = consultation.getSpecialty().getFee();
        String currency = paymentProperties.getCurrency();

        CreateSessionResult session = paymentGateway.createCheckoutSession(CheckoutRequest.builder()
            .paymentId(paymentId)
            .consultationId(consultationId)
            .amount(amount)
            .currency(currency)
            .description(consultation.getSpecialty() + " Consultation")
            .idempotencyKey(idempotencyKey)
            .build());

        if (!session.isSuccess()) {
            metrics.recordPaymentInitiated(consultation.getSpecialty().name(), "provider_error");
            throw new ProviderException(paymentGateway.providerId(),
                "Failed to create checkout session: " + session.getErrorMessage());
        }

        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        Payment pending = Payment.pending(paymentId, consultationId, amount, currency,
            session.getSessionId(), idempotencyKey, now);

        try {
            initiationWriter.recordPending(caller.getUserId(), consultation, pending);
        } catch (RuntimeException e) {
            log.warn("Failed to record payment {} for consultation {}, expiring checkout {}",
                paymentId, consultationId, session.getSessionId());
            expireQuietly(session.getSessionId());
            metrics.recordPaymentInitiated(consultation.getSpecialty().name(), "error");
            throw e;
        }

        metrics.recordPaymentInitiated(consultation.getSpecialty().name(), "success");
        return new CheckoutSession(session.getRedirectUrl(), paymentId);
    }

    /**
     * Poll target: true once a PAID payment exists. Pure read.
     */
    public boolean isPaid(Caller caller, UUID consultationId) {
        Consultation consultation = consultationPersistence.getById(consultationId);
        accessPolicy.requireVisible(consultation, caller);
        return paymentPersistence.isPaid(consultationId);
    }

    /**
     * The paying patient or an admin.
     */
    public Payment getPayment(Caller caller, UUID paymentId) {
        Payment payment = paymentPersistence.getById(paymentId);
        if (!caller.is(Role.ADMIN)) {
            Consultation consultation = consultationPersistence.getById(payment.getConsultationId());
            if (!consultation.isOwnedBy(caller.getUserId())) {
                throw new ForbiddenException("You do not have access to this payment");
            }
        }
        return payment;
    }

    private void expireQuietly(String sessionId) {
        try {
            paymentGateway.expireSession(sessionId);
        } catch (RuntimeException cleanupError) {
            log.error("Failed to expire checkout session {}", sessionId, cleanupError);
        }
    }
}
