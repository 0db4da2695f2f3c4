package com.flagship.telehealth_booking.payment;

import com.flagship.telehealth_booking.common.exception.ConflictException;
import com.flagship.telehealth_booking.common.exception.ForbiddenException;
import com.flagship.telehealth_booking.common.exception.ProviderException;
import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationAccessPolicy;
import com.flagship.telehealth_booking.consultation.ConsultationPersistenceService;
import com.flagship.telehealth_booking.consultation.ConsultationStatus;
import com.flagship.telehealth_booking.consultation.Specialty;
import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.identity.Role;
import com.flagship.telehealth_booking.observability.ConsultationMetrics;
import com.flagship.telehealth_booking.payment.gateway.CheckoutRequest;
import com.flagship.telehealth_booking.payment.gateway.CreateSessionResult;
import com.flagship.telehealth_booking.payment.gateway.PaymentGateway;
import com.flagship.telehealth_booking.payment.gateway.PaymentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PaymentInitiatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private ConsultationPersistenceService consultationPersistence;
    @Mock
    private PaymentPersistenceService paymentPersistence;
    @Mock
    private PaymentInitiationWriter initiationWriter;
    @Mock
    private PaymentGateway paymentGateway;
    @Mock
    private ConsultationMetrics metrics;

    private PaymentInitiator initiator;

    private final UUID patientId = UUID.randomUUID();
    private final Caller patient = new Caller(patientId, Role.PATIENT);

    @BeforeEach
    void setUp() {
        initiator = new PaymentInitiator(
                consultationPersistence,
                new ConsultationAccessPolicy(),
                paymentPersistence,
                initiationWriter,
                paymentGateway,
                new PaymentProperties(),
                metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));

        when(paymentGateway.providerId()).thenReturn("STRIPE");
        when(paymentPersistence.findActive(any())).thenReturn(Optional.empty());
        when(initiationWriter.recordPending(any(), any(), any())).thenAnswer(inv -> inv.getArgument(2));
    }

    @Test
    @DisplayName("Initiation charges the specialty fee and stores a PENDING payment for the checkout")
    void initiateCreatesPendingPayment() {
        Consultation consultation = stored(ConsultationStatus.CREATED, Specialty.CARDIOLOGY);
        when(paymentGateway.createCheckoutSession(any()))
                .thenReturn(CreateSessionResult.success("cs_test_1", "https://checkout.test/cs_test_1"));

        CheckoutSession session = initiator.initiate(patient, consultation.getId());

        ArgumentCaptor<CheckoutRequest> request = ArgumentCaptor.forClass(CheckoutRequest.class);
        verify(paymentGateway).createCheckoutSession(request.capture());
        assertEquals(0, new BigDecimal("150.00").compareTo(request.getValue().getAmount()));
        assertEquals("USD", request.getValue().getCurrency());
        assertEquals(session.getPaymentId(), request.getValue().getPaymentId());

        ArgumentCaptor<Payment> pending = ArgumentCaptor.forClass(Payment.class);
        verify(initiationWriter).recordPending(eq(patientId), eq(consultation), pending.capture());
        assertEquals(PaymentStatus.PENDING, pending.getValue().getStatus());
        assertEquals("cs_test_1", pending.getValue().getProviderCheckoutId());
        assertEquals(request.getValue().getIdempotencyKey(), pending.getValue().getIdempotencyKey());
        assertEquals(NOW, pending.getValue().getCreatedAt());

        assertEquals("https://checkout.test/cs_test_1", session.getUrl());
    }

    @Test
    @DisplayName("Every attempt uses a fresh idempotency key")
    void freshIdempotencyKeyPerAttempt() {
        Consultation consultation = stored(ConsultationStatus.PAYMENT_FAILED, Specialty.GENERAL);
        when(paymentGateway.createCheckoutSession(any()))
                .thenReturn(CreateSessionResult.success("cs_1", "https://checkout.test/1"))
                .thenReturn(CreateSessionResult.success("cs_2", "https://checkout.test/2"));

        initiator.initiate(patient, consultation.getId());
        initiator.initiate(patient, consultation.getId());

        ArgumentCaptor<CheckoutRequest> requests = ArgumentCaptor.forClass(CheckoutRequest.class);
        verify(paymentGateway, times(2)).createCheckoutSession(requests.capture());
        assertNotEquals(requests.getAllValues().get(0).getIdempotencyKey(),
                requests.getAllValues().get(1).getIdempotencyKey());
    }

    @Test
    @DisplayName("Only the owning patient may pay, checked before the provider is called")
    void ownerCheckedFirst() {
        Consultation consultation = stored(ConsultationStatus.CREATED, Specialty.GENERAL);

        assertThrows(ForbiddenException.class,
                () -> initiator.initiate(new Caller(UUID.randomUUID(), Role.PATIENT), consultation.getId()));
        assertThrows(ForbiddenException.class,
                () -> initiator.initiate(new Caller(UUID.randomUUID(), Role.ADMIN), consultation.getId()));
        verify(paymentGateway, never()).createCheckoutSession(any());
    }

    @Test
    @DisplayName("An existing PENDING or PAID payment blocks a new checkout with CONFLICT")
    void existingPaymentConflicts() {
        Consultation consultation = stored(ConsultationStatus.PAYMENT_PENDING, Specialty.GENERAL);
        Payment existing = Payment.pending(UUID.randomUUID(), consultation.getId(), new BigDecimal("50.00"),
                "USD", "cs_old", "key", NOW);
        when(paymentPersistence.findActive(consultation.getId())).thenReturn(Optional.of(existing));

        ConflictException e = assertThrows(ConflictException.class,
                () -> initiator.initiate(patient, consultation.getId()));

        assertEquals(existing.getId(), e.getDetails().get("paymentId"));
        verify(paymentGateway, never()).createCheckoutSession(any());
    }

    @Test
    @DisplayName("Consultations past payment cannot start a checkout")
    void paidConsultationRejected() {
        Consultation consultation = stored(ConsultationStatus.CANCELLED, Specialty.GENERAL);

        assertThrows(ValidationException.class, () -> initiator.initiate(patient, consultation.getId()));
        verify(paymentGateway, never()).createCheckoutSession(any());
    }

    @Test
    @DisplayName("Provider failure surfaces as ProviderException and writes nothing")
    void providerFailure() {
        Consultation consultation = stored(ConsultationStatus.CREATED, Specialty.GENERAL);
        when(paymentGateway.createCheckoutSession(any())).thenReturn(CreateSessionResult.failure("invalid key"));

        assertThrows(ProviderException.class, () -> initiator.initiate(patient, consultation.getId()));
        verifyNoInteractions(initiationWriter);
    }

    @Test
    @DisplayName("If the PENDING row cannot be written the checkout session is expired")
    void writeFailureExpiresSession() {
        Consultation consultation = stored(ConsultationStatus.CREATED, Specialty.GENERAL);
        when(paymentGateway.createCheckoutSession(any()))
                .thenReturn(CreateSessionResult.success("cs_orphan", "https://checkout.test/orphan"));
        when(initiationWriter.recordPending(any(), any(), any()))
                .thenThrow(new ConflictException("Consultation was modified concurrently"));

        assertThrows(ConflictException.class, () -> initiator.initiate(patient, consultation.getId()));
        verify(paymentGateway).expireSession("cs_orphan");
    }

    @Test
    @DisplayName("A failed session expiry does not mask the original write failure")
    void expiryFailureKeepsOriginalError() {
        Consultation consultation = stored(ConsultationStatus.CREATED, Specialty.GENERAL);
        when(paymentGateway.createCheckoutSession(any()))
                .thenReturn(CreateSessionResult.success("cs_orphan", "https://checkout.test/orphan"));
        when(initiationWriter.recordPending(any(), any(), any()))
                .thenThrow(new ConflictException("Consultation was modified concurrently"));
        doThrow(new ProviderException("STRIPE", "failed to expire session cs_orphan"))
                .when(paymentGateway).expireSession("cs_orphan");

        assertThrows(ConflictException.class, () -> initiator.initiate(patient, consultation.getId()));
        verify(paymentGateway).expireSession("cs_orphan");
    }

    @Test
    @DisplayName("Status poll reports paid only when a PAID payment exists")
    void statusPoll() {
        Consultation consultation = stored(ConsultationStatus.PAID, Specialty.GENERAL);
        when(paymentPersistence.isPaid(consultation.getId())).thenReturn(true);

        assertTrue(initiator.isPaid(patient, consultation.getId()));
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("A missing consultationId is a validation error")
    void missingConsultationId() {
        assertThrows(ValidationException.class, () -> initiator.initiate(patient, null));
    }

    private Consultation stored(ConsultationStatus status, Specialty specialty) {
        Consultation consultation = Consultation.book(patientId, specialty, NOW.plusSeconds(3600), NOW.minusSeconds(60))
                .toBuilder()
                .status(status)
                .build();
        when(consultationPersistence.getById(consultation.getId())).thenReturn(consultation);
        return consultation;
    }
}
