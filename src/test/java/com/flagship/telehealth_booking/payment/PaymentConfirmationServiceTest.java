package com.flagship.telehealth_booking.payment;

import com.flagship.telehealth_booking.common.exception.ValidationException;
import com.flagship.telehealth_booking.consultation.Consultation;
import com.flagship.telehealth_booking.consultation.ConsultationPersistenceService;
import com.flagship.telehealth_booking.consultation.ConsultationStatus;
import com.flagship.telehealth_booking.consultation.Specialty;
import com.flagship.telehealth_booking.observability.ConsultationMetrics;
import com.flagship.telehealth_booking.payment.gateway.CheckoutOutcome;
import com.flagship.telehealth_booking.payment.gateway.PaymentGateway;
import com.flagship.telehealth_booking.payment.gateway.WebhookResult;
import com.flagship.telehealth_booking.slot.SlotLockService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PaymentConfirmationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private PaymentGateway paymentGateway;
    @Mock
    private PaymentPersistenceService paymentPersistence;
    @Mock
    private PaymentConfirmationWriter confirmationWriter;
    @Mock
    private ConsultationPersistenceService consultationPersistence;
    @Mock
    private SlotLockService slotLockService;
    @Mock
    private ConsultationMetrics metrics;

    @InjectMocks
    private PaymentConfirmationService service;

    private Consultation consultation;
    private Payment pending;

    @BeforeEach
    void setUp() {
        consultation = Consultation.book(UUID.randomUUID(), Specialty.GENERAL, NOW.plusSeconds(3600), NOW)
                .toBuilder()
                .doctorId(UUID.randomUUID())
                .status(ConsultationStatus.PAYMENT_PENDING)
                .build();
        pending = Payment.pending(UUID.randomUUID(), consultation.getId(), new BigDecimal("50.00"), "USD",
                "cs_1", "key-1", NOW);

        when(paymentPersistence.findByCheckoutId("cs_1")).thenReturn(Optional.of(pending));
        when(consultationPersistence.findById(consultation.getId())).thenReturn(Optional.of(consultation));
    }

    @Test
    @DisplayName("Unverified deliveries are rejected without touching any payment")
    void unverifiedRejected() {
        when(paymentGateway.handleWebhook("{}", "bad")).thenReturn(WebhookResult.unverified());

        assertThrows(ValidationException.class, () -> service.handleWebhook("{}", "bad"));
        verifyNoInteractions(paymentPersistence, confirmationWriter);
    }

    @Test
    @DisplayName("Verified events without an outcome are acknowledged and ignored")
    void nonActionableIgnored() {
        when(paymentGateway.handleWebhook(any(), any())).thenReturn(WebhookResult.ignored("customer.created"));

        assertEquals(ConfirmationResult.IGNORED, service.handleWebhook("{}", "sig"));
        verifyNoInteractions(confirmationWriter);
    }

    @Test
    @DisplayName("A completed checkout confirms the payment and releases the slot lock")
    void completedConfirmsPaid() {
        webhook(CheckoutOutcome.COMPLETED);
        when(confirmationWriter.confirmPaid(pending, "pi_1")).thenReturn(ConfirmationResult.PAID);

        assertEquals(ConfirmationResult.PAID, service.handleWebhook("{}", "sig"));
        verify(slotLockService).release(consultation.getDoctorId(), consultation.getScheduledStartAt(),
                consultation.getId());
        verify(metrics).recordPaymentConfirmed("PAID");
    }

    @Test
    @DisplayName("A taken slot still records the payment and fails the consultation")
    void slotTakenFallsBack() {
        webhook(CheckoutOutcome.COMPLETED);
        when(confirmationWriter.confirmPaid(pending, "pi_1"))
                .thenThrow(new DataIntegrityViolationException("uq_consultations_confirmed_slot"));
        when(confirmationWriter.confirmPaidSlotTaken(pending, "pi_1")).thenReturn(ConfirmationResult.SLOT_TAKEN);

        assertEquals(ConfirmationResult.SLOT_TAKEN, service.handleWebhook("{}", "sig"));
        verify(confirmationWriter).confirmPaidSlotTaken(pending, "pi_1");
        verify(slotLockService).release(any(), any(), any());
    }

    @Test
    @DisplayName("A failed or expired checkout fails the payment")
    void failedOutcome() {
        webhook(CheckoutOutcome.FAILED);
        when(confirmationWriter.confirmFailed(pending, "pi_1")).thenReturn(ConfirmationResult.FAILED);

        assertEquals(ConfirmationResult.FAILED, service.handleWebhook("{}", "sig"));
        verify(confirmationWriter, never()).confirmPaid(any(), any());
    }

    @Test
    @DisplayName("Redelivery for a payment that already left PENDING changes nothing")
    void redeliveryIsIdempotent() {
        webhook(CheckoutOutcome.COMPLETED);
        Payment paid = pending.toBuilder().status(PaymentStatus.PAID).build();
        when(paymentPersistence.findByCheckoutId("cs_1")).thenReturn(Optional.of(paid));

        assertEquals(ConfirmationResult.ALREADY_PROCESSED, service.handleWebhook("{}", "sig"));
        verifyNoInteractions(confirmationWriter, slotLockService);
    }

    @Test
    @DisplayName("Unknown checkout sessions are acknowledged")
    void unknownSession() {
        when(paymentGateway.handleWebhook(any(), any()))
                .thenReturn(WebhookResult.of("checkout.session.completed", "cs_unknown", null, CheckoutOutcome.COMPLETED));

        assertEquals(ConfirmationResult.UNKNOWN_SESSION, service.handleWebhook("{}", "sig"));
        verifyNoInteractions(confirmationWriter);
    }

    @Test
    @DisplayName("The slot lock is released even when confirmation fails unexpectedly")
    void lockReleasedOnFailure() {
        webhook(CheckoutOutcome.COMPLETED);
        when(confirmationWriter.confirmPaid(any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> service.handleWebhook("{}", "sig"));
        verify(slotLockService).release(any(), any(), any());
    }

    private void webhook(CheckoutOutcome outcome) {
        when(paymentGateway.handleWebhook(any(), any()))
                .thenReturn(WebhookResult.of("checkout.session.completed", "cs_1", "pi_1", outcome));
    }
}
