package com.flagship.telehealth_booking.payment;

import com.flagship.telehealth_booking.identity.Caller;
import com.flagship.telehealth_booking.observability.ConsultationMetrics;
import com.flagship.telehealth_booking.observability.CorrelationContext;
import com.flagship.telehealth_booking.payment.dto.CheckoutResponse;
import com.flagship.telehealth_booking.payment.dto.CreatePaymentRequest;
import com.flagship.telehealth_booking.payment.dto.PaymentResponse;
import com.flagship.telehealth_booking.payment.dto.PaymentStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Checkout initiation and payment reads. Confirmation arrives separately through
 * {@link PaymentWebhookController}; clients poll the status endpoint.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentInitiator paymentInitiator;
    private final ConsultationMetrics metrics;

    @PostMapping
    public ResponseEntity<CheckoutResponse> createCheckout(Caller caller,
                                                           @Valid @RequestBody CreatePaymentRequest request) {
        if (request.getConsultationId() != null) {
            MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, request.getConsultationId().toString());
        }
        long startTime = System.currentTimeMillis();
        try {
            CheckoutSession session = paymentInitiator.initiate(caller, request.getConsultationId());
            metrics.recordLatency("initiate_payment", "success", System.currentTimeMillis() - startTime);
            return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CheckoutResponse(session.getUrl(), session.getPaymentId()));

        } catch (RuntimeException e) {
            metrics.recordLatency("initiate_payment", "error", System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    @GetMapping("/consultations/{consultationId}/status")
    public ResponseEntity<PaymentStatusResponse> getStatus(
            Caller caller,
            @PathVariable("consultationId") UUID consultationId) {
        MDC.put(CorrelationContext.CONSULTATION_ID_MDC_KEY, consultationId.toString());
        return ResponseEntity.ok(new PaymentStatusResponse(paymentInitiator.isPaid(caller, consultationId)));
    }

    @GetMapping("/{paymentId}")
    public ResponseEntity<PaymentResponse> getPayment(Caller caller, @PathVariable("paymentId") UUID paymentId) {
        return ResponseEntity.ok(PaymentResponse.from(paymentInitiator.getPayment(caller, paymentId)));
    }
}
