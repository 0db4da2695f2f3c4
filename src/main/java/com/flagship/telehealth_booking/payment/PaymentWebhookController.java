package com.flagship.telehealth_booking.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Provider callback. Unauthenticated: the signature header is the credential.
 * Any verified delivery is acknowledged with 200 so the provider stops retrying.
 */
@RestController
@RequestMapping("/api/v1/payments/webhook")
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final PaymentConfirmationService confirmationService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestBody String payload,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature) {
        ConfirmationResult result = confirmationService.handleWebhook(payload, signature);
        log.debug("Webhook handled: result={}", result);
        return ResponseEntity.ok(Map.of("received", true, "result", result.name()));
    }
}
