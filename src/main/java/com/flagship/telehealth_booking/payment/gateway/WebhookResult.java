package com.flagship.telehealth_booking.payment.gateway;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Parsed webhook delivery. {@code outcome} is null for verified events that
 * carry nothing actionable.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WebhookResult {
    boolean verified;
    String eventType;
    String sessionId;
    String providerPaymentId;
    CheckoutOutcome outcome;

    public static WebhookResult unverified() {
        return new WebhookResult(false, null, null, null, null);
    }

    public static WebhookResult ignored(String eventType) {
        return new WebhookResult(true, eventType, null, null, null);
    }

    public static WebhookResult of(String eventType, String sessionId, String providerPaymentId,
                                   CheckoutOutcome outcome) {
        return new WebhookResult(true, eventType, sessionId, providerPaymentId, outcome);
    }

    public boolean isActionable() {
        return verified && outcome != null && sessionId != null;
    }
}
