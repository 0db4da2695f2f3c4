package com.flagship.telehealth_booking.payment.gateway;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of {@link PaymentGateway#createCheckoutSession(CheckoutRequest)}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CreateSessionResult {
    boolean success;
    String sessionId;
    String redirectUrl;
    String errorMessage;

    public static CreateSessionResult success(String sessionId, String redirectUrl) {
        return new CreateSessionResult(true, sessionId, redirectUrl, null);
    }

    public static CreateSessionResult failure(String errorMessage) {
        return new CreateSessionResult(false, null, null, errorMessage);
    }
}
