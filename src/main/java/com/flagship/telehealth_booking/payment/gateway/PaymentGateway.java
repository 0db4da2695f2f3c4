package com.flagship.telehealth_booking.payment.gateway;

/**
 * Port to the hosted-checkout payment provider.
 */
public interface PaymentGateway {

    String providerId();

    /**
     * Creates a hosted checkout session. Provider failures come back as
     * {@link CreateSessionResult#failure(String)}, never as exceptions.
     */
    CreateSessionResult createCheckoutSession(CheckoutRequest request);

    /**
     * Verifies the signature and parses a webhook delivery. Callers must ignore
     * the result unless {@link WebhookResult#isVerified()}.
     */
    WebhookResult handleWebhook(String payload, String signatureHeader);

    /**
     * Expires an open checkout session so it can no longer be paid.
     *
     * @throws com.flagship.telehealth_booking.common.exception.ProviderException if the provider call fails
     */
    void expireSession(String sessionId);
}
