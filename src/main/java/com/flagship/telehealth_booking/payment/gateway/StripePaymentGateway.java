package com.flagship.telehealth_booking.payment.gateway;

import com.flagship.telehealth_booking.common.exception.ProviderException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.model.Event;
import com.stripe.model.StripeObject;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.net.Webhook;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;

/**
 * Stripe Checkout adapter. The API key travels with each request; the global
 * {@code Stripe.apiKey} is never set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StripePaymentGateway implements PaymentGateway {

    public static final String PROVIDER_ID = "STRIPE";

    static final String EVENT_COMPLETED = "checkout.session.completed";
    static final String EVENT_ASYNC_SUCCEEDED = "checkout.session.async_payment_succeeded";
    static final String EVENT_ASYNC_FAILED = "checkout.session.async_payment_failed";
    static final String EVENT_EXPIRED = "checkout.session.expired";

    private static final Set<String> ZERO_DECIMAL_CURRENCIES = Set.of(
        "BIF", "CLP", "DJF", "GNF", "JPY", "KMF", "KRW", "MGA", "PYG", "RWF", "UGX", "VND", "VUV",
        "XAF", "XOF", "XPF");

    private final PaymentProperties properties;

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public CreateSessionResult createCheckoutSession(CheckoutRequest request) {
        try {
            RequestOptions options = RequestOptions.builder()
                .setApiKey(apiKey())
                .setIdempotencyKey(request.getIdempotencyKey())
                .build();

            String consultationId = request.getConsultationId().toString();
            SessionCreateParams params = SessionCreateParams.builder()
                .setMode(SessionCreateParams.Mode.PAYMENT)
                .setClientReferenceId(consultationId)
                .setSuccessUrl(properties.getSuccessUrl().replace("{consultationId}", consultationId))
                .setCancelUrl(properties.getCancelUrl().replace("{consultationId}", consultationId))
                .putMetadata("consultationId", consultationId)
                .putMetadata("paymentId", request.getPaymentId().toString())
                .addLineItem(SessionCreateParams.LineItem.builder()
                    .setQuantity(1L)
                    .setPriceData(SessionCreateParams.LineItem.PriceData.builder()
                        .setCurrency(request.getCurrency().toLowerCase())
                        .setUnitAmount(toSmallestUnit(request.getAmount(), request.getCurrency()))
                        .setProductData(SessionCreateParams.LineItem.PriceData.ProductData.builder()
                            .setName(request.getDescription())
                            .build())
                        .build())
                    .build())
                .build();

            Session session = Session.create(params, options);
            return CreateSessionResult.success(session.getId(), session.getUrl());

        } catch (StripeException e) {
            log.error("Stripe session creation failed: {}", e.getMessage(), e);
            return CreateSessionResult.failure(e.getMessage());
        }
    }

    @Override
    public WebhookResult handleWebhook(String payload, String signatureHeader) {
        String secret = properties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Stripe webhook secret is not configured; rejecting delivery");
            return WebhookResult.unverified();
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            log.warn("Stripe webhook missing Stripe-Signature header");
            return WebhookResult.unverified();
        }

        Event event;
        try {
            event = Webhook.constructEvent(payload, signatureHeader, secret);
        } catch (SignatureVerificationException e) {
            log.warn("Stripe webhook signature verification failed: {}", e.getMessage());
            return WebhookResult.unverified();
        }

        String eventType = event.getType();
        CheckoutOutcome outcome;
        switch (eventType) {
            case EVENT_COMPLETED, EVENT_ASYNC_SUCCEEDED -> outcome = CheckoutOutcome.COMPLETED;
            case EVENT_ASYNC_FAILED, EVENT_EXPIRED -> outcome = CheckoutOutcome.FAILED;
            default -> {
                log.debug("Stripe webhook: unhandled event type '{}'", eventType);
                return WebhookResult.ignored(eventType);
            }
        }

        StripeObject object = event.getDataObjectDeserializer().getObject().orElse(null);
        if (!(object instanceof Session session)) {
            log.warn("Stripe webhook: could not deserialize checkout session from {}", eventType);
            return WebhookResult.ignored(eventType);
        }

        // Delayed payment methods complete the session before the money arrives.
        if (EVENT_COMPLETED.equals(eventType) && !"paid".equals(session.getPaymentStatus())) {
            log.info("Stripe checkout {} completed with payment status {}, awaiting async result",
                session.getId(), session.getPaymentStatus());
            return WebhookResult.ignored(eventType);
        }

        return WebhookResult.of(eventType, session.getId(), session.getPaymentIntent(), outcome);
    }

    @Override
    public void expireSession(String sessionId) {
        try {
            RequestOptions options = RequestOptions.builder().setApiKey(apiKey()).build();
            Session.retrieve(sessionId, options).expire(options);
            log.info("Stripe session {} expired", sessionId);
        } catch (StripeException e) {
            throw new ProviderException(PROVIDER_ID, "failed to expire session " + sessionId, e);
        }
    }

    /**
     * Converts a major-unit amount to the smallest currency unit (cents for USD).
     */
    long toSmallestUnit(BigDecimal amount, String currency) {
        if (ZERO_DECIMAL_CURRENCIES.contains(currency.toUpperCase())) {
            return amount.setScale(0, RoundingMode.HALF_UP).longValueExact();
        }
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private String apiKey() {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException(PROVIDER_ID, "API key is not configured");
        }
        return apiKey;
    }
}
