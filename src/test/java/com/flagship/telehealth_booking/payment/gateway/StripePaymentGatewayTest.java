package com.flagship.telehealth_booking.payment.gateway;

import com.flagship.telehealth_booking.common.exception.ProviderException;
import com.stripe.Stripe;
import com.stripe.exception.StripeException;
import com.stripe.net.Webhook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class StripePaymentGatewayTest {

    private static final String SECRET = "whsec_test_secret";

    private PaymentProperties properties;
    private StripePaymentGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new PaymentProperties();
        properties.setWebhookSecret(SECRET);
        gateway = new StripePaymentGateway(properties);
    }

    @Test
    @DisplayName("Amounts convert to cents, zero-decimal currencies stay whole")
    void smallestUnit() {
        assertEquals(15000L, gateway.toSmallestUnit(new BigDecimal("150.00"), "USD"));
        assertEquals(1999L, gateway.toSmallestUnit(new BigDecimal("19.99"), "eur"));
        assertEquals(500L, gateway.toSmallestUnit(new BigDecimal("500"), "JPY"));
    }

    @Test
    @DisplayName("Completed paid checkout yields an actionable COMPLETED result")
    void completedPaidSession() throws Exception {
        String payload = event("checkout.session.completed", "paid");

        WebhookResult result = gateway.handleWebhook(payload, sign(payload));

        assertTrue(result.isVerified());
        assertTrue(result.isActionable());
        assertEquals(CheckoutOutcome.COMPLETED, result.getOutcome());
        assertEquals("cs_test_1", result.getSessionId());
        assertEquals("pi_test_1", result.getProviderPaymentId());
    }

    @Test
    @DisplayName("Completed checkout still awaiting payment is ignored")
    void completedUnpaidIgnored() throws Exception {
        String payload = event("checkout.session.completed", "unpaid");

        WebhookResult result = gateway.handleWebhook(payload, sign(payload));

        assertTrue(result.isVerified());
        assertFalse(result.isActionable());
    }

    @Test
    @DisplayName("Expired checkout maps to FAILED")
    void expiredIsFailed() throws Exception {
        String payload = event("checkout.session.expired", "unpaid");

        WebhookResult result = gateway.handleWebhook(payload, sign(payload));

        assertEquals(CheckoutOutcome.FAILED, result.getOutcome());
    }

    @Test
    @DisplayName("Unrelated event types are verified but ignored")
    void unrelatedEventIgnored() throws Exception {
        String payload = event("customer.created", "paid");

        WebhookResult result = gateway.handleWebhook(payload, sign(payload));

        assertTrue(result.isVerified());
        assertEquals("customer.created", result.getEventType());
        assertFalse(result.isActionable());
    }

    @Test
    @DisplayName("Bad, missing or unconfigured signatures are unverified")
    void unverified() throws Exception {
        String payload = event("checkout.session.completed", "paid");

        assertFalse(gateway.handleWebhook(payload, "t=1,v1=deadbeef").isVerified());
        assertFalse(gateway.handleWebhook(payload, null).isVerified());

        properties.setWebhookSecret("");
        assertFalse(gateway.handleWebhook(payload, sign(payload)).isVerified());
    }

    @Test
    @DisplayName("Creating a checkout without an API key fails before any network call")
    void missingApiKey() {
        CheckoutRequest request = CheckoutRequest.builder()
                .paymentId(UUID.randomUUID())
                .consultationId(UUID.randomUUID())
                .amount(new BigDecimal("50.00"))
                .currency("USD")
                .description("GENERAL Consultation")
                .idempotencyKey(UUID.randomUUID().toString())
                .build();

        assertThrows(ProviderException.class, () -> gateway.createCheckoutSession(request));
    }

    @Test
    @DisplayName("A Stripe failure while expiring a session is raised as ProviderException")
    void expireFailurePropagates() {
        properties.setApiKey("sk_test_unreachable");
        Stripe.overrideApiBase("http://127.0.0.1:1");
        try {
            ProviderException e = assertThrows(ProviderException.class, () -> gateway.expireSession("cs_test_1"));
            assertEquals("STRIPE", e.getProvider());
            assertInstanceOf(StripeException.class, e.getCause());
        } finally {
            Stripe.overrideApiBase(Stripe.LIVE_API_BASE);
        }
    }

    private static String event(String type, String paymentStatus) {
        return """
                {
                  "id": "evt_test_1",
                  "object": "event",
                  "api_version": "%s",
                  "type": "%s",
                  "data": {
                    "object": {
                      "id": "cs_test_1",
                      "object": "checkout.session",
                      "payment_status": "%s",
                      "payment_intent": "pi_test_1"
                    }
                  }
                }
                """.formatted(Stripe.API_VERSION, type, paymentStatus);
    }

    private static String sign(String payload) throws Exception {
        long timestamp = System.currentTimeMillis() / 1000L;
        String signature = Webhook.Util.computeHmacSha256(SECRET, timestamp + "." + payload);
        return "t=" + timestamp + ",v1=" + signature;
    }
}
