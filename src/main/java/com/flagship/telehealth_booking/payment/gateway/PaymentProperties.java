package com.flagship.telehealth_booking.payment.gateway;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "telehealth.payment")
public class PaymentProperties {

    private String apiKey;

    private String webhookSecret;

    /** Checkout redirects here on success; {@code {consultationId}} is substituted. */
    private String successUrl = "http://localhost:3000/checkout/success?id={consultationId}";

    private String cancelUrl = "http://localhost:3000/consultations/{consultationId}";

    private String currency = "USD";
}
