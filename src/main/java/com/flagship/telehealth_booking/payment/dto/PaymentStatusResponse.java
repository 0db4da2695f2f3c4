package com.flagship.telehealth_booking.payment.dto;

import lombok.Value;

@Value
public class PaymentStatusResponse {
    boolean paid;
}
