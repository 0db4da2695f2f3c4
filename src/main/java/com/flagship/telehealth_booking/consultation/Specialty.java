package com.flagship.telehealth_booking.consultation;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Medical specialties with their consultation fee in USD.
 */
@Getter
public enum Specialty {
    GENERAL(new BigDecimal("50.00")),
    CARDIOLOGY(new BigDecimal("150.00")),
    DERMATOLOGY(new BigDecimal("85.00")),
    PEDIATRICS(new BigDecimal("65.00")),
    PSYCHIATRY(new BigDecimal("120.00")),
    ORTHOPEDICS(new BigDecimal("110.00"));

    private final BigDecimal fee;

    Specialty(BigDecimal fee) {
        this.fee = fee;
    }
}
