package com.flagship.telehealth_booking.common.exception;

import lombok.Getter;

/**
 * A call to an external provider (video rooms, checkout) failed.
 * Reported to clients as INTERNAL_ERROR; the provider message stays in the logs.
 */
@Getter
public class ProviderException extends TelehealthException {

    private final String provider;

    public ProviderException(String provider, String message) {
        this(provider, message, null);
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, provider + ": " + message, null, cause);
        this.provider = provider;
    }
}
