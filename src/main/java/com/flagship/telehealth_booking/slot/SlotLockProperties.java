package com.flagship.telehealth_booking.slot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "telehealth.slot-lock")
public class SlotLockProperties {

    private boolean enabled = true;

    /** How long a doctor/time slot stays reserved while payment is in flight. */
    private Duration ttl = Duration.ofMinutes(15);
}
