package com.flagship.telehealth_booking.video;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "telehealth.video")
public class VideoProperties {

    private String apiKey;

    private String baseUrl = "https://api.daily.co/v1";

    /** Rooms eject everyone and close this long after creation. */
    private Duration roomTtl = Duration.ofMinutes(30);

    /** Meeting tokens expire this long after minting; they are never refreshed. */
    private Duration tokenTtl = Duration.ofMinutes(30);

    private int maxParticipants = 2;
}
