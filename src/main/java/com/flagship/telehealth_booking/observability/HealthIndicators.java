package com.flagship.telehealth_booking.observability;

import com.flagship.telehealth_booking.video.VideoProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the booking service.
 */
public class HealthIndicators {

    /**
     * Redis backs the advisory slot lock only, so an outage degrades the service
     * instead of taking it down.
     */
    @Component("slotLockHealth")
    public static class SlotLockHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public SlotLockHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", "Bookings proceed without the advisory slot lock")
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return Health.status("DEGRADED")
                            .withDetail("response", result != null ? result : "null")
                            .build();
                }

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Bookings proceed without the advisory slot lock")
                        .build();
            }
        }
    }

    /**
     * Reports whether the video provider is configured. No network call is made.
     */
    @Component("videoProviderHealth")
    public static class VideoProviderHealthIndicator implements HealthIndicator {

        private final VideoProperties videoProperties;

        public VideoProviderHealthIndicator(VideoProperties videoProperties) {
            this.videoProperties = videoProperties;
        }

        @Override
        public Health health() {
            if (videoProperties.getApiKey() == null || videoProperties.getApiKey().isBlank()) {
                return Health.down()
                        .withDetail("error", "Video provider API key is not configured")
                        .build();
            }
            return Health.up()
                    .withDetail("baseUrl", videoProperties.getBaseUrl())
                    .build();
        }
    }
}
