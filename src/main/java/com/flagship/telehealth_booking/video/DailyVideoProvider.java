package com.flagship.telehealth_booking.video;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.telehealth_booking.common.exception.ProviderException;
import com.flagship.telehealth_booking.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Daily.co REST adapter.
 *
 * The HTTP client is created on first use and then shared: initialization is lazy,
 * idempotent and thread-safe, so the application starts without video credentials
 * and fails only when a room is actually needed.
 */
@Component
@Slf4j
public class DailyVideoProvider implements VideoProvider {

    static final String PROVIDER_ID = "DAILY";

    private final RestClient.Builder restClientBuilder;
    private final VideoProperties properties;

    private volatile RestClient restClient;

    public DailyVideoProvider(RestClient.Builder restClientBuilder, VideoProperties properties) {
        this.restClientBuilder = restClientBuilder;
        this.properties = properties;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public VideoRoom createRoom(String roomName, Instant expiresAt) {
        Map<String, Object> roomProperties = new LinkedHashMap<>();
        roomProperties.put("exp", expiresAt.getEpochSecond());
        roomProperties.put("enable_chat", true);
        roomProperties.put("enable_screenshare", true);
        roomProperties.put("enable_knocking", false);
        roomProperties.put("start_video_off", false);
        roomProperties.put("start_audio_off", false);
        roomProperties.put("eject_at_room_exp", true);
        roomProperties.put("max_participants", properties.getMaxParticipants());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", roomName);
        body.put("properties", roomProperties);

        try {
            JsonNode response = client().post()
                .uri("/rooms")
                .contentType(MediaType.APPLICATION_JSON)
                .header(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId())
                .body(body)
                .retrieve()
                .body(JsonNode.class);

            if (response == null || !response.hasNonNull("name") || !response.hasNonNull("url")) {
                throw new ProviderException(PROVIDER_ID, "Room response missing name or url");
            }
            log.info("Daily room created: roomName={}", roomName);
            return new VideoRoom(response.get("name").asText(), response.get("url").asText());

        } catch (RestClientException e) {
            throw new ProviderException(PROVIDER_ID, "Failed to create room " + roomName, e);
        }
    }

    @Override
    public void deleteRoom(String roomName) {
        try {
            client().delete()
                .uri("/rooms/{name}", roomName)
                .header(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId())
                .retrieve()
                .toBodilessEntity();
            log.info("Daily room deleted: roomName={}", roomName);

        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Daily room {} already gone", roomName);
        } catch (RestClientException e) {
            throw new ProviderException(PROVIDER_ID, "Failed to delete room " + roomName, e);
        }
    }

    @Override
    public MeetingToken createMeetingToken(String roomName, UUID userId, boolean owner, Instant expiresAt) {
        Map<String, Object> tokenProperties = new LinkedHashMap<>();
        tokenProperties.put("room_name", roomName);
        tokenProperties.put("user_id", userId.toString());
        tokenProperties.put("is_owner", owner);
        tokenProperties.put("exp", expiresAt.getEpochSecond());
        tokenProperties.put("enable_screenshare", true);
        tokenProperties.put("start_video_off", false);
        tokenProperties.put("start_audio_off", false);

        try {
            JsonNode response = client().post()
                .uri("/meeting-tokens")
                .contentType(MediaType.APPLICATION_JSON)
                .header(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId())
                .body(Map.of("properties", tokenProperties))
                .retrieve()
                .body(JsonNode.class);

            if (response == null || !response.hasNonNull("token")) {
                throw new ProviderException(PROVIDER_ID, "Meeting token response missing token");
            }
            return new MeetingToken(response.get("token").asText(), expiresAt);

        } catch (RestClientException e) {
            throw new ProviderException(PROVIDER_ID, "Failed to create meeting token for room " + roomName, e);
        }
    }

    private RestClient client() {
        RestClient client = restClient;
        if (client == null) {
            synchronized (this) {
                client = restClient;
                if (client == null) {
                    String apiKey = properties.getApiKey();
                    if (apiKey == null || apiKey.isBlank()) {
                        throw new ProviderException(PROVIDER_ID, "telehealth.video.api-key is not configured");
                    }
                    client = restClientBuilder
                        .baseUrl(properties.getBaseUrl())
                        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                        .build();
                    restClient = client;
                    log.info("Daily client initialized: baseUrl={}", properties.getBaseUrl());
                }
            }
        }
        return client;
    }
}
