package com.flagship.telehealth_booking.slot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Advisory lock on a (doctor, scheduled start) slot, held in Redis.
 *
 * The lock narrows double-booking races; it does not prevent them. The
 * authoritative guard is the partial unique index on consultations. Every Redis
 * failure degrades to {@link LockOutcome#UNAVAILABLE} and the caller proceeds.
 */
@Service
@Slf4j
public class SlotLockService {

    private static final String KEY_PREFIX = "slotlock:";

    public enum LockOutcome {
        ACQUIRED,
        HELD_ELSEWHERE,
        UNAVAILABLE
    }

    private final Optional<StringRedisTemplate> redisTemplate;
    private final SlotLockProperties properties;

    public SlotLockService(Optional<StringRedisTemplate> redisTemplate, SlotLockProperties properties) {
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    static String keyFor(UUID doctorId, Instant scheduledStartAt) {
        return KEY_PREFIX + doctorId + ":" + scheduledStartAt.toEpochMilli();
    }

    /**
     * Reserves the slot for {@code consultationId}. Re-acquiring a slot the same
     * consultation already holds counts as ACQUIRED and refreshes the TTL.
     */
    public LockOutcome acquire(UUID doctorId, Instant scheduledStartAt, UUID consultationId) {
        if (!properties.isEnabled() || redisTemplate.isEmpty()) {
            return LockOutcome.UNAVAILABLE;
        }

        String key = keyFor(doctorId, scheduledStartAt);
        String owner = consultationId.toString();
        try {
            var ops = redisTemplate.get().opsForValue();
            Boolean acquired = ops.setIfAbsent(key, owner, properties.getTtl());
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Slot lock acquired: key={}", key);
                return LockOutcome.ACQUIRED;
            }

            String holder = ops.get(key);
            if (owner.equals(holder)) {
                redisTemplate.get().expire(key, properties.getTtl());
                return LockOutcome.ACQUIRED;
            }
            if (holder == null) {
                // Expired between the two calls; one more attempt.
                return Boolean.TRUE.equals(ops.setIfAbsent(key, owner, properties.getTtl()))
                        ? LockOutcome.ACQUIRED
                        : LockOutcome.HELD_ELSEWHERE;
            }

            log.info("Slot lock held by another consultation: key={}, holder={}", key, holder);
            return LockOutcome.HELD_ELSEWHERE;

        } catch (Exception e) {
            log.warn("Slot lock unavailable for key {}, proceeding without it: {}", key, e.getMessage());
            return LockOutcome.UNAVAILABLE;
        }
    }

    /**
     * Best-effort release. Only removes the lock if {@code consultationId} holds it.
     */
    public void release(UUID doctorId, Instant scheduledStartAt, UUID consultationId) {
        if (!properties.isEnabled() || redisTemplate.isEmpty()) {
            return;
        }

        String key = keyFor(doctorId, scheduledStartAt);
        try {
            String holder = redisTemplate.get().opsForValue().get(key);
            if (consultationId.toString().equals(holder)) {
                redisTemplate.get().delete(key);
                log.debug("Slot lock released: key={}", key);
            }
        } catch (Exception e) {
            log.warn("Failed to release slot lock {}: {}", key, e.getMessage());
        }
    }
}
