package com.loanorigination.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Redis-based deduplication of inbound events.
 *
 * KEY NAMING:
 * ===========
 * idempotency:{eventType}:{eventId}, e.g.
 * idempotency:StageDecisionSubmitted:3f2a...
 *
 * The value records which consumer took the event and when, for debugging
 * with redis-cli. Keys expire after 7 days, matching Kafka's default
 * retention.
 *
 * FAILOVER:
 * =========
 * If Redis is unreachable the event is treated as new (fail open). A
 * duplicate stage decision is then caught by the state machine itself,
 * which rejects a transition to the stage and status the application is
 * already in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    static final Duration IDEMPOTENCY_TTL = Duration.ofDays(7);
    static final String IDEMPOTENCY_PREFIX = "idempotency:";

    private final RedisTemplate<String, Object> redisTemplate;
    private final Clock clock;

    public boolean isProcessed(String eventType, String eventId) {
        String key = buildKey(eventType, eventId);

        try {
            boolean processed = Boolean.TRUE.equals(redisTemplate.hasKey(key));
            if (processed) {
                log.debug("Event already processed (idempotency check): {}:{}", eventType, eventId);
            }
            return processed;

        } catch (Exception e) {
            log.error("Redis error checking idempotency, treating as NOT processed: {}:{}",
                     eventType, eventId, e);
            return false;
        }
    }

    /**
     * Atomically claims the event (SET NX with TTL).
     *
     * @return true if this caller is the first to claim it
     */
    public boolean markAsProcessed(String eventType, String eventId, String consumerName) {
        String key = buildKey(eventType, eventId);

        try {
            String value = consumerName + ":" + clock.millis();
            Boolean success = redisTemplate.opsForValue().setIfAbsent(key, value, IDEMPOTENCY_TTL);

            if (Boolean.TRUE.equals(success)) {
                log.debug("Marked event as processed: {}:{} by {}", eventType, eventId, consumerName);
                return true;
            }
            log.warn("Event already processed by another consumer: {}:{}", eventType, eventId);
            return false;

        } catch (Exception e) {
            log.error("Redis error marking event as processed: {}:{}", eventType, eventId, e);
            return true;
        }
    }

    /**
     * Check-and-claim in one call. Consumers skip the event when this
     * returns false.
     */
    public boolean tryAcquire(String eventType, String eventId, String consumerName) {
        if (isProcessed(eventType, eventId)) {
            return false;
        }
        return markAsProcessed(eventType, eventId, consumerName);
    }

    /**
     * Drops a claim so a redelivery of the event is processed again. Called
     * when processing failed after {@link #tryAcquire} succeeded.
     */
    public void release(String eventType, String eventId) {
        String key = buildKey(eventType, eventId);
        try {
            redisTemplate.delete(key);
            log.debug("Released idempotency key {}", key);
        } catch (Exception e) {
            // The key expires on its own; a redelivery within the TTL is skipped as a duplicate
            log.error("Redis error releasing idempotency key {}", key, e);
        }
    }

    /**
     * @return "consumerName:epochMillis" of the claim, or null if not claimed
     */
    public String getProcessingInfo(String eventType, String eventId) {
        String key = buildKey(eventType, eventId);
        try {
            Object value = redisTemplate.opsForValue().get(key);
            return value != null ? value.toString() : null;
        } catch (Exception e) {
            log.error("Redis error getting processing info: {}:{}", eventType, eventId, e);
            return null;
        }
    }

    private String buildKey(String eventType, String eventId) {
        return IDEMPOTENCY_PREFIX + eventType + ":" + eventId;
    }
}
