package com.loanorigination.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final String KEY = "idempotency:StageDecisionSubmitted:evt-1";

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        idempotencyService = new IdempotencyService(redisTemplate,
                Clock.fixed(Instant.parse("2025-01-15T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("The first consumer claims the event with a 7 day TTL")
    void firstClaimWins() {
        // Given
        when(redisTemplate.hasKey(KEY)).thenReturn(false);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(KEY, "StageDecisionConsumer:1736935200000",
                IdempotencyService.IDEMPOTENCY_TTL)).thenReturn(true);

        // When / Then
        assertThat(idempotencyService.tryAcquire("StageDecisionSubmitted", "evt-1", "StageDecisionConsumer"))
                .isTrue();
    }

    @Test
    @DisplayName("An already claimed event is not claimed again")
    void duplicateSkipped() {
        when(redisTemplate.hasKey(KEY)).thenReturn(true);

        assertThat(idempotencyService.tryAcquire("StageDecisionSubmitted", "evt-1", "StageDecisionConsumer"))
                .isFalse();
        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    @DisplayName("Losing the SET NX race means the event belongs to another consumer")
    void lostRace() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), any(), any())).thenReturn(false);

        assertThat(idempotencyService.markAsProcessed("StageDecisionSubmitted", "evt-1", "StageDecisionConsumer"))
                .isFalse();
    }

    @Test
    @DisplayName("Redis outages fail open")
    void failsOpen() {
        when(redisTemplate.hasKey(KEY)).thenThrow(new RedisConnectionFailureException("down"));
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(anyString(), any(), any()))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThat(idempotencyService.isProcessed("StageDecisionSubmitted", "evt-1")).isFalse();
        assertThat(idempotencyService.tryAcquire("StageDecisionSubmitted", "evt-1", "StageDecisionConsumer"))
                .isTrue();
    }

    @Test
    @DisplayName("Releasing a claim deletes its key")
    void releaseDeletesKey() {
        idempotencyService.release("StageDecisionSubmitted", "evt-1");

        verify(redisTemplate).delete(KEY);
    }

    @Test
    @DisplayName("Processing info reports who claimed the event")
    void processingInfo() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(KEY)).thenReturn("StageDecisionConsumer:1736935200000");
        when(valueOperations.get("idempotency:StageDecisionSubmitted:evt-2")).thenReturn(null);

        assertThat(idempotencyService.getProcessingInfo("StageDecisionSubmitted", "evt-1"))
                .isEqualTo("StageDecisionConsumer:1736935200000");
        assertThat(idempotencyService.getProcessingInfo("StageDecisionSubmitted", "evt-2")).isNull();
    }
}
