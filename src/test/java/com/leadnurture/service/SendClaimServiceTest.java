package com.leadnurture.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SendClaimServiceTest {

    private static final UUID LEAD_ID = UUID.fromString("7c9e6679-7425-40de-944b-e07fc1f90ae7");

    @Mock private StringRedisTemplate redisTemplate;
    @Mock private ValueOperations<String, String> valueOps;

    @InjectMocks
    private SendClaimService claims;

    @Test
    @DisplayName("First claim on a (lead, template) pair succeeds")
    void firstClaimWins() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq("nurture:send:" + LEAD_ID + ":veteran_welcome"), eq("1"), eq(Duration.ofHours(24))))
                .thenReturn(true);

        assertTrue(claims.claim(LEAD_ID, "veteran_welcome"));
    }

    @Test
    @DisplayName("Second claim on the same pair is refused")
    void secondClaimLoses() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), eq("1"), any(Duration.class))).thenReturn(false);

        assertFalse(claims.claim(LEAD_ID, "veteran_welcome"));
    }

    @Test
    @DisplayName("Null reply from Redis (pipeline/transaction) counts as not claimed")
    void nullReplyNotClaimed() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(null);

        assertFalse(claims.claim(LEAD_ID, "veteran_welcome"));
    }

    @Test
    @DisplayName("Release deletes the claim key")
    void releaseDeletesKey() {
        claims.release(LEAD_ID, "veteran_benefits");

        verify(redisTemplate).delete("nurture:send:" + LEAD_ID + ":veteran_benefits");
    }
}
