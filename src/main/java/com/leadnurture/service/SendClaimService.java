package com.leadnurture.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Cross-instance guard against sending the same campaign step twice.
 *
 * HOW IT WORKS:
 *   1. Before a send, claim(leadId, templateId) does
 *      SET nurture:send:{leadId}:{templateId} 1 NX EX 86400
 *   2. SET succeeds → this caller owns the send
 *   3. SET fails    → another sweep (thread or instance) already claimed it
 *
 * A failed send releases the claim so the retry can take it again.
 * A successful send keeps it until the TTL expires; by then the EMAIL_SENT
 * interaction is the durable record.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SendClaimService {

    private static final String CLAIM_PREFIX = "nurture:send:";
    private static final Duration CLAIM_TTL = Duration.ofHours(24);

    private final StringRedisTemplate redisTemplate;

    public boolean claim(UUID leadId, String templateId) {
        Boolean wasSet = redisTemplate.opsForValue()
                .setIfAbsent(key(leadId, templateId), "1", CLAIM_TTL);

        if (Boolean.TRUE.equals(wasSet)) {
            return true;
        }
        log.warn("Send already claimed: lead={}, template={}", leadId, templateId);
        return false;
    }

    public void release(UUID leadId, String templateId) {
        redisTemplate.delete(key(leadId, templateId));
        log.info("Released send claim: lead={}, template={}", leadId, templateId);
    }

    static String key(UUID leadId, String templateId) {
        return CLAIM_PREFIX + leadId + ":" + templateId;
    }
}
