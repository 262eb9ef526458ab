package com.leadnurture.email;

import com.leadnurture.dto.OutboundEmail;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Logs instead of sending. Used when no provider key is configured; it only
 * reports itself enabled in simulation mode, so an unconfigured deployment
 * never pretends to have delivered anything.
 */
@RequiredArgsConstructor
@Slf4j
public class ConsoleEmailTransport implements EmailTransport {

    private final boolean simulate;

    @Override
    public String send(OutboundEmail email) {
        String messageId = "console-" + UUID.randomUUID();
        log.info("""
                ========================================
                [SIMULATED] Nurture email
                To: {}
                Subject: {}
                Headers: {}
                Message id: {}
                ========================================""",
                email.getTo(), email.getSubject(), email.getHeaders(), messageId);
        return messageId;
    }

    @Override
    public boolean isEnabled() {
        return simulate;
    }
}
