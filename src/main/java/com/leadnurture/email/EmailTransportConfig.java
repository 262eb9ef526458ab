package com.leadnurture.email;

import com.leadnurture.config.NurtureProperties;
import com.resend.Resend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the transport from configuration:
 *   resend-api-key set      → ResendEmailTransport
 *   simulate: true          → ConsoleEmailTransport (enabled)
 *   neither                 → ConsoleEmailTransport (disabled, sweeps become no-ops)
 */
@Configuration
@Slf4j
public class EmailTransportConfig {

    @Bean
    public EmailTransport emailTransport(NurtureProperties properties) {
        NurtureProperties.Email email = properties.getEmail();
        if (email.getResendApiKey() != null && !email.getResendApiKey().isBlank()) {
            log.info("Email transport: Resend (from {})", email.getFrom());
            return new ResendEmailTransport(new Resend(email.getResendApiKey()), email.getFrom());
        }
        if (email.isSimulate()) {
            log.warn("Email transport: console simulation, no email will leave this process");
        } else {
            log.warn("Email transport not configured; nurture sends are disabled");
        }
        return new ConsoleEmailTransport(email.isSimulate());
    }
}
