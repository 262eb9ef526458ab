package com.leadnurture.email;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.OutboundEmail;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmailTransportConfigTest {

    private final EmailTransportConfig config = new EmailTransportConfig();

    @Test
    @DisplayName("API key selects the Resend transport")
    void resendWhenKeyPresent() {
        NurtureProperties properties = new NurtureProperties();
        properties.getEmail().setResendApiKey("re_test_key");

        EmailTransport transport = config.emailTransport(properties);

        assertInstanceOf(ResendEmailTransport.class, transport);
        assertTrue(transport.isEnabled());
    }

    @Test
    @DisplayName("Without a key or simulation the transport reports itself disabled")
    void disabledWithoutKey() {
        EmailTransport transport = config.emailTransport(new NurtureProperties());

        assertInstanceOf(ConsoleEmailTransport.class, transport);
        assertFalse(transport.isEnabled());
    }

    @Test
    @DisplayName("Simulation logs the email and returns a console message id")
    void simulation() throws Exception {
        NurtureProperties properties = new NurtureProperties();
        properties.getEmail().setSimulate(true);

        EmailTransport transport = config.emailTransport(properties);
        String messageId = transport.send(OutboundEmail.builder().to("sam@example.com").subject("Hi").build());

        assertTrue(transport.isEnabled());
        assertTrue(messageId.startsWith("console-"));
    }
}
