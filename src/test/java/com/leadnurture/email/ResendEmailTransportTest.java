package com.leadnurture.email;

import com.leadnurture.dto.OutboundEmail;
import com.leadnurture.exception.EmailDeliveryException;
import com.resend.Resend;
import com.resend.core.exception.ResendException;
import com.resend.services.emails.Emails;
import com.resend.services.emails.model.CreateEmailOptions;
import com.resend.services.emails.model.CreateEmailResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResendEmailTransportTest {

    private static final String FROM = "Forward Horizon <no-reply@theforwardhorizon.com>";

    @Mock private Resend resend;
    @Mock private Emails emails;

    private ResendEmailTransport transport;
    private OutboundEmail email;

    @BeforeEach
    void setUp() {
        transport = new ResendEmailTransport(resend, FROM);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Campaign-ID", "veteran:veteran_welcome");
        headers.put("X-Lead-ID", "lead-1");
        email = OutboundEmail.builder()
                .to("sam@example.com")
                .subject("Welcome, Sam")
                .html("<p>Hi</p>")
                .text("Hi")
                .headers(headers)
                .trackingId("lead-1:veteran_welcome")
                .build();
        when(resend.emails()).thenReturn(emails);
    }

    @Test
    @DisplayName("Message fields and campaign headers are handed to Resend")
    void sendsHeaders() throws Exception {
        CreateEmailResponse response = new CreateEmailResponse();
        response.setId("re_123");
        when(emails.send(any(CreateEmailOptions.class))).thenReturn(response);

        assertEquals("re_123", transport.send(email));

        ArgumentCaptor<CreateEmailOptions> captor = ArgumentCaptor.forClass(CreateEmailOptions.class);
        verify(emails).send(captor.capture());
        CreateEmailOptions options = captor.getValue();
        assertEquals(FROM, options.getFrom());
        assertEquals(List.of("sam@example.com"), options.getTo());
        assertEquals("Welcome, Sam", options.getSubject());
        assertEquals("Hi", options.getText());
        assertEquals("veteran:veteran_welcome", options.getHeaders().get("X-Campaign-ID"));
        assertEquals("lead-1", options.getHeaders().get("X-Lead-ID"));
    }

    @Test
    @DisplayName("Provider rejection becomes a retryable delivery failure")
    void rejectionWrapped() throws Exception {
        when(emails.send(any(CreateEmailOptions.class))).thenThrow(new ResendException("rate limited"));

        EmailDeliveryException thrown = assertThrows(EmailDeliveryException.class, () -> transport.send(email));
        assertFalse(thrown.isTimeout());
        assertInstanceOf(ResendException.class, thrown.getCause());
    }
}
