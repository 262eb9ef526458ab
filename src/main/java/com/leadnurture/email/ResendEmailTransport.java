package com.leadnurture.email;

import com.leadnurture.dto.OutboundEmail;
import com.leadnurture.exception.EmailDeliveryException;
import com.resend.Resend;
import com.resend.core.exception.ResendException;
import com.resend.services.emails.model.CreateEmailOptions;
import com.resend.services.emails.model.CreateEmailResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RequiredArgsConstructor
@Slf4j
public class ResendEmailTransport implements EmailTransport {

    private final Resend resend;
    private final String from;

    @Override
    public String send(OutboundEmail email) throws EmailDeliveryException {
        CreateEmailOptions options = CreateEmailOptions.builder()
                .from(from)
                .to(email.getTo())
                .subject(email.getSubject())
                .html(email.getHtml())
                .text(email.getText())
                .headers(email.getHeaders())
                .build();

        try {
            CreateEmailResponse response = resend.emails().send(options);
            log.info("Email sent to {} via Resend: id={}", email.getTo(), response.getId());
            return response.getId();
        } catch (ResendException e) {
            log.error("Failed to send email to {}: {}", email.getTo(), e.getMessage());
            throw new EmailDeliveryException("Resend rejected email to " + email.getTo(), e);
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
