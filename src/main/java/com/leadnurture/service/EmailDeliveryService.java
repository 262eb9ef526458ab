package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.OutboundEmail;
import com.leadnurture.email.EmailTransport;
import com.leadnurture.exception.EmailDeliveryException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps the email transport with a hard per-call timeout.
 *
 * The transport call runs on a small worker pool and the caller waits at most
 * email.send-timeout. A timeout is reported as a retryable EmailDeliveryException;
 * the abandoned call is cancelled on a best-effort basis.
 */
@Service
@Slf4j
public class EmailDeliveryService {

    private final EmailTransport transport;
    private final Duration timeout;
    private final ExecutorService executor = Executors.newFixedThreadPool(2, r -> {
        Thread t = new Thread(r, "nurture-email");
        t.setDaemon(true);
        return t;
    });

    public EmailDeliveryService(EmailTransport transport, NurtureProperties properties) {
        this.transport = transport;
        this.timeout = properties.getEmail().getSendTimeout();
    }

    public boolean isEnabled() {
        return transport.isEnabled();
    }

    public String send(OutboundEmail email) throws EmailDeliveryException {
        CompletableFuture<String> call = CompletableFuture.supplyAsync(() -> {
            try {
                return transport.send(email);
            } catch (EmailDeliveryException e) {
                throw new CompletionException(e);
            }
        }, executor);

        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Email to {} timed out after {}", email.getTo(), timeout);
            throw new EmailDeliveryException("Email send timed out after " + timeout, e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EmailDeliveryException) {
                throw (EmailDeliveryException) cause;
            }
            throw new EmailDeliveryException("Email send failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmailDeliveryException("Interrupted while sending email", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
