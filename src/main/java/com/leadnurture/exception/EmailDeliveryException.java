package com.leadnurture.exception;

/**
 * The email transport did not confirm a send. Covers transport errors and the
 * per-call timeout alike; both are retryable.
 */
public class EmailDeliveryException extends Exception {

    private final boolean timeout;

    public EmailDeliveryException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public EmailDeliveryException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
