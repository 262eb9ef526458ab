package com.leadnurture.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of lead interactions. Serialized in lower snake case
 * ("email_sent", "form_completed") to match the engagement event feed.
 */
public enum InteractionType {
    EMAIL_SENT,
    EMAIL_OPENED,
    EMAIL_CLICKED,
    EMAIL_REPLIED,
    EMAIL_BOUNCED,
    FORM_COMPLETED,
    PHONE_CONTACT,
    PHONE_INVALID,
    APPOINTMENT_SCHEDULED,
    DOCUMENT_SUBMITTED,
    SMS_SENT,
    CHAT_PROMOTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InteractionType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("interaction type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // Phone calls are logged under two names by the voice integration
        if ("PHONE_CALL".equals(normalized)) {
            return PHONE_CONTACT;
        }
        return InteractionType.valueOf(normalized);
    }

    public boolean isOutreach() {
        return this == EMAIL_SENT || this == SMS_SENT;
    }

    public boolean isResponse() {
        return this == EMAIL_OPENED || this == EMAIL_CLICKED || this == FORM_COMPLETED
                || this == EMAIL_REPLIED;
    }
}
