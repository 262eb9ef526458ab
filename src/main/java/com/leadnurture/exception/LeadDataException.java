package com.leadnurture.exception;

import java.util.UUID;

/**
 * A lead record the engine cannot act on (missing email, unknown campaign step).
 * Thrown per lead; the sweep logs it and moves on to the next lead.
 */
public class LeadDataException extends RuntimeException {

    private final UUID leadId;

    public LeadDataException(UUID leadId, String message) {
        super(message);
        this.leadId = leadId;
    }

    public UUID getLeadId() {
        return leadId;
    }
}
