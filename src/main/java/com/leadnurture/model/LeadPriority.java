package com.leadnurture.model;

/**
 * Handling priority derived from a lead's score.
 * URGENT leads bypass the soft quota rules.
 */
public enum LeadPriority {
    URGENT,
    HIGH,
    MEDIUM,
    LOW;

    public boolean isAtLeast(LeadPriority other) {
        return ordinal() <= other.ordinal();
    }
}
