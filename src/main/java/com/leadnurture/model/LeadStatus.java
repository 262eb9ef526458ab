package com.leadnurture.model;

/**
 * Lifecycle of a lead as seen by the nurture engine.
 * Only NEW, CONTACTED and NURTURING leads are swept by default.
 */
public enum LeadStatus {
    NEW,
    CONTACTED,
    NURTURING,
    CONVERTED,
    LOST
}
