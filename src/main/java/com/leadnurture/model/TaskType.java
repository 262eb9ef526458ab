package com.leadnurture.model;

/**
 * Work the scheduler knows how to execute.
 * Retry policy per type lives in NurtureProperties.Tasks.
 */
public enum TaskType {
    LEAD_PROCESSING,
    EMAIL_DELIVERY,
    EMAIL_FOLLOW_UP,
    SESSION_SWEEP,
    REPORT_GENERATION,
    DATA_CLEANUP
}
