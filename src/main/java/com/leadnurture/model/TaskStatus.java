package com.leadnurture.model;

/**
 * PENDING → RUNNING → COMPLETED | PENDING (retry) | FAILED.
 * COMPLETED and FAILED are terminal.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
