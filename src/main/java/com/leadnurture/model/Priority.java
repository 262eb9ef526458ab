package com.leadnurture.model;

/**
 * Priority of a campaign step or a scheduled task.
 * Declaration order is the execution order: HIGH runs before MEDIUM before LOW.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW
}
