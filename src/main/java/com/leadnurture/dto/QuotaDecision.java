package com.leadnurture.dto;

/**
 * Outcome of a quota admission check. Anything other than ADMITTED is a
 * normal "not this tick" answer, re-evaluated on the next sweep.
 */
public enum QuotaDecision {
    ADMITTED,
    DAILY_CAP_REACHED,
    HOURLY_CAP_REACHED,
    OUTSIDE_BUSINESS_HOURS,
    LOW_PRIORITY_CAPACITY_RESERVED;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
