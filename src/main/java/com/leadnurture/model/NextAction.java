package com.leadnurture.model;

/**
 * Recommended next step for a lead, looked up from (grade, priority).
 */
public enum NextAction {
    CALL_NOW("Call lead immediately"),
    SCHEDULE_TOUR("Schedule property tour"),
    BOOK_CONSULTATION("Send calendar link for consultation"),
    FOLLOW_UP("Send follow-up email"),
    CONTINUE_NURTURE("Continue automated nurture sequence"),
    LONG_TERM_NURTURE("Add to long-term nurture campaign");

    private final String description;

    NextAction(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
