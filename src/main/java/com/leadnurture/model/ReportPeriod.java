package com.leadnurture.model;

import java.time.Duration;
import java.util.Locale;

public enum ReportPeriod {
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7));

    private final Duration window;

    ReportPeriod(Duration window) {
        this.window = window;
    }

    public Duration getWindow() {
        return window;
    }

    public static ReportPeriod fromAction(Object action) {
        if (action == null) {
            return DAILY;
        }
        return valueOf(action.toString().trim().toUpperCase(Locale.ROOT));
    }
}
