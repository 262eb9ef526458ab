package com.leadnurture.model;

import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Scheduler-internal unit of work. Lives only in TaskRunner's memory;
 * nothing here survives a restart.
 *
 * key is an optional de-duplication key: scheduling a second task with the
 * same key while the first is still pending returns the first one.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Task {

    private String id;
    private TaskType type;

    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    private String key;
    private Priority priority;

    private Instant createdAt;
    private Instant scheduledAt;

    // Monotonic enqueue order, breaks createdAt ties
    private long sequence;

    private int attempts;
    private int maxAttempts;
    private Duration backoffDelay;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private String lastError;
    private Object result;
    private Instant startedAt;
    private Instant completedAt;
    private Instant failedAt;

    public boolean isDue(Instant now) {
        return status == TaskStatus.PENDING && !scheduledAt.isAfter(now);
    }
}
