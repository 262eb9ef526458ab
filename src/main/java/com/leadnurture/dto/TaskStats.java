package com.leadnurture.dto;

import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TaskStats {
    private long totalTasks;
    private long completedTasks;
    private long failedTasks;
    private long pendingTasks;
    private Instant lastExecution;
    private int recurringTriggers;
}
