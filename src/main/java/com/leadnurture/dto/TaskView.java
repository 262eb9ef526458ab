package com.leadnurture.dto;

import com.leadnurture.model.Priority;
import com.leadnurture.model.Task;
import com.leadnurture.model.TaskStatus;
import com.leadnurture.model.TaskType;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TaskView {
    private String id;
    private TaskType type;
    private TaskStatus status;
    private Priority priority;
    private int attempts;
    private int maxAttempts;
    private Instant createdAt;
    private Instant scheduledAt;
    private Instant completedAt;
    private Instant failedAt;
    private String lastError;

    public static TaskView from(Task task) {
        return TaskView.builder()
                .id(task.getId())
                .type(task.getType())
                .status(task.getStatus())
                .priority(task.getPriority())
                .attempts(task.getAttempts())
                .maxAttempts(task.getMaxAttempts())
                .createdAt(task.getCreatedAt())
                .scheduledAt(task.getScheduledAt())
                .completedAt(task.getCompletedAt())
                .failedAt(task.getFailedAt())
                .lastError(task.getLastError())
                .build();
    }
}
