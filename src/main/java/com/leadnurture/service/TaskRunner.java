package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.TaskStats;
import com.leadnurture.model.Priority;
import com.leadnurture.model.Task;
import com.leadnurture.model.TaskStatus;
import com.leadnurture.model.TaskType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory task queue with fixed-delay retries and cron-style recurring triggers.
 *
 * FLOW (every heartbeat):
 *   tick()
 *     ├─ fire every recurring trigger whose next fire time has passed
 *     │    → schedule(type, {action})
 *     └─ runDueTasks()
 *          select PENDING tasks with scheduledAt <= now
 *          order by priority, then createdAt
 *          execute one at a time:
 *            handler ok     → COMPLETED
 *            handler throws → attempts < maxAttempts ? PENDING at now + backoff : FAILED
 *
 * Retry delay is a fixed per-type value, not exponential. A FAILED task is
 * logged and published to the dead-letter topic; nothing is ever thrown out
 * of the driver loop.
 *
 * Time only comes from the injected Clock, including cron evaluation, so tests
 * advance virtual time and call tick() instead of waiting on real timers.
 */
@Component
@Slf4j
public class TaskRunner {

    private static final Comparator<Task> EXECUTION_ORDER = Comparator
            .comparing(Task::getPriority)
            .thenComparing(Task::getCreatedAt)
            .thenComparingLong(Task::getSequence);

    private final NurtureProperties.Tasks config;
    private final DeadLetterPublisher deadLetterPublisher;
    private final Clock clock;

    // Guards the task map and counters; held only for short bookkeeping
    private final Object state = new Object();
    // Held for a whole drain pass, so no two tasks ever execute concurrently
    private final ReentrantLock runLock = new ReentrantLock();

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final List<RecurringTrigger> triggers = new ArrayList<>();

    private long sequence;
    private long totalTasks;
    private long completedTasks;
    private long failedTasks;
    private Instant lastExecution;

    public TaskRunner(NurtureProperties properties, DeadLetterPublisher deadLetterPublisher, Clock clock) {
        this.config = properties.getTasks();
        this.deadLetterPublisher = deadLetterPublisher;
        this.clock = clock;

        ZonedDateTime now = ZonedDateTime.now(clock);
        for (NurtureProperties.RecurringTask recurring : config.getRecurring()) {
            CronExpression cron = CronExpression.parse(recurring.getCron());
            triggers.add(new RecurringTrigger(recurring, cron, cron.next(now)));
            log.info("Scheduled recurring task: {} ({} → {})",
                    recurring.getName(), recurring.getCron(), recurring.getType());
        }
    }

    public void register(TaskType type, TaskHandler handler) {
        synchronized (state) {
            handlers.put(type, handler);
        }
    }

    // --- Scheduling ---

    public String schedule(TaskType type, Map<String, Object> payload) {
        return schedule(type, payload, null, null);
    }

    public String schedule(TaskType type, Map<String, Object> payload, Instant at) {
        return schedule(type, payload, at, null);
    }

    /**
     * Enqueues a task. With a non-null key, an existing PENDING task carrying the
     * same key is returned instead of creating a duplicate.
     */
    public String schedule(TaskType type, Map<String, Object> payload, Instant at, String key) {
        Instant now = clock.instant();
        NurtureProperties.TaskTypeSettings settings = config.settingsFor(type);

        synchronized (state) {
            if (key != null) {
                Optional<Task> existing = findPendingByKey(key);
                if (existing.isPresent()) {
                    log.debug("Task with key {} already pending: {}", key, existing.get().getId());
                    return existing.get().getId();
                }
            }

            Task task = Task.builder()
                    .id("task_" + UUID.randomUUID())
                    .type(type)
                    .payload(payload != null ? new HashMap<>(payload) : new HashMap<>())
                    .key(key)
                    .priority(settings.getPriority())
                    .createdAt(now)
                    .scheduledAt(at != null ? at : now)
                    .sequence(sequence++)
                    .maxAttempts(Math.max(1, settings.getMaxAttempts()))
                    .backoffDelay(settings.getBackoff())
                    .status(TaskStatus.PENDING)
                    .build();

            tasks.put(task.getId(), task);
            totalTasks++;
            log.info("Scheduled {} task: {} (at {})", type, task.getId(), task.getScheduledAt());
            return task.getId();
        }
    }

    public boolean hasPending(String key) {
        synchronized (state) {
            return findPendingByKey(key).isPresent();
        }
    }

    // --- Driver loop ---

    @Scheduled(fixedDelayString = "${nurture.tasks.heartbeat-ms:5000}")
    public void tick() {
        fireRecurringTriggers();
        runDueTasks();
    }

    void fireRecurringTriggers() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        for (RecurringTrigger trigger : triggers) {
            if (trigger.nextFireAt != null && !trigger.nextFireAt.isAfter(now)) {
                // Missed periods collapse into one firing
                trigger.nextFireAt = trigger.cron.next(now);
                schedule(trigger.definition.getType(),
                        Map.of("action", trigger.definition.getAction(), "trigger", trigger.definition.getName()));
            }
        }
    }

    /**
     * Executes every due task, one at a time, until none is due. Returns the
     * number of executions. A concurrent call returns 0 immediately; the pass
     * already in progress picks up whatever became due.
     */
    public int runDueTasks() {
        if (!runLock.tryLock()) {
            return 0;
        }
        try {
            int executed = 0;
            List<Task> due;
            while (!(due = selectDue(clock.instant())).isEmpty()) {
                for (Task task : due) {
                    if (execute(task)) {
                        executed++;
                    }
                }
            }
            return executed;
        } finally {
            runLock.unlock();
        }
    }

    private List<Task> selectDue(Instant now) {
        synchronized (state) {
            return tasks.values().stream()
                    .filter(t -> t.isDue(now))
                    .sorted(EXECUTION_ORDER)
                    .collect(Collectors.toList());
        }
    }

    private boolean execute(Task task) {
        TaskHandler handler;
        synchronized (state) {
            if (task.getStatus() != TaskStatus.PENDING) {
                return false;
            }
            task.setStatus(TaskStatus.RUNNING);
            task.setStartedAt(clock.instant());
            task.setAttempts(task.getAttempts() + 1);
            handler = handlers.get(task.getType());
        }

        log.info("Executing {} task: {} (attempt {}/{})",
                task.getType(), task.getId(), task.getAttempts(), task.getMaxAttempts());
        try {
            if (handler == null) {
                throw new IllegalStateException("No handler registered for task type " + task.getType());
            }
            Object result = handler.handle(task);
            synchronized (state) {
                task.setStatus(TaskStatus.COMPLETED);
                task.setCompletedAt(clock.instant());
                task.setResult(result);
                completedTasks++;
                lastExecution = task.getCompletedAt();
            }
            log.info("Completed {} task: {}", task.getType(), task.getId());
        } catch (Exception e) {
            onFailure(task, e);
        }
        return true;
    }

    private void onFailure(Task task, Exception e) {
        Instant now = clock.instant();
        boolean terminal;
        synchronized (state) {
            task.setLastError(e.getMessage());
            lastExecution = now;
            terminal = task.getAttempts() >= task.getMaxAttempts();
            if (terminal) {
                task.setStatus(TaskStatus.FAILED);
                task.setFailedAt(now);
                failedTasks++;
            } else {
                task.setStatus(TaskStatus.PENDING);
                task.setScheduledAt(now.plus(task.getBackoffDelay()));
            }
        }

        if (terminal) {
            log.error("CRITICAL: {} task {} failed after {} attempts: {}",
                    task.getType(), task.getId(), task.getAttempts(), e.getMessage(), e);
            deadLetterPublisher.publishFailedTask(task);
        } else {
            log.warn("Retrying {} task {} at {} (attempt {}/{}): {}",
                    task.getType(), task.getId(), task.getScheduledAt(),
                    task.getAttempts(), task.getMaxAttempts(), e.getMessage());
        }
    }

    // --- Housekeeping & queries ---

    /** Drops COMPLETED tasks beyond the most recent {@code retain}; returns how many were removed. */
    public int trimCompleted(int retain) {
        synchronized (state) {
            List<String> stale = tasks.values().stream()
                    .filter(t -> t.getStatus() == TaskStatus.COMPLETED)
                    .sorted(Comparator.comparing(Task::getCompletedAt).reversed())
                    .skip(Math.max(0, retain))
                    .map(Task::getId)
                    .collect(Collectors.toList());
            stale.forEach(tasks::remove);
            if (!stale.isEmpty()) {
                log.info("Cleaned up {} old completed tasks", stale.size());
            }
            return stale.size();
        }
    }

    public int trimCompleted() {
        return trimCompleted(config.getRetention());
    }

    public Optional<Task> getTask(String id) {
        synchronized (state) {
            return Optional.ofNullable(tasks.get(id));
        }
    }

    public List<Task> getTasks(TaskStatus status, TaskType type, int limit) {
        synchronized (state) {
            return tasks.values().stream()
                    .filter(t -> status == null || t.getStatus() == status)
                    .filter(t -> type == null || t.getType() == type)
                    .sorted(Comparator.comparing(Task::getCreatedAt)
                            .thenComparingLong(Task::getSequence).reversed())
                    .limit(Math.max(0, limit))
                    .collect(Collectors.toList());
        }
    }

    public TaskStats getStats() {
        synchronized (state) {
            long pending = tasks.values().stream().filter(t -> t.getStatus() == TaskStatus.PENDING).count();
            return TaskStats.builder()
                    .totalTasks(totalTasks)
                    .completedTasks(completedTasks)
                    .failedTasks(failedTasks)
                    .pendingTasks(pending)
                    .lastExecution(lastExecution)
                    .recurringTriggers(triggers.size())
                    .build();
        }
    }

    private Optional<Task> findPendingByKey(String key) {
        return tasks.values().stream()
                .filter(t -> key.equals(t.getKey()))
                .filter(t -> t.getStatus() == TaskStatus.PENDING || t.getStatus() == TaskStatus.RUNNING)
                .findFirst();
    }

    private static final class RecurringTrigger {
        private final NurtureProperties.RecurringTask definition;
        private final CronExpression cron;
        private ZonedDateTime nextFireAt;

        private RecurringTrigger(NurtureProperties.RecurringTask definition, CronExpression cron,
                                 ZonedDateTime nextFireAt) {
            this.definition = definition;
            this.cron = cron;
            this.nextFireAt = nextFireAt;
        }
    }
}
