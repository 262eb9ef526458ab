package com.leadnurture.config;

import com.leadnurture.model.LeadStatus;
import com.leadnurture.model.Priority;
import com.leadnurture.model.TaskType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes all nurture engine configuration.
 *
 * Bound from application.yml under "nurture" prefix:
 *   nurture:
 *     zone: America/Los_Angeles
 *     quota:
 *       max-daily: 50
 *       max-hourly: 10
 *     campaign:
 *       hour-tolerance: 2
 *       send-pause: 2s
 *     tasks:
 *       retention: 100
 *       types:
 *         email-delivery: { priority: HIGH, max-attempts: 3, backoff: 30m }
 *
 * Defaults below mirror the values the service has always run with, so an
 * empty config block still produces a working engine.
 */
@Component
@ConfigurationProperties(prefix = "nurture")
@Getter
@Setter
public class NurtureProperties {

    private ZoneId zone = ZoneId.of("America/Los_Angeles");

    private Quota quota = new Quota();
    private Campaign campaign = new Campaign();
    private Email email = new Email();
    private Chat chat = new Chat();
    private Tasks tasks = new Tasks();
    private Topics topics = new Topics();
    private Business business = new Business();

    @Getter
    @Setter
    public static class Quota {
        private int maxDaily = 50;
        private int maxHourly = 10;
        private int businessHourStart = 9;
        // Inclusive: a medium-priority step may still go out at 17:59
        private int businessHourEnd = 17;
        private double lowPriorityShare = 0.5;
    }

    @Getter
    @Setter
    public static class Campaign {
        private String catalog = "campaigns.json";
        private int hourTolerance = 2;
        private Duration sendPause = Duration.ofSeconds(2);
        private Set<LeadStatus> eligibleStatuses =
                EnumSet.of(LeadStatus.NEW, LeadStatus.CONTACTED, LeadStatus.NURTURING);
    }

    @Getter
    @Setter
    public static class Email {
        private String from = "Forward Horizon <no-reply@theforwardhorizon.com>";
        private String resendApiKey;
        private boolean simulate = false;
        private Duration sendTimeout = Duration.ofSeconds(30);
        private String trackingBaseUrl = "https://theforwardhorizon.com";
    }

    @Getter
    @Setter
    public static class Chat {
        private Duration sessionTimeout = Duration.ofMinutes(30);
        private int maxMessageLength = 1000;
        private int promotionMinTurns = 3;
        private List<String> leadKeywords = new ArrayList<>(List.of(
                "schedule", "appointment", "consultation", "interested",
                "need help", "housing", "tour", "visit", "apply",
                "application", "qualify", "contact", "callback"));
    }

    @Getter
    @Setter
    public static class Tasks {
        private int retention = 100;
        // Read by TaskRunner's @Scheduled heartbeat
        private long heartbeatMs = 5000;
        private Map<TaskType, TaskTypeSettings> types = defaultTypes();
        private List<RecurringTask> recurring = new ArrayList<>(List.of(
                new RecurringTask("lead-processing", "0 */10 * * * *", TaskType.LEAD_PROCESSING, "process_due_campaigns"),
                new RecurringTask("session-sweep", "0 */5 * * * *", TaskType.SESSION_SWEEP, "sweep_expired_sessions"),
                new RecurringTask("daily-report", "0 0 18 * * *", TaskType.REPORT_GENERATION, "daily"),
                new RecurringTask("weekly-report", "0 0 9 * * MON", TaskType.REPORT_GENERATION, "weekly"),
                new RecurringTask("data-cleanup", "0 0 2 * * *", TaskType.DATA_CLEANUP, "trim_completed_tasks")));

        public TaskTypeSettings settingsFor(TaskType type) {
            TaskTypeSettings settings = types.get(type);
            return settings != null ? settings : defaultTypes().get(type);
        }

        private static Map<TaskType, TaskTypeSettings> defaultTypes() {
            Map<TaskType, TaskTypeSettings> defaults = new EnumMap<>(TaskType.class);
            defaults.put(TaskType.LEAD_PROCESSING,
                    new TaskTypeSettings(Priority.HIGH, 3, Duration.ofMinutes(15)));
            defaults.put(TaskType.EMAIL_DELIVERY,
                    new TaskTypeSettings(Priority.HIGH, 3, Duration.ofMinutes(30)));
            defaults.put(TaskType.EMAIL_FOLLOW_UP,
                    new TaskTypeSettings(Priority.HIGH, 3, Duration.ofMinutes(30)));
            defaults.put(TaskType.SESSION_SWEEP,
                    new TaskTypeSettings(Priority.LOW, 1, Duration.ofMinutes(5)));
            defaults.put(TaskType.REPORT_GENERATION,
                    new TaskTypeSettings(Priority.LOW, 1, Duration.ofHours(4)));
            defaults.put(TaskType.DATA_CLEANUP,
                    new TaskTypeSettings(Priority.LOW, 1, Duration.ofHours(24)));
            return defaults;
        }
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TaskTypeSettings {
        private Priority priority = Priority.MEDIUM;
        private int maxAttempts = 2;
        private Duration backoff = Duration.ofMinutes(1);
    }

    /**
     * A cron-driven trigger. Cron has six fields (seconds first) and is
     * evaluated in the engine zone against the injected clock.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecurringTask {
        private String name;
        private String cron;
        private TaskType type;
        private String action;
    }

    @Getter
    @Setter
    public static class Topics {
        private String interactions = "nurture.interactions";
        private String deadLetter = "nurture.dead-letter";
        private String reports = "nurture.reports";
    }

    @Getter
    @Setter
    public static class Business {
        private String name = "Forward Horizon";
        private String phone = "(310) 488-5280";
        private String email = "theforwardhorizon@gmail.com";
        private String website = "https://theforwardhorizon.com";
    }
}
