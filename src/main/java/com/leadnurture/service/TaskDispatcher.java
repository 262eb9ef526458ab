package com.leadnurture.service;

import com.leadnurture.model.ReportPeriod;
import com.leadnurture.model.Task;
import com.leadnurture.model.TaskType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Routes each task type to the component that does the work.
 *
 *   LEAD_PROCESSING   → NurtureEngine.processDueCampaigns(now)
 *   EMAIL_DELIVERY    → NurtureEngine.retryDelivery(payload)
 *   EMAIL_FOLLOW_UP   → NurtureEngine.followUp(payload)
 *   SESSION_SWEEP     → SessionManager.sweepExpired(now)
 *   REPORT_GENERATION → ReportService.generate(daily | weekly)
 *   DATA_CLEANUP      → TaskRunner.trimCompleted()
 *
 * Registered with the TaskRunner at startup rather than injected into it, which
 * keeps the runner free of any dependency on the engine that schedules into it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskDispatcher {

    private final TaskRunner taskRunner;
    private final NurtureEngine engine;
    private final SessionManager sessionManager;
    private final ReportService reportService;
    private final Clock clock;

    @PostConstruct
    public void registerHandlers() {
        for (TaskType type : TaskType.values()) {
            taskRunner.register(type, this::dispatch);
        }
        log.info("Registered task handlers for {} task types", TaskType.values().length);
    }

    public Object dispatch(Task task) throws Exception {
        return switch (task.getType()) {
            case LEAD_PROCESSING -> engine.processDueCampaigns(clock.instant());
            case EMAIL_DELIVERY -> engine.retryDelivery(task.getPayload());
            case EMAIL_FOLLOW_UP -> engine.followUp(task.getPayload());
            case SESSION_SWEEP -> sessionManager.sweepExpired(clock.instant());
            case REPORT_GENERATION -> reportService.generate(ReportPeriod.fromAction(task.getPayload().get("action")));
            case DATA_CLEANUP -> taskRunner.trimCompleted();
        };
    }
}
