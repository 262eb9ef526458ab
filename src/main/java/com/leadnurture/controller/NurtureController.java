package com.leadnurture.controller;

import com.leadnurture.dto.EngineStats;
import com.leadnurture.dto.ScoreResult;
import com.leadnurture.dto.TaskStats;
import com.leadnurture.dto.TaskView;
import com.leadnurture.model.TaskStatus;
import com.leadnurture.model.TaskType;
import com.leadnurture.service.NurtureEngine;
import com.leadnurture.service.TaskRunner;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Operational endpoints for the nurture engine.
 *
 * POST /api/nurture/sweep                      → run one campaign sweep now
 * GET  /api/nurture/stats                      → send counters, quota headroom, sessions
 * GET  /api/nurture/leads/{id}/score           → score breakdown for one lead
 * POST /api/nurture/leads/{id}/follow-up?delayMinutes=60
 * GET  /api/nurture/tasks?status=FAILED&type=EMAIL_DELIVERY&limit=50
 * GET  /api/nurture/tasks/stats
 */
@RestController
@RequestMapping("/api/nurture")
@RequiredArgsConstructor
public class NurtureController {

    private final NurtureEngine engine;
    private final TaskRunner taskRunner;
    private final Clock clock;

    @PostMapping("/sweep")
    public ResponseEntity<Map<String, Object>> sweep() {
        int sent = engine.processDueCampaigns(clock.instant());
        return ResponseEntity.ok(Map.of("status", "completed", "sent", sent));
    }

    @GetMapping("/stats")
    public ResponseEntity<EngineStats> stats() {
        return ResponseEntity.ok(engine.getStats());
    }

    @GetMapping("/leads/{id}/score")
    public ResponseEntity<ScoreResult> score(@PathVariable UUID id) {
        return ResponseEntity.ok(engine.scoreLead(id));
    }

    @PostMapping("/leads/{id}/follow-up")
    public ResponseEntity<Map<String, String>> followUp(@PathVariable UUID id,
                                                        @RequestParam(defaultValue = "0") long delayMinutes) {
        if (delayMinutes < 0) {
            throw new IllegalArgumentException("delayMinutes must not be negative");
        }
        String taskId = engine.scheduleFollowUp(id, Duration.ofMinutes(delayMinutes));
        return ResponseEntity.accepted().body(Map.of("status", "scheduled", "taskId", taskId));
    }

    @GetMapping("/tasks")
    public ResponseEntity<List<TaskView>> tasks(@RequestParam(required = false) TaskStatus status,
                                                @RequestParam(required = false) TaskType type,
                                                @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(taskRunner.getTasks(status, type, limit).stream()
                .map(TaskView::from)
                .collect(Collectors.toList()));
    }

    @GetMapping("/tasks/stats")
    public ResponseEntity<TaskStats> taskStats() {
        return ResponseEntity.ok(taskRunner.getStats());
    }
}
