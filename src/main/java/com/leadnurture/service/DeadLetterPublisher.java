package com.leadnurture.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadnurture.config.NurtureProperties;
import com.leadnurture.model.Task;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Dead-letter topic for work the engine gave up on.
 *
 * Two kinds of envelope go to nurture.dead-letter:
 *   - a task that exhausted its attempts: type, payload, attempts, last error
 *   - an inbound interaction event that could not be parsed: the raw message and the error
 *
 * Nothing here is replayed automatically; the topic exists for investigation.
 * Publication failures are logged and swallowed so they never break the caller's loop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final NurtureProperties properties;
    private final Clock clock;

    public void publishFailedTask(Task task) {
        try {
            Map<String, Object> envelope = new HashMap<>();
            envelope.put("kind", "task");
            envelope.put("taskId", task.getId());
            envelope.put("type", task.getType());
            envelope.put("payload", task.getPayload());
            envelope.put("attempts", task.getAttempts());
            envelope.put("error", task.getLastError());
            envelope.put("timestamp", clock.millis());

            String message = objectMapper.writeValueAsString(envelope);
            kafkaTemplate.send(properties.getTopics().getDeadLetter(), task.getId(), message);
            log.info("Task sent to dead-letter topic: taskId={}, type={}, attempts={}",
                    task.getId(), task.getType(), task.getAttempts());
        } catch (Exception e) {
            log.error("CRITICAL: Failed to dead-letter task {}: {}", task.getId(), e.getMessage(), e);
        }
    }

    public void publishRaw(String rawMessage, String errorMessage) {
        try {
            Map<String, Object> envelope = new HashMap<>();
            envelope.put("kind", "event");
            envelope.put("rawMessage", rawMessage);
            envelope.put("error", errorMessage);
            envelope.put("timestamp", clock.millis());

            String message = objectMapper.writeValueAsString(envelope);
            kafkaTemplate.send(properties.getTopics().getDeadLetter(), message);
            log.info("Unparseable interaction event sent to dead-letter topic: error={}", errorMessage);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to dead-letter raw event: {}", e.getMessage(), e);
        }
    }
}
