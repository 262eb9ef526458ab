package com.leadnurture.dto;

import com.leadnurture.model.InteractionType;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Engagement event published by the tracking endpoints, form handlers and
 * phone/SMS integrations onto the interactions topic.
 *
 * Example:
 * {
 *   "leadId": "5b0c...",
 *   "type": "email_opened",
 *   "templateId": "veteran_welcome",
 *   "occurredAt": "2024-05-01T16:04:00Z",
 *   "payload": { "userAgent": "..." }
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class InteractionEvent {
    private UUID leadId;
    private InteractionType type;
    private String templateId;
    private Instant occurredAt;
    private Map<String, Object> payload;
}
