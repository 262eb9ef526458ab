package com.leadnurture.dto;

import com.leadnurture.model.InteractionType;
import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * What the engine asks the store to append to a lead's history.
 * templateId is only set for EMAIL_SENT records.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class InteractionRecord {
    private InteractionType type;
    private String templateId;
    private Map<String, Object> payload;
    private Instant occurredAt;
}
