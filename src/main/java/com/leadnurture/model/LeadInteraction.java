package com.leadnurture.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record of something that happened with a lead.
 *
 * EMAIL_SENT rows double as the de-duplication source for the sequencer:
 * templateId is stored in its own column so "already sent?" never needs
 * to parse the payload.
 *
 * payload is a JSON string, e.g.
 *   {"template": "veteran_welcome", "subject": "...", "day": 0, "messageId": "..."}
 */
@Entity
@Table(name = "lead_interactions", indexes = {
    @Index(name = "lead_interactions_lead_id_idx", columnList = "lead_id"),
    @Index(name = "lead_interactions_type_idx", columnList = "interaction_type, created_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class LeadInteraction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "lead_id", nullable = false)
    private UUID leadId;

    @Enumerated(EnumType.STRING)
    @Column(name = "interaction_type", nullable = false)
    private InteractionType type;

    @Column(name = "template_id")
    private String templateId;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
