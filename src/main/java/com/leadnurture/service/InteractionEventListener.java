package com.leadnurture.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadnurture.dto.InteractionEvent;
import com.leadnurture.dto.InteractionRecord;
import com.leadnurture.model.InteractionType;
import com.leadnurture.repository.LeadStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Kafka consumer for engagement events (opens, clicks, replies, forms, bounces).
 *
 * FLOW:
 *   tracking endpoint / form handler → topic "nurture.interactions"
 *                                          ↓
 *                              InteractionEventListener
 *                                          ↓
 *                       LeadStore.insertInteraction(leadId, record)
 *
 * The appended rows feed the scorer's engagement and behavioral buckets on the
 * next sweep. Unparseable messages and outreach types (email_sent, sms_sent,
 * chat_promoted) go to the dead-letter topic; events for unknown leads are
 * dropped with a warning.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InteractionEventListener {

    private final LeadStore leadStore;
    private final ObjectMapper objectMapper;
    private final DeadLetterPublisher deadLetterPublisher;
    private final Clock clock;

    @KafkaListener(topics = "${nurture.topics.interactions:nurture.interactions}", groupId = "nurture-engine")
    public void onEvent(String message) {
        InteractionEvent event;
        try {
            event = objectMapper.readValue(message, InteractionEvent.class);
        } catch (Exception e) {
            log.error("Failed to parse interaction event: {}", e.getMessage());
            deadLetterPublisher.publishRaw(message, e.getMessage());
            return;
        }
        if (event.getLeadId() == null || event.getType() == null) {
            deadLetterPublisher.publishRaw(message, "Interaction event requires leadId and type");
            return;
        }
        if (!isEngagement(event.getType())) {
            // Sends and chat promotions are written by the engine itself
            log.warn("Rejecting {} event for lead {}: not an engagement event",
                    event.getType().wireName(), event.getLeadId());
            deadLetterPublisher.publishRaw(message,
                    "Interaction type " + event.getType().wireName() + " is not accepted from the event feed");
            return;
        }

        InteractionRecord record = InteractionRecord.builder()
                .type(event.getType())
                .templateId(event.getTemplateId())
                .payload(event.getPayload())
                .occurredAt(event.getOccurredAt() != null ? event.getOccurredAt() : clock.instant())
                .build();
        try {
            leadStore.insertInteraction(event.getLeadId(), record);
            log.info("Recorded {} for lead {}", event.getType().wireName(), event.getLeadId());
        } catch (EntityNotFoundException e) {
            log.warn("Dropping {} event for unknown lead {}", event.getType().wireName(), event.getLeadId());
        }
    }

    static boolean isEngagement(InteractionType type) {
        return !type.isOutreach() && type != InteractionType.CHAT_PROMOTED;
    }
}
