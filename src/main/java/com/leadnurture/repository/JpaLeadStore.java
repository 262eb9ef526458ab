package com.leadnurture.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadnurture.dto.InteractionRecord;
import com.leadnurture.dto.LeadSummary;
import com.leadnurture.model.InteractionType;
import com.leadnurture.model.Lead;
import com.leadnurture.model.LeadInteraction;
import com.leadnurture.model.LeadStatus;
import com.leadnurture.model.LeadWithHistory;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * LeadStore backed by the leads / lead_interactions tables.
 *
 * Histories are fetched in one IN query per sweep and grouped in memory,
 * so a sweep over N leads costs two round trips rather than N + 1.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaLeadStore implements LeadStore {

    private final LeadRepository leadRepository;
    private final LeadInteractionRepository interactionRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public List<LeadWithHistory> listLeadsWithInteractions(Collection<LeadStatus> statusIn,
                                                           boolean excludeOptedOut) {
        List<Lead> leads = excludeOptedOut
                ? leadRepository.findByStatusInAndOptedOutFalse(statusIn)
                : leadRepository.findByStatusIn(statusIn);
        if (leads.isEmpty()) {
            return List.of();
        }

        List<UUID> ids = leads.stream().map(Lead::getId).collect(Collectors.toList());
        Map<UUID, List<LeadInteraction>> byLead = interactionRepository
                .findByLeadIdInOrderByCreatedAtAsc(ids).stream()
                .collect(Collectors.groupingBy(LeadInteraction::getLeadId));

        return leads.stream()
                .map(lead -> new LeadWithHistory(lead, byLead.getOrDefault(lead.getId(), List.of())))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LeadWithHistory> findLeadWithInteractions(UUID leadId) {
        return leadRepository.findById(leadId)
                .map(lead -> new LeadWithHistory(lead,
                        interactionRepository.findByLeadIdOrderByCreatedAtAsc(leadId)));
    }

    @Override
    @Transactional
    public void insertInteraction(UUID leadId, InteractionRecord record) {
        if (!leadRepository.existsById(leadId)) {
            throw new EntityNotFoundException("Lead not found: " + leadId);
        }
        LeadInteraction interaction = LeadInteraction.builder()
                .leadId(leadId)
                .type(record.getType())
                .templateId(record.getTemplateId())
                .payload(toJson(record.getPayload()))
                .createdAt(record.getOccurredAt() != null ? record.getOccurredAt() : clock.instant())
                .build();
        interactionRepository.save(interaction);
        log.debug("Recorded {} for lead {}", record.getType(), leadId);
    }

    @Override
    @Transactional
    public void updateLeadStatus(UUID leadId, LeadStatus status) {
        Lead lead = leadRepository.findById(leadId)
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));
        lead.setStatus(status);
        lead.setLastContactAt(clock.instant());
        leadRepository.save(lead);
    }

    @Override
    @Transactional
    public UUID insertLead(LeadSummary summary) {
        Lead lead = Lead.builder()
                .name(summary.getName())
                .email(summary.getEmail())
                .phone(summary.getPhone())
                .source(summary.getSource())
                .notes(summary.getNotes())
                .chatSessionId(summary.getChatSessionId())
                .tags(summary.getTags() != null ? new HashSet<>(summary.getTags()) : new HashSet<>())
                .status(LeadStatus.NEW)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        return leadRepository.save(lead).getId();
    }

    @Override
    @Transactional(readOnly = true)
    public long countInteractions(InteractionType type, Instant from, Instant to) {
        return interactionRepository.countByTypeAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(type, from, to);
    }

    private String toJson(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Interaction payload is not serializable", e);
        }
    }
}
