package com.leadnurture.repository;

import com.leadnurture.dto.InteractionRecord;
import com.leadnurture.dto.LeadSummary;
import com.leadnurture.model.InteractionType;
import com.leadnurture.model.LeadStatus;
import com.leadnurture.model.LeadWithHistory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence collaborator of the nurture engine. The engine only reads leads,
 * appends interactions and requests status changes; it never owns the records.
 */
public interface LeadStore {

    List<LeadWithHistory> listLeadsWithInteractions(Collection<LeadStatus> statusIn, boolean excludeOptedOut);

    Optional<LeadWithHistory> findLeadWithInteractions(UUID leadId);

    /** Appends to the lead's history; fails with EntityNotFoundException for an unknown lead. */
    void insertInteraction(UUID leadId, InteractionRecord record);

    void updateLeadStatus(UUID leadId, LeadStatus status);

    UUID insertLead(LeadSummary summary);

    long countInteractions(InteractionType type, Instant from, Instant to);
}
