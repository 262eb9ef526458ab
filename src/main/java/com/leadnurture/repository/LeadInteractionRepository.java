package com.leadnurture.repository;

import com.leadnurture.model.InteractionType;
import com.leadnurture.model.LeadInteraction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface LeadInteractionRepository extends JpaRepository<LeadInteraction, UUID> {

    // Used by the sweep: one query for the history of every candidate lead
    List<LeadInteraction> findByLeadIdInOrderByCreatedAtAsc(Collection<UUID> leadIds);

    List<LeadInteraction> findByLeadIdOrderByCreatedAtAsc(UUID leadId);

    // Used by reports
    long countByTypeAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(
            InteractionType type, Instant from, Instant to);
}
