package com.leadnurture.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A lead snapshot plus its interaction history, as handed to the engine.
 * The campaign type is classified once here so every caller sees the same answer.
 */
@Getter
public class LeadWithHistory {

    private final Lead lead;
    private final List<LeadInteraction> interactions;
    private final CampaignType campaignType;

    public LeadWithHistory(Lead lead, List<LeadInteraction> interactions) {
        this.lead = Objects.requireNonNull(lead, "lead");
        this.interactions = interactions == null ? List.of() : List.copyOf(interactions);
        this.campaignType = CampaignType.classify(lead);
    }

    /** Template ids already recorded as EMAIL_SENT for this lead. */
    public Set<String> sentTemplateIds() {
        return interactions.stream()
                .filter(i -> i.getType() == InteractionType.EMAIL_SENT)
                .map(LeadInteraction::getTemplateId)
                .filter(Objects::nonNull)
                .collect(Collectors.collectingAndThen(Collectors.toSet(), Collections::unmodifiableSet));
    }
}
