package com.leadnurture.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A named, ordered sequence of outreach steps for one class of lead.
 * Steps are kept in catalog order; that order is the sequencer's tie-break.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
public class CampaignDefinition {

    private final CampaignType type;
    private final String name;
    private final String description;
    private final int scoreBoost;

    @Singular
    private final List<CampaignStep> steps;
}
