package com.leadnurture.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * One scheduled message within a campaign.
 *
 * A step becomes eligible dayOffset whole days after the lead was created and
 * is only sent while the sweep runs within hourWindow ± tolerance.
 * scoreBoost is null in the catalog file when the step inherits the
 * campaign-level boost; CampaignCatalog fills it in on load.
 */
@Getter
@ToString
@Builder(toBuilder = true)
@Jacksonized
public class CampaignStep {

    private final int dayOffset;
    private final int hourWindow;
    private final String templateId;
    private final String subject;
    private final String headline;
    private final String body;
    private final Priority priority;
    private final Integer scoreBoost;

    public int boost() {
        return scoreBoost == null ? 0 : scoreBoost;
    }
}
