package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.model.CampaignStep;
import com.leadnurture.model.LeadWithHistory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which campaign step, if any, is due for a lead right now.
 *
 * Walks the lead's campaign in catalog order. A step is due when
 *   1. daysSinceCreation >= step.dayOffset
 *   2. no EMAIL_SENT interaction already references step.templateId
 *   3. |hour(now) - step.hourWindow| <= tolerance
 * The first step passing all three wins; earlier steps therefore beat later
 * ones when both are eligible. An empty result is the normal outcome on most
 * ticks, not an error.
 *
 * Hours are taken in the engine's configured zone, not the lead's.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Sequencer {

    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    private final CampaignCatalog catalog;
    private final NurtureProperties properties;
    private final Clock clock;

    public Optional<CampaignStep> next(LeadWithHistory lead, Instant now) {
        long daysSinceCreation = daysSinceCreation(lead.getLead().getCreatedAt(), now);
        int currentHour = now.atZone(clock.getZone()).getHour();
        int tolerance = properties.getCampaign().getHourTolerance();
        Set<String> alreadySent = lead.sentTemplateIds();

        for (CampaignStep step : catalog.steps(lead.getCampaignType())) {
            if (daysSinceCreation < step.getDayOffset()) {
                continue;
            }
            if (alreadySent.contains(step.getTemplateId())) {
                continue;
            }
            if (Math.abs(currentHour - step.getHourWindow()) <= tolerance) {
                return Optional.of(step);
            }
            log.debug("Step {} eligible for lead {} but outside hour window (now={}, target={})",
                    step.getTemplateId(), lead.getLead().getId(), currentHour, step.getHourWindow());
        }
        return Optional.empty();
    }

    /** Whole days elapsed since creation, floored; negative if created in the future. */
    static long daysSinceCreation(Instant createdAt, Instant now) {
        return Math.floorDiv(Duration.between(createdAt, now).toMillis(), DAY_MILLIS);
    }
}
