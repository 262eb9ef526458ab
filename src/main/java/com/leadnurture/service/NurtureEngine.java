package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.EngineStats;
import com.leadnurture.dto.InteractionRecord;
import com.leadnurture.dto.OutboundEmail;
import com.leadnurture.dto.QuotaDecision;
import com.leadnurture.dto.QuotaSnapshot;
import com.leadnurture.dto.ScoreResult;
import com.leadnurture.exception.EmailDeliveryException;
import com.leadnurture.exception.LeadDataException;
import com.leadnurture.model.CampaignStep;
import com.leadnurture.model.InteractionType;
import com.leadnurture.model.Lead;
import com.leadnurture.model.LeadInteraction;
import com.leadnurture.model.LeadStatus;
import com.leadnurture.model.LeadWithHistory;
import com.leadnurture.model.TaskType;
import com.leadnurture.repository.LeadStore;
import jakarta.persistence.EntityNotFoundException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * The campaign sweep: the heart of the nurture engine.
 *
 * PROCESSING PIPELINE (processDueCampaigns):
 *
 *   Eligible leads (status new/contacted/nurturing, not opted out)
 *     │
 *     ├─ 1. SCORE & RANK   → score + campaign boost, highest first
 *     │
 *     └─ for each lead, one at a time:
 *          ├─ 2. SEQUENCE   → Sequencer.next(): is a step due right now?
 *          ├─ 3. VALIDATE   → email present, no retry already pending for this step
 *          ├─ 4. QUOTA      → QuotaManager.evaluate(step priority, lead priority)
 *          ├─ 5. CLAIM      → Redis SET NX so no other sweep sends the same step
 *          ├─ 6. SEND       → EmailDeliveryService (per-call timeout)
 *          ├─ 7. RECORD     → EMAIL_SENT interaction, quota.recordSend(), status update
 *          └─ pause between sends
 *
 * A failed send releases the claim, counts as a failure and becomes an
 * EMAIL_DELIVERY task retried by the TaskRunner. A bad lead is skipped with a
 * warning; nothing one lead does can abort the rest of the sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NurtureEngine {

    static final String DELIVERY_KEY_PREFIX = "delivery:";
    static final String FOLLOW_UP_KEY_PREFIX = "follow-up:";

    private final LeadStore leadStore;
    private final LeadScorer scorer;
    private final Sequencer sequencer;
    private final CampaignCatalog catalog;
    private final QuotaManager quota;
    private final EmailTemplateRenderer renderer;
    private final EmailDeliveryService delivery;
    private final SendClaimService claims;
    private final TaskRunner taskRunner;
    private final SessionManager sessionManager;
    private final NurtureProperties properties;
    private final Clock clock;

    private final ReentrantLock sweepLock = new ReentrantLock();

    /**
     * Runs one full sweep. Returns the number of emails sent.
     */
    public int processDueCampaigns(Instant now) {
        if (!delivery.isEnabled()) {
            log.warn("Email transport not configured; skipping campaign sweep");
            return 0;
        }
        if (!sweepLock.tryLock()) {
            log.info("Campaign sweep already in progress; skipping");
            return 0;
        }
        try {
            List<LeadWithHistory> leads = leadStore.listLeadsWithInteractions(
                    properties.getCampaign().getEligibleStatuses(), true);
            List<RankedLead> ranked = rank(leads, now);
            log.info("Campaign sweep: {} eligible leads", ranked.size());

            int sent = 0;
            for (RankedLead candidate : ranked) {
                UUID leadId = candidate.getHistory().getLead().getId();
                try {
                    if (processLead(candidate.getHistory(), candidate.getScore(), now)) {
                        sent++;
                        pauseBetweenSends();
                    }
                } catch (LeadDataException e) {
                    log.warn("Skipping lead {}: {}", leadId, e.getMessage());
                } catch (RuntimeException e) {
                    log.warn("Skipping lead {} after unexpected error: {}", leadId, e.getMessage(), e);
                }
            }

            log.info("Campaign sweep complete: {} emails sent", sent);
            return sent;
        } finally {
            sweepLock.unlock();
        }
    }

    public ScoreResult score(Lead lead, List<LeadInteraction> interactions, Instant now) {
        return scorer.score(lead, interactions, now);
    }

    public ScoreResult scoreLead(UUID leadId) {
        LeadWithHistory history = leadStore.findLeadWithInteractions(leadId)
                .orElseThrow(() -> new EntityNotFoundException("Lead not found: " + leadId));
        return scorer.score(history.getLead(), history.getInteractions(), clock.instant());
    }

    public EngineStats getStats() {
        QuotaSnapshot snapshot = quota.snapshot();
        return EngineStats.builder()
                .sent(snapshot.getSent())
                .failed(snapshot.getFailed())
                .dailySent(snapshot.getDailySent())
                .dailyLimit(snapshot.getDailyLimit())
                .remainingToday(snapshot.getRemainingToday())
                .hourlySent(snapshot.getHourlySent())
                .remainingThisHour(snapshot.getRemainingThisHour())
                .activeSessions(sessionManager.activeCount())
                .emailEnabled(delivery.isEnabled())
                .pendingTasks(taskRunner.getStats().getPendingTasks())
                .build();
    }

    /** Queues a one-off re-run of the sequencer for a single lead. */
    public String scheduleFollowUp(UUID leadId, Duration delay) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("leadId", leadId.toString());
        return taskRunner.schedule(TaskType.EMAIL_FOLLOW_UP, payload,
                clock.instant().plus(delay), FOLLOW_UP_KEY_PREFIX + leadId);
    }

    // --- Task handlers ---

    /**
     * EMAIL_FOLLOW_UP handler: runs the per-lead pipeline for one lead.
     */
    public String followUp(Map<String, Object> payload) {
        UUID leadId = leadIdFrom(payload);
        Optional<LeadWithHistory> found = leadStore.findLeadWithInteractions(leadId);
        if (found.isEmpty()) {
            log.warn("Follow-up for unknown lead {}; dropping", leadId);
            return "lead_missing";
        }
        if (!delivery.isEnabled()) {
            return "transport_disabled";
        }
        LeadWithHistory history = found.get();
        if (!isEligible(history.getLead())) {
            return "not_eligible";
        }
        Instant now = clock.instant();
        ScoreResult score = scorer.score(history.getLead(), history.getInteractions(), now);
        return processLead(history, score, now) ? "sent" : "nothing_sent";
    }

    /**
     * EMAIL_DELIVERY handler: retries one specific (lead, template) send.
     * Throws on delivery failure so the TaskRunner applies its backoff.
     * The hour window is not re-checked; the step was due when it first failed.
     */
    public String retryDelivery(Map<String, Object> payload) throws EmailDeliveryException {
        UUID leadId = leadIdFrom(payload);
        String templateId = (String) payload.get("templateId");

        Optional<LeadWithHistory> found = leadStore.findLeadWithInteractions(leadId);
        if (found.isEmpty()) {
            log.warn("Delivery retry for unknown lead {}; dropping", leadId);
            return "lead_missing";
        }
        LeadWithHistory history = found.get();
        if (history.sentTemplateIds().contains(templateId)) {
            return "already_sent";
        }
        if (!isEligible(history.getLead())) {
            return "not_eligible";
        }
        Optional<CampaignStep> step = catalog.findStep(history.getCampaignType(), templateId);
        if (step.isEmpty()) {
            log.warn("Delivery retry for unknown template {} (lead {}); dropping", templateId, leadId);
            return "unknown_template";
        }

        Instant now = clock.instant();
        ScoreResult score = scorer.score(history.getLead(), history.getInteractions(), now);
        QuotaDecision decision = quota.evaluate(step.get().getPriority(), score.getPriority());
        if (!decision.isAdmitted()) {
            // The next sweep re-offers the step if it is still in its window
            log.info("Delivery retry for lead {} deferred: {}", leadId, decision);
            return "deferred";
        }
        requireEmail(history.getLead());
        return deliver(history, step.get(), now) ? "sent" : "claimed_elsewhere";
    }

    // --- Per-lead pipeline ---

    boolean processLead(LeadWithHistory history, ScoreResult score, Instant now) {
        Lead lead = history.getLead();
        Optional<CampaignStep> due = sequencer.next(history, now);
        if (due.isEmpty()) {
            log.debug("Nothing due for lead {}", lead.getId());
            return false;
        }
        CampaignStep step = due.get();
        requireEmail(lead);

        String key = deliveryKey(lead.getId(), step.getTemplateId());
        if (taskRunner.hasPending(key)) {
            log.debug("Retry already pending for lead {} step {}", lead.getId(), step.getTemplateId());
            return false;
        }

        QuotaDecision decision = quota.evaluate(step.getPriority(), score.getPriority());
        if (!decision.isAdmitted()) {
            log.debug("Step {} for lead {} not admitted: {}", step.getTemplateId(), lead.getId(), decision);
            return false;
        }

        try {
            return deliver(history, step, now);
        } catch (EmailDeliveryException e) {
            log.warn("Email to lead {} ({}) failed, scheduling retry: {}",
                    lead.getId(), step.getTemplateId(), e.getMessage());
            scheduleDeliveryRetry(lead.getId(), step.getTemplateId());
            return false;
        }
    }

    private boolean deliver(LeadWithHistory history, CampaignStep step, Instant now) throws EmailDeliveryException {
        Lead lead = history.getLead();
        // Rendered before claiming so a template error cannot strand the claim
        OutboundEmail email = renderer.render(lead, history.getCampaignType(), step);
        if (!claims.claim(lead.getId(), step.getTemplateId())) {
            return false;
        }

        String messageId;
        try {
            messageId = delivery.send(email);
        } catch (EmailDeliveryException e) {
            claims.release(lead.getId(), step.getTemplateId());
            quota.recordFailure();
            throw e;
        } catch (RuntimeException e) {
            claims.release(lead.getId(), step.getTemplateId());
            throw e;
        }

        leadStore.insertInteraction(lead.getId(), sentRecord(step, messageId, now));
        quota.recordSend();
        updateStatusAfterSend(lead, step);
        log.info("Sent {} step {} to lead {} (messageId={})",
                history.getCampaignType().tag(), step.getTemplateId(), lead.getId(), messageId);
        return true;
    }

    private void scheduleDeliveryRetry(UUID leadId, String templateId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("leadId", leadId.toString());
        payload.put("templateId", templateId);
        NurtureProperties.TaskTypeSettings settings =
                properties.getTasks().settingsFor(TaskType.EMAIL_DELIVERY);
        taskRunner.schedule(TaskType.EMAIL_DELIVERY, payload,
                clock.instant().plus(settings.getBackoff()), deliveryKey(leadId, templateId));
    }

    private void updateStatusAfterSend(Lead lead, CampaignStep step) {
        LeadStatus next = lead.getStatus();
        if (step.getDayOffset() == 0) {
            next = LeadStatus.CONTACTED;
        } else if (step.getDayOffset() >= 7) {
            next = LeadStatus.NURTURING;
        }
        if (next != lead.getStatus()) {
            leadStore.updateLeadStatus(lead.getId(), next);
            lead.setStatus(next);
        }
    }

    private static InteractionRecord sentRecord(CampaignStep step, String messageId, Instant now) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("template", step.getTemplateId());
        payload.put("subject", step.getSubject());
        payload.put("priority", step.getPriority().name().toLowerCase());
        payload.put("day", step.getDayOffset());
        payload.put("messageId", messageId);
        payload.put("sentAt", now.toString());
        return InteractionRecord.builder()
                .type(InteractionType.EMAIL_SENT)
                .templateId(step.getTemplateId())
                .payload(payload)
                .occurredAt(now)
                .build();
    }

    private List<RankedLead> rank(List<LeadWithHistory> leads, Instant now) {
        return leads.stream()
                .map(h -> {
                    ScoreResult score = scorer.score(h.getLead(), h.getInteractions(), now);
                    int boost = catalog.get(h.getCampaignType()).getScoreBoost();
                    return new RankedLead(h, score, score.getScore() + boost);
                })
                .sorted(Comparator.comparingInt(RankedLead::getRank).reversed())
                .collect(Collectors.toList());
    }

    private boolean isEligible(Lead lead) {
        return !lead.isOptedOut() && properties.getCampaign().getEligibleStatuses().contains(lead.getStatus());
    }

    private static void requireEmail(Lead lead) {
        if (lead.getEmail() == null || lead.getEmail().isBlank()) {
            throw new LeadDataException(lead.getId(), "lead has no email address");
        }
    }

    private void pauseBetweenSends() {
        Duration pause = properties.getCampaign().getSendPause();
        if (pause.isZero() || pause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static String deliveryKey(UUID leadId, String templateId) {
        return DELIVERY_KEY_PREFIX + leadId + ":" + templateId;
    }

    private static UUID leadIdFrom(Map<String, Object> payload) {
        Object raw = payload.get("leadId");
        if (raw == null) {
            throw new IllegalArgumentException("Task payload has no leadId");
        }
        return UUID.fromString(raw.toString());
    }

    @Getter
    @RequiredArgsConstructor
    private static class RankedLead {
        private final LeadWithHistory history;
        private final ScoreResult score;
        private final int rank;
    }
}
