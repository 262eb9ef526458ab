package com.leadnurture.service;

import com.leadnurture.dto.ScoreBreakdown;
import com.leadnurture.dto.ScoreResult;
import com.leadnurture.model.EmploymentStatus;
import com.leadnurture.model.Grade;
import com.leadnurture.model.InteractionType;
import com.leadnurture.model.Lead;
import com.leadnurture.model.LeadInteraction;
import com.leadnurture.model.LeadPriority;
import com.leadnurture.model.NextAction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Scores a lead from its attributes and interaction history.
 *
 * SCORE = demographic + urgency + engagement + qualification + behavioral + penalties,
 * clamped to 0..100.
 *
 *   demographic   → veteran 25, recovery 20, reentry 18, family 15, employed 10
 *   urgency       → homeless 30, eviction risk 25, move-in within 30/60/90 days 20/15/10
 *   engagement    → opens, clicks, calls, appointments, documents; each weighted by
 *                   how recent it is, bucket capped at 50
 *   qualification → income verified, references, background-check consent
 *   behavioral    → form completions, replies, speed of first response
 *   penalties     → silence, bounces, invalid phone, opt-out
 *
 * Pure: the only notion of time is the "now" passed in. The injected clock is
 * consulted for its zone alone (to turn "now" into a calendar date).
 */
@Component
@RequiredArgsConstructor
public class LeadScorer {

    static final int VETERAN = 25;
    static final int IN_RECOVERY = 20;
    static final int REENTRY = 18;
    static final int HAS_FAMILY = 15;
    static final int EMPLOYED = 10;

    static final int CURRENTLY_HOMELESS = 30;
    static final int EVICTION_RISK = 25;
    static final int MOVE_IN_30_DAYS = 20;
    static final int MOVE_IN_60_DAYS = 15;
    static final int MOVE_IN_90_DAYS = 10;

    static final int OPEN_POINTS = 5;
    static final int CLICK_POINTS = 10;
    static final int CALL_POINTS = 15;
    static final int APPOINTMENT_POINTS = 25;
    static final int DOCUMENT_POINTS = 20;
    static final int ENGAGEMENT_CAP = 50;

    static final int INCOME_VERIFIED = 15;
    static final int REFERENCES_PROVIDED = 10;
    static final int BACKGROUND_CHECK_CONSENT = 10;

    static final int FORM_POINTS = 20;
    static final int REPLY_POINTS = 15;

    static final int NO_RESPONSE_7_DAYS = -10;
    static final int NO_RESPONSE_14_DAYS = -20;
    static final int BOUNCE_PENALTY = -15;
    static final int INVALID_PHONE_PENALTY = -10;
    static final int OPTED_OUT = -100;

    private final Clock clock;

    public ScoreResult score(Lead lead, List<LeadInteraction> interactions, Instant now) {
        List<LeadInteraction> history = interactions == null ? List.of() : interactions;

        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .demographic(demographic(lead))
                .urgency(urgency(lead, now))
                .engagement(engagement(history, now))
                .qualification(qualification(lead))
                .behavioral(behavioral(history))
                .penalties(penalties(lead, history, now))
                .build();

        int score = Math.max(0, Math.min(100, breakdown.total()));
        Grade grade = Grade.fromScore(score);
        LeadPriority priority = priority(score, lead);

        return ScoreResult.builder()
                .score(score)
                .grade(grade)
                .priority(priority)
                .nextAction(nextAction(grade, priority))
                .breakdown(breakdown)
                .recommendations(recommendations(grade, lead))
                .build();
    }

    int demographic(Lead lead) {
        int points = 0;
        if (lead.isVeteran()) points += VETERAN;
        if (lead.isInRecovery()) points += IN_RECOVERY;
        if (lead.isReentry()) points += REENTRY;
        if (lead.isHasFamily() || (lead.getHouseholdSize() != null && lead.getHouseholdSize() > 1)) {
            points += HAS_FAMILY;
        }
        if (lead.getEmploymentStatus() == EmploymentStatus.EMPLOYED) points += EMPLOYED;
        return points;
    }

    int urgency(Lead lead, Instant now) {
        int points = 0;
        if (lead.isCurrentlyHomeless()) points += CURRENTLY_HOMELESS;
        if (lead.isEvictionRisk()) points += EVICTION_RISK;

        if (lead.getMoveInDate() != null) {
            LocalDate today = LocalDate.ofInstant(now, clock.getZone());
            long daysUntilMove = ChronoUnit.DAYS.between(today, lead.getMoveInDate());
            if (daysUntilMove <= 30) {
                points += MOVE_IN_30_DAYS;
            } else if (daysUntilMove <= 60) {
                points += MOVE_IN_60_DAYS;
            } else if (daysUntilMove <= 90) {
                points += MOVE_IN_90_DAYS;
            }
        }
        return points;
    }

    int engagement(List<LeadInteraction> history, Instant now) {
        double points = 0;
        for (LeadInteraction interaction : history) {
            int weight = switch (interaction.getType()) {
                case EMAIL_OPENED -> OPEN_POINTS;
                case EMAIL_CLICKED -> CLICK_POINTS;
                case PHONE_CONTACT -> CALL_POINTS;
                case APPOINTMENT_SCHEDULED -> APPOINTMENT_POINTS;
                case DOCUMENT_SUBMITTED -> DOCUMENT_POINTS;
                default -> 0;
            };
            if (weight > 0) {
                points += weight * recencyFactor(interaction.getCreatedAt(), now);
            }
        }
        return (int) Math.min(Math.round(points), ENGAGEMENT_CAP);
    }

    /**
     * Credit multiplier by age: last 2h full credit, last day 75%, last week half,
     * anything older a quarter.
     */
    static double recencyFactor(Instant occurredAt, Instant now) {
        Duration age = Duration.between(occurredAt, now);
        if (age.compareTo(Duration.ofHours(2)) <= 0) return 1.0;
        if (age.compareTo(Duration.ofHours(24)) <= 0) return 0.75;
        if (age.compareTo(Duration.ofDays(7)) <= 0) return 0.5;
        return 0.25;
    }

    int qualification(Lead lead) {
        int points = 0;
        if (lead.isIncomeVerified()) points += INCOME_VERIFIED;
        if (lead.isReferencesProvided()) points += REFERENCES_PROVIDED;
        if (lead.isBackgroundCheckConsent()) points += BACKGROUND_CHECK_CONSENT;
        return points;
    }

    int behavioral(List<LeadInteraction> history) {
        int points = 0;
        for (LeadInteraction interaction : history) {
            if (interaction.getType() == InteractionType.FORM_COMPLETED) points += FORM_POINTS;
            if (interaction.getType() == InteractionType.EMAIL_REPLIED) points += REPLY_POINTS;
        }

        Optional<Instant> firstOutreach = history.stream()
                .filter(i -> i.getType().isOutreach())
                .map(LeadInteraction::getCreatedAt)
                .min(Comparator.naturalOrder());
        if (firstOutreach.isPresent()) {
            Instant sentAt = firstOutreach.get();
            Optional<Instant> firstResponse = history.stream()
                    .filter(i -> i.getType().isResponse())
                    .map(LeadInteraction::getCreatedAt)
                    .filter(at -> !at.isBefore(sentAt))
                    .min(Comparator.naturalOrder());
            if (firstResponse.isPresent()) {
                long hours = Duration.between(sentAt, firstResponse.get()).toHours();
                if (hours <= 1) {
                    points += 15;
                } else if (hours <= 6) {
                    points += 10;
                } else if (hours <= 24) {
                    points += 5;
                } else if (hours <= 72) {
                    points += 2;
                }
            }
        }
        return points;
    }

    int penalties(Lead lead, List<LeadInteraction> history, Instant now) {
        int points = 0;

        Optional<Instant> last = history.stream()
                .map(LeadInteraction::getCreatedAt)
                .max(Comparator.naturalOrder());
        if (last.isPresent()) {
            long daysSilent = Duration.between(last.get(), now).toDays();
            if (daysSilent >= 14) {
                points += NO_RESPONSE_14_DAYS;
            } else if (daysSilent >= 7) {
                points += NO_RESPONSE_7_DAYS;
            }
        }

        if (lead.isEmailBounced() || history.stream().anyMatch(i -> i.getType() == InteractionType.EMAIL_BOUNCED)) {
            points += BOUNCE_PENALTY;
        }
        if (lead.isPhoneInvalid() || history.stream().anyMatch(i -> i.getType() == InteractionType.PHONE_INVALID)) {
            points += INVALID_PHONE_PENALTY;
        }
        if (lead.isOptedOut()) {
            points += OPTED_OUT;
        }
        return points;
    }

    static LeadPriority priority(int score, Lead lead) {
        LeadPriority fromScore;
        if (score >= Grade.A.getThreshold()) {
            fromScore = LeadPriority.URGENT;
        } else if (score >= Grade.B.getThreshold()) {
            fromScore = LeadPriority.HIGH;
        } else if (score >= Grade.C.getThreshold()) {
            fromScore = LeadPriority.MEDIUM;
        } else {
            fromScore = LeadPriority.LOW;
        }
        // Someone without a roof is never below HIGH, whatever the engagement says
        if (lead.isCurrentlyHomeless() && !fromScore.isAtLeast(LeadPriority.HIGH)) {
            return LeadPriority.HIGH;
        }
        return fromScore;
    }

    static NextAction nextAction(Grade grade, LeadPriority priority) {
        return switch (priority) {
            case URGENT -> NextAction.CALL_NOW;
            case HIGH -> (grade == Grade.A || grade == Grade.B) ? NextAction.SCHEDULE_TOUR : NextAction.CALL_NOW;
            case MEDIUM -> NextAction.BOOK_CONSULTATION;
            case LOW -> grade == Grade.D ? NextAction.FOLLOW_UP : NextAction.LONG_TERM_NURTURE;
        };
    }

    private static List<String> recommendations(Grade grade, Lead lead) {
        List<String> recommendations = new ArrayList<>();
        switch (grade) {
            case A -> {
                recommendations.add("Hot lead: call immediately");
                recommendations.add("Assign to senior housing specialist");
                recommendations.add("Fast-track application process");
            }
            case B -> {
                recommendations.add("Schedule phone call within 24 hours");
                recommendations.add("Offer virtual tour");
            }
            case C -> {
                recommendations.add("Continue email nurturing sequence");
                recommendations.add("Send relevant success stories");
            }
            default -> {
                recommendations.add("Add to long-term nurture campaign");
                recommendations.add("Re-engage in 30 days");
            }
        }
        if (lead.isVeteran()) recommendations.add("Connect with Veterans Liaison");
        if (lead.isInRecovery()) recommendations.add("Assign recovery-specialized counselor");
        if (lead.isCurrentlyHomeless()) recommendations.add("Expedite housing placement");
        return recommendations;
    }
}
