package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.model.*;
import com.leadnurture.support.MutableClock;
import com.leadnurture.support.TestCatalogs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SequencerTest {

    private MutableClock clock;
    private Sequencer sequencer;
    private Instant created;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(2024, 5, 6, 10, 0);
        sequencer = new Sequencer(TestCatalogs.standard(), new NurtureProperties(), clock);
        created = clock.instant();
    }

    private LeadWithHistory veteran(LeadInteraction... history) {
        Lead lead = Lead.builder().id(UUID.randomUUID()).email("v@example.com").veteran(true).createdAt(created).build();
        return new LeadWithHistory(lead, List.of(history));
    }

    private static LeadInteraction sent(String templateId) {
        return LeadInteraction.builder().type(InteractionType.EMAIL_SENT).templateId(templateId)
                .createdAt(Instant.EPOCH).build();
    }

    @Test
    @DisplayName("Day-0 step is due at creation time within the hour window")
    void welcomeDueImmediately() {
        Optional<CampaignStep> step = sequencer.next(veteran(), clock.instant());

        assertEquals("veteran_welcome", step.orElseThrow().getTemplateId());
    }

    @Test
    @DisplayName("Template already sent is never offered again")
    void sentTemplateSkipped() {
        clock.advance(Duration.ofDays(1));

        Optional<CampaignStep> step = sequencer.next(veteran(sent("veteran_welcome")), clock.instant());

        assertEquals("veteran_benefits", step.orElseThrow().getTemplateId());
    }

    @Test
    @DisplayName("Earlier unsent step wins over a later one (catalog order)")
    void catalogOrderTieBreak() {
        clock.advance(Duration.ofDays(1));

        Optional<CampaignStep> step = sequencer.next(veteran(), clock.instant());

        assertEquals("veteran_welcome", step.orElseThrow().getTemplateId());
    }

    @Test
    @DisplayName("Outside every hour window nothing is due")
    void outsideHourWindow() {
        clock.setLocal(2024, 5, 6, 13, 0);

        assertTrue(sequencer.next(veteran(), clock.instant()).isEmpty());
    }

    @Test
    @DisplayName("Hour window tolerance is inclusive at ±2 hours")
    void toleranceEdges() {
        clock.setLocal(2024, 5, 6, 12, 59);
        assertTrue(sequencer.next(veteran(), clock.instant()).isPresent());

        clock.setLocal(2024, 5, 6, 8, 0);
        created = clock.instant().minus(Duration.ofHours(1));
        assertTrue(sequencer.next(veteran(), clock.instant()).isPresent());

        clock.setLocal(2024, 5, 6, 7, 59);
        created = clock.instant().minus(Duration.ofHours(1));
        assertTrue(sequencer.next(veteran(), clock.instant()).isEmpty());
    }

    @Test
    @DisplayName("Nothing is due when every step's day offset is still ahead")
    void notYetDue() {
        created = clock.instant();
        LeadWithHistory lead = veteran(sent("veteran_welcome"));

        clock.setLocal(2024, 5, 7, 9, 0);

        assertEquals(0, Sequencer.daysSinceCreation(created, clock.instant()));
        assertTrue(sequencer.next(lead, clock.instant()).isEmpty());
    }

    @Test
    @DisplayName("Whole days are floored")
    void daysFloored() {
        Instant start = Instant.parse("2024-05-01T00:00:00Z");

        assertEquals(0, Sequencer.daysSinceCreation(start, start.plus(Duration.ofHours(23).plusMinutes(59))));
        assertEquals(1, Sequencer.daysSinceCreation(start, start.plus(Duration.ofHours(24))));
        assertEquals(-1, Sequencer.daysSinceCreation(start, start.minus(Duration.ofMinutes(1))));
    }

    @Test
    @DisplayName("Once all steps are sent the lead has nothing due")
    void campaignFinished() {
        clock.advance(Duration.ofDays(40));

        LeadWithHistory lead = veteran(sent("veteran_welcome"), sent("veteran_benefits"),
                sent("veteran_story"), sent("veteran_long_term"));

        assertTrue(sequencer.next(lead, clock.instant()).isEmpty());
    }
}
