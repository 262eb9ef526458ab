package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.EngineStats;
import com.leadnurture.dto.InteractionRecord;
import com.leadnurture.dto.OutboundEmail;
import com.leadnurture.dto.TaskStats;
import com.leadnurture.exception.EmailDeliveryException;
import com.leadnurture.model.InteractionType;
import com.leadnurture.model.Lead;
import com.leadnurture.model.LeadInteraction;
import com.leadnurture.model.LeadStatus;
import com.leadnurture.model.LeadWithHistory;
import com.leadnurture.model.TaskType;
import com.leadnurture.repository.LeadStore;
import com.leadnurture.support.MutableClock;
import com.leadnurture.support.TestCatalogs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NurtureEngineTest {

    @Mock private LeadStore leadStore;
    @Mock private EmailDeliveryService delivery;
    @Mock private SendClaimService claims;
    @Mock private TaskRunner taskRunner;

    private MutableClock clock;
    private NurtureProperties properties;
    private QuotaManager quota;
    private NurtureEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(2024, 5, 6, 10, 0);
        properties = new NurtureProperties();
        properties.getCampaign().setSendPause(Duration.ZERO);
        CampaignCatalog catalog = TestCatalogs.standard();
        quota = new QuotaManager(properties, clock);
        engine = new NurtureEngine(leadStore, new LeadScorer(clock), new Sequencer(catalog, properties, clock),
                catalog, quota, new EmailTemplateRenderer(properties), delivery, claims, taskRunner,
                new SessionManager(properties), properties, clock);
    }

    private Lead veteran() {
        return Lead.builder().id(UUID.randomUUID()).name("Sam Rivera").email("sam@example.com")
                .veteran(true).createdAt(clock.instant()).build();
    }

    private Lead general() {
        return Lead.builder().id(UUID.randomUUID()).name("Ana Cruz").email("ana@example.com")
                .createdAt(clock.instant()).build();
    }

    private static LeadInteraction sent(Lead lead, String templateId, Instant at) {
        return LeadInteraction.builder().leadId(lead.getId()).type(InteractionType.EMAIL_SENT)
                .templateId(templateId).createdAt(at).build();
    }

    private static Map<String, Object> payload(UUID leadId, String templateId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("leadId", leadId.toString());
        payload.put("templateId", templateId);
        return payload;
    }

    @Nested
    @DisplayName("Campaign sweep")
    class Sweep {

        @BeforeEach
        void transportUp() {
            when(delivery.isEnabled()).thenReturn(true);
        }

        @Test
        @DisplayName("Welcome goes out once and a second sweep sends nothing")
        void welcomeSentOnce() throws Exception {
            Lead lead = veteran();
            Instant sentAt = clock.instant();
            when(leadStore.listLeadsWithInteractions(anyCollection(), eq(true)))
                    .thenReturn(List.of(new LeadWithHistory(lead, List.of())))
                    .thenReturn(List.of(new LeadWithHistory(lead, List.of(sent(lead, "veteran_welcome", sentAt)))));
            when(claims.claim(lead.getId(), "veteran_welcome")).thenReturn(true);
            when(delivery.send(any(OutboundEmail.class))).thenReturn("msg-1");

            assertEquals(1, engine.processDueCampaigns(clock.instant()));
            clock.advance(Duration.ofMinutes(10));
            assertEquals(0, engine.processDueCampaigns(clock.instant()));

            verify(delivery, times(1)).send(any(OutboundEmail.class));
            ArgumentCaptor<InteractionRecord> record = ArgumentCaptor.forClass(InteractionRecord.class);
            verify(leadStore).insertInteraction(eq(lead.getId()), record.capture());
            assertEquals(InteractionType.EMAIL_SENT, record.getValue().getType());
            assertEquals("veteran_welcome", record.getValue().getTemplateId());
            assertEquals("msg-1", record.getValue().getPayload().get("messageId"));
            assertEquals("high", record.getValue().getPayload().get("priority"));
            verify(leadStore).updateLeadStatus(lead.getId(), LeadStatus.CONTACTED);
            assertEquals(1, quota.snapshot().getDailySent());
        }

        @Test
        @DisplayName("A lead without email is skipped and the rest of the sweep continues")
        void badLeadIsolated() throws Exception {
            Lead broken = veteran();
            broken.setEmail(null);
            Lead healthy = general();
            when(leadStore.listLeadsWithInteractions(anyCollection(), eq(true))).thenReturn(List.of(
                    new LeadWithHistory(broken, List.of()), new LeadWithHistory(healthy, List.of())));
            when(claims.claim(healthy.getId(), "general_welcome")).thenReturn(true);
            when(delivery.send(any(OutboundEmail.class))).thenReturn("msg-2");

            assertEquals(1, engine.processDueCampaigns(clock.instant()));

            ArgumentCaptor<OutboundEmail> email = ArgumentCaptor.forClass(OutboundEmail.class);
            verify(delivery).send(email.capture());
            assertEquals("ana@example.com", email.getValue().getTo());
            verify(claims, never()).claim(eq(broken.getId()), anyString());
        }

        @Test
        @DisplayName("Higher ranked lead gets the last slot of the hour")
        void rankingDecidesWhoIsSent() throws Exception {
            properties.getQuota().setMaxHourly(1);
            quota = new QuotaManager(properties, clock);
            CampaignCatalog catalog = TestCatalogs.standard();
            engine = new NurtureEngine(leadStore, new LeadScorer(clock), new Sequencer(catalog, properties, clock),
                    catalog, quota, new EmailTemplateRenderer(properties), delivery, claims, taskRunner,
                    new SessionManager(properties), properties, clock);

            Lead low = general();
            Lead high = veteran();
            when(leadStore.listLeadsWithInteractions(anyCollection(), eq(true))).thenReturn(List.of(
                    new LeadWithHistory(low, List.of()), new LeadWithHistory(high, List.of())));
            when(claims.claim(high.getId(), "veteran_welcome")).thenReturn(true);
            when(delivery.send(any(OutboundEmail.class))).thenReturn("msg-3");

            assertEquals(1, engine.processDueCampaigns(clock.instant()));

            verify(leadStore).insertInteraction(eq(high.getId()), any(InteractionRecord.class));
            verify(claims, never()).claim(eq(low.getId()), anyString());
        }

        @Test
        @DisplayName("Failed send releases the claim, counts a failure and schedules a retry")
        void failureSchedulesRetry() throws Exception {
            Lead lead = veteran();
            when(leadStore.listLeadsWithInteractions(anyCollection(), eq(true)))
                    .thenReturn(List.of(new LeadWithHistory(lead, List.of())));
            when(claims.claim(lead.getId(), "veteran_welcome")).thenReturn(true);
            when(delivery.send(any(OutboundEmail.class)))
                    .thenThrow(new EmailDeliveryException("provider down", null));

            assertEquals(0, engine.processDueCampaigns(clock.instant()));

            verify(claims).release(lead.getId(), "veteran_welcome");
            verify(taskRunner).schedule(eq(TaskType.EMAIL_DELIVERY), anyMap(),
                    eq(clock.instant().plus(Duration.ofMinutes(30))),
                    eq("delivery:" + lead.getId() + ":veteran_welcome"));
            verify(leadStore, never()).insertInteraction(any(), any());
            assertEquals(1, quota.snapshot().getFailed());
            assertEquals(0, quota.snapshot().getDailySent());
        }

        @Test
        @DisplayName("Template error leaves the send unclaimed so the next sweep can try again")
        void renderFailureLeavesNoClaim() throws Exception {
            EmailTemplateRenderer renderer = mock(EmailTemplateRenderer.class);
            CampaignCatalog catalog = TestCatalogs.standard();
            engine = new NurtureEngine(leadStore, new LeadScorer(clock), new Sequencer(catalog, properties, clock),
                    catalog, quota, renderer, delivery, claims, taskRunner,
                    new SessionManager(properties), properties, clock);

            Lead lead = veteran();
            when(leadStore.listLeadsWithInteractions(anyCollection(), eq(true)))
                    .thenReturn(List.of(new LeadWithHistory(lead, List.of())));
            when(renderer.render(eq(lead), any(), any())).thenThrow(new IllegalStateException("bad template"));

            assertEquals(0, engine.processDueCampaigns(clock.instant()));

            verifyNoInteractions(claims);
            verify(delivery, never()).send(any());
            verify(leadStore, never()).insertInteraction(any(), any());
        }

        @Test
        @DisplayName("Unexpected transport error releases the claim")
        void unexpectedSendErrorReleasesClaim() throws Exception {
            Lead lead = veteran();
            when(leadStore.listLeadsWithInteractions(anyCollection(), eq(true)))
                    .thenReturn(List.of(new LeadWithHistory(lead, List.of())));
            when(claims.claim(lead.getId(), "veteran_welcome")).thenReturn(true);
            when(delivery.send(any(OutboundEmail.class))).thenThrow(new IllegalStateException("client closed"));

            assertEquals(0, engine.processDueCampaigns(clock.instant()));

            verify(claims).release(lead.getId(), "veteran_welcome");
            verify(leadStore, never()).insertInteraction(any(), any());
            assertEquals(0, quota.snapshot().getDailySent());
        }

        @Test
        @DisplayName("Step with a retry already queued is left to the retry")
        void pendingRetrySkipsStep() throws Exception {
            Lead lead = veteran();
            when(leadStore.listLeadsWithInteractions(anyCollection(), eq(true)))
                    .thenReturn(List.of(new LeadWithHistory(lead, List.of())));
            when(taskRunner.hasPending("delivery:" + lead.getId() + ":veteran_welcome")).thenReturn(true);

            assertEquals(0, engine.processDueCampaigns(clock.instant()));

            verifyNoInteractions(claims);
            verify(delivery, never()).send(any());
        }

        @Test
        @DisplayName("Claim held elsewhere means no send")
        void claimLost() throws Exception {
            Lead lead = veteran();
            when(leadStore.listLeadsWithInteractions(anyCollection(), eq(true)))
                    .thenReturn(List.of(new LeadWithHistory(lead, List.of())));
            when(claims.claim(lead.getId(), "veteran_welcome")).thenReturn(false);

            assertEquals(0, engine.processDueCampaigns(clock.instant()));

            verify(delivery, never()).send(any());
            assertEquals(0, quota.snapshot().getDailySent());
        }
    }

    @Test
    @DisplayName("Sweep is a no-op when no transport is configured")
    void disabledTransport() {
        when(delivery.isEnabled()).thenReturn(false);

        assertEquals(0, engine.processDueCampaigns(clock.instant()));

        verifyNoInteractions(leadStore, claims);
    }

    @Test
    @DisplayName("Stats combine quota counters, sessions and pending tasks")
    void stats() {
        quota.recordSend();
        quota.recordFailure();
        when(delivery.isEnabled()).thenReturn(true);
        when(taskRunner.getStats()).thenReturn(TaskStats.builder().pendingTasks(3).build());

        EngineStats stats = engine.getStats();

        assertEquals(1, stats.getSent());
        assertEquals(1, stats.getFailed());
        assertEquals(49, stats.getRemainingToday());
        assertEquals(9, stats.getRemainingThisHour());
        assertEquals(0, stats.getActiveSessions());
        assertEquals(3, stats.getPendingTasks());
        assertTrue(stats.isEmailEnabled());
    }

    @Nested
    @DisplayName("Delivery retries")
    class Retries {

        @Test
        @DisplayName("Retry sends even outside the step's hour window")
        void retrySends() throws Exception {
            Lead lead = veteran();
            clock.setLocal(2024, 5, 6, 22, 0);
            when(leadStore.findLeadWithInteractions(lead.getId()))
                    .thenReturn(Optional.of(new LeadWithHistory(lead, List.of())));
            when(claims.claim(lead.getId(), "veteran_welcome")).thenReturn(true);
            when(delivery.send(any(OutboundEmail.class))).thenReturn("msg-4");

            assertEquals("sent", engine.retryDelivery(payload(lead.getId(), "veteran_welcome")));
            verify(leadStore).insertInteraction(eq(lead.getId()), any(InteractionRecord.class));
        }

        @Test
        @DisplayName("Retry of a template already recorded is a no-op")
        void alreadySent() throws Exception {
            Lead lead = veteran();
            when(leadStore.findLeadWithInteractions(lead.getId())).thenReturn(Optional.of(
                    new LeadWithHistory(lead, List.of(sent(lead, "veteran_welcome", clock.instant())))));

            assertEquals("already_sent", engine.retryDelivery(payload(lead.getId(), "veteran_welcome")));
            verifyNoInteractions(claims, delivery);
        }

        @Test
        @DisplayName("Retry is deferred when the daily cap is spent")
        void deferredByQuota() throws Exception {
            properties.getQuota().setMaxDaily(1);
            quota.recordSend();
            Lead lead = veteran();
            when(leadStore.findLeadWithInteractions(lead.getId()))
                    .thenReturn(Optional.of(new LeadWithHistory(lead, List.of())));

            assertEquals("deferred", engine.retryDelivery(payload(lead.getId(), "veteran_welcome")));
            verifyNoInteractions(claims, delivery);
        }

        @Test
        @DisplayName("Retry failure propagates so the task runner backs off")
        void failurePropagates() throws Exception {
            Lead lead = veteran();
            when(leadStore.findLeadWithInteractions(lead.getId()))
                    .thenReturn(Optional.of(new LeadWithHistory(lead, List.of())));
            when(claims.claim(lead.getId(), "veteran_welcome")).thenReturn(true);
            when(delivery.send(any(OutboundEmail.class)))
                    .thenThrow(new EmailDeliveryException("timeout", null, true));

            assertThrows(EmailDeliveryException.class,
                    () -> engine.retryDelivery(payload(lead.getId(), "veteran_welcome")));
            verify(claims).release(lead.getId(), "veteran_welcome");
        }

        @Test
        @DisplayName("Unknown lead or template is dropped")
        void unknownTargets() throws Exception {
            Lead lead = veteran();
            UUID missing = UUID.randomUUID();
            when(leadStore.findLeadWithInteractions(missing)).thenReturn(Optional.empty());
            when(leadStore.findLeadWithInteractions(lead.getId()))
                    .thenReturn(Optional.of(new LeadWithHistory(lead, List.of())));

            assertEquals("lead_missing", engine.retryDelivery(payload(missing, "veteran_welcome")));
            assertEquals("unknown_template", engine.retryDelivery(payload(lead.getId(), "no_such_step")));
        }
    }

    @Nested
    @DisplayName("Follow-ups")
    class FollowUps {

        @Test
        @DisplayName("Follow-up is queued with a per-lead key")
        void scheduleFollowUp() {
            UUID leadId = UUID.randomUUID();
            when(taskRunner.schedule(eq(TaskType.EMAIL_FOLLOW_UP), anyMap(), any(Instant.class), anyString()))
                    .thenReturn("task_1");

            assertEquals("task_1", engine.scheduleFollowUp(leadId, Duration.ofHours(2)));
            verify(taskRunner).schedule(eq(TaskType.EMAIL_FOLLOW_UP), anyMap(),
                    eq(clock.instant().plus(Duration.ofHours(2))), eq("follow-up:" + leadId));
        }

        @Test
        @DisplayName("Opted-out lead is not followed up")
        void optedOutNotEligible() {
            Lead lead = veteran();
            lead.setOptedOut(true);
            when(leadStore.findLeadWithInteractions(lead.getId()))
                    .thenReturn(Optional.of(new LeadWithHistory(lead, List.of())));
            when(delivery.isEnabled()).thenReturn(true);

            assertEquals("not_eligible", engine.followUp(Map.of("leadId", lead.getId().toString())));
        }

        @Test
        @DisplayName("Follow-up for a due lead sends the next step")
        void followUpSends() throws Exception {
            Lead lead = veteran();
            when(leadStore.findLeadWithInteractions(lead.getId()))
                    .thenReturn(Optional.of(new LeadWithHistory(lead, List.of())));
            when(delivery.isEnabled()).thenReturn(true);
            when(claims.claim(lead.getId(), "veteran_welcome")).thenReturn(true);
            when(delivery.send(any(OutboundEmail.class))).thenReturn("msg-5");

            assertEquals("sent", engine.followUp(Map.of("leadId", lead.getId().toString())));
        }
    }
}
