package com.leadnurture.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadnurture.dto.InteractionRecord;
import com.leadnurture.dto.LeadSummary;
import com.leadnurture.model.InteractionType;
import com.leadnurture.model.Lead;
import com.leadnurture.model.LeadInteraction;
import com.leadnurture.model.LeadStatus;
import com.leadnurture.model.LeadWithHistory;
import com.leadnurture.support.MutableClock;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaLeadStoreTest {

    @Mock private LeadRepository leadRepository;
    @Mock private LeadInteractionRepository interactionRepository;
    @Spy  private ObjectMapper objectMapper = new ObjectMapper();

    private MutableClock clock;
    private JpaLeadStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(2024, 5, 6, 10, 0);
        store = new JpaLeadStore(leadRepository, interactionRepository, objectMapper, clock);
    }

    @Test
    @DisplayName("Histories are loaded in one query and matched to their leads")
    void listGroupsHistories() {
        Lead first = Lead.builder().id(UUID.randomUUID()).name("A").build();
        Lead second = Lead.builder().id(UUID.randomUUID()).name("B").build();
        Set<LeadStatus> statuses = EnumSet.of(LeadStatus.NEW, LeadStatus.CONTACTED);
        when(leadRepository.findByStatusInAndOptedOutFalse(statuses)).thenReturn(List.of(first, second));
        when(interactionRepository.findByLeadIdInOrderByCreatedAtAsc(List.of(first.getId(), second.getId())))
                .thenReturn(List.of(LeadInteraction.builder().leadId(first.getId())
                        .type(InteractionType.EMAIL_SENT).templateId("general_welcome").build()));

        List<LeadWithHistory> result = store.listLeadsWithInteractions(statuses, true);

        assertEquals(2, result.size());
        assertEquals(Set.of("general_welcome"), result.get(0).sentTemplateIds());
        assertTrue(result.get(1).getInteractions().isEmpty());
        verify(interactionRepository, times(1)).findByLeadIdInOrderByCreatedAtAsc(anyCollection());
    }

    @Test
    @DisplayName("No eligible leads means no history query")
    void emptyListShortCircuits() {
        when(leadRepository.findByStatusIn(anyCollection())).thenReturn(List.of());

        assertTrue(store.listLeadsWithInteractions(EnumSet.of(LeadStatus.NEW), false).isEmpty());
        verifyNoInteractions(interactionRepository);
    }

    @Test
    @DisplayName("Interaction is stored with its template column and JSON payload")
    void insertInteraction() {
        UUID leadId = UUID.randomUUID();
        when(leadRepository.existsById(leadId)).thenReturn(true);

        store.insertInteraction(leadId, InteractionRecord.builder()
                .type(InteractionType.EMAIL_SENT)
                .templateId("veteran_welcome")
                .payload(Map.of("messageId", "re_1"))
                .build());

        ArgumentCaptor<LeadInteraction> captor = ArgumentCaptor.forClass(LeadInteraction.class);
        verify(interactionRepository).save(captor.capture());
        LeadInteraction saved = captor.getValue();
        assertEquals("veteran_welcome", saved.getTemplateId());
        assertEquals("{\"messageId\":\"re_1\"}", saved.getPayload());
        assertEquals(clock.instant(), saved.getCreatedAt());
    }

    @Test
    @DisplayName("Interaction for an unknown lead is rejected")
    void insertForUnknownLead() {
        UUID leadId = UUID.randomUUID();
        when(leadRepository.existsById(leadId)).thenReturn(false);

        assertThrows(EntityNotFoundException.class, () -> store.insertInteraction(leadId,
                InteractionRecord.builder().type(InteractionType.EMAIL_OPENED).build()));
        verify(interactionRepository, never()).save(any());
    }

    @Test
    @DisplayName("Status update stamps the last contact time")
    void updateStatus() {
        Lead lead = Lead.builder().id(UUID.randomUUID()).name("A").status(LeadStatus.NEW).build();
        when(leadRepository.findById(lead.getId())).thenReturn(Optional.of(lead));

        store.updateLeadStatus(lead.getId(), LeadStatus.CONTACTED);

        assertEquals(LeadStatus.CONTACTED, lead.getStatus());
        assertEquals(clock.instant(), lead.getLastContactAt());
        verify(leadRepository).save(lead);
    }

    @Test
    @DisplayName("Promoted chat lead starts as NEW with its tags")
    void insertLead() {
        UUID generated = UUID.randomUUID();
        when(leadRepository.save(any(Lead.class))).thenAnswer(invocation -> {
            Lead lead = invocation.getArgument(0);
            lead.setId(generated);
            return lead;
        });

        UUID id = store.insertLead(LeadSummary.builder()
                .name("Maria Lopez").email("maria@example.com").source("website_chat")
                .tags(Set.of("veteran")).build());

        assertEquals(generated, id);
        ArgumentCaptor<Lead> captor = ArgumentCaptor.forClass(Lead.class);
        verify(leadRepository).save(captor.capture());
        assertEquals(LeadStatus.NEW, captor.getValue().getStatus());
        assertTrue(captor.getValue().hasTag("veteran"));
    }
}
