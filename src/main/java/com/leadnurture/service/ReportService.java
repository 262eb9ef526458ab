package com.leadnurture.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.NurtureReport;
import com.leadnurture.model.InteractionType;
import com.leadnurture.model.ReportPeriod;
import com.leadnurture.repository.LeadStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Daily and weekly activity reports, run by the REPORT_GENERATION task.
 * The report is logged and published to the reports topic as JSON.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    private final LeadStore leadStore;
    private final NurtureEngine engine;
    private final TaskRunner taskRunner;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final NurtureProperties properties;
    private final Clock clock;

    public NurtureReport generate(ReportPeriod period) {
        Instant to = clock.instant();
        Instant from = to.minus(period.getWindow());

        NurtureReport report = NurtureReport.builder()
                .period(period)
                .from(from)
                .to(to)
                .emailsSent(leadStore.countInteractions(InteractionType.EMAIL_SENT, from, to))
                .emailsOpened(leadStore.countInteractions(InteractionType.EMAIL_OPENED, from, to))
                .emailsClicked(leadStore.countInteractions(InteractionType.EMAIL_CLICKED, from, to))
                .repliesReceived(leadStore.countInteractions(InteractionType.EMAIL_REPLIED, from, to))
                .formsCompleted(leadStore.countInteractions(InteractionType.FORM_COMPLETED, from, to))
                .chatLeads(leadStore.countInteractions(InteractionType.CHAT_PROMOTED, from, to))
                .engine(engine.getStats())
                .tasks(taskRunner.getStats())
                .build();

        log.info("{} report: sent={}, opened={}, clicked={}, replies={}, forms={}, chatLeads={}",
                period, report.getEmailsSent(), report.getEmailsOpened(), report.getEmailsClicked(),
                report.getRepliesReceived(), report.getFormsCompleted(), report.getChatLeads());
        publish(report);
        return report;
    }

    private void publish(NurtureReport report) {
        try {
            String message = objectMapper.writeValueAsString(report);
            kafkaTemplate.send(properties.getTopics().getReports(), report.getPeriod().name(), message);
        } catch (Exception e) {
            log.warn("Failed to publish {} report: {}", report.getPeriod(), e.getMessage());
        }
    }
}
