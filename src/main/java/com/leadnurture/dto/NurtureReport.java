package com.leadnurture.dto;

import com.leadnurture.model.ReportPeriod;
import lombok.*;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class NurtureReport {
    private ReportPeriod period;
    private Instant from;
    private Instant to;
    private long emailsSent;
    private long emailsOpened;
    private long emailsClicked;
    private long repliesReceived;
    private long formsCompleted;
    private long chatLeads;
    private EngineStats engine;
    private TaskStats tasks;
}
