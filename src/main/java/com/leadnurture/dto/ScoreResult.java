package com.leadnurture.dto;

import com.leadnurture.model.Grade;
import com.leadnurture.model.LeadPriority;
import com.leadnurture.model.NextAction;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ScoreResult {
    // Always within 0..100
    private int score;
    private Grade grade;
    private LeadPriority priority;
    private NextAction nextAction;
    private ScoreBreakdown breakdown;
    private List<String> recommendations;
}
