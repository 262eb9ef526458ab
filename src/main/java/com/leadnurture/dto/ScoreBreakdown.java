package com.leadnurture.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ScoreBreakdown {
    private int demographic;
    private int urgency;
    private int engagement;
    private int qualification;
    private int behavioral;
    private int penalties;

    public int total() {
        return demographic + urgency + engagement + qualification + behavioral + penalties;
    }
}
