package com.leadnurture.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EngineStats {
    private long sent;
    private long failed;
    private int dailySent;
    private int dailyLimit;
    private int remainingToday;
    private int hourlySent;
    private int remainingThisHour;
    private int activeSessions;
    private boolean emailEnabled;
    private long pendingTasks;
}
