package com.leadnurture.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChatStats {
    private int activeSessions;
    private long sessionsLast24h;
    private long leadsGenerated;
    private long averageTurnsPerSession;
}
