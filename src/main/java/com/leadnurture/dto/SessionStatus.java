package com.leadnurture.dto;

import com.leadnurture.model.ChatTurn;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SessionStatus {
    private String sessionId;
    private String userName;
    private int turnCount;
    private Instant createdAt;
    private Instant lastActivity;
    private boolean leadPromoted;
    private UUID promotedLeadId;
    private List<ChatTurn> recentTurns;
}
