package com.leadnurture.dto;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChatResponse {
    private String replyText;
    private String sessionId;
    private boolean leadPromoted;
}
