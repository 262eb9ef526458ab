package com.leadnurture.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ChatRequest {

    private String sessionId;

    private String userName;

    @NotBlank(message = "message is required")
    private String message;
}
