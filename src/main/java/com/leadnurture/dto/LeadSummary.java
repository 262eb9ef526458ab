package com.leadnurture.dto;

import lombok.*;

import java.util.Set;

/**
 * Lead-creation request synthesized from a promoted chat session.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class LeadSummary {
    private String name;
    private String email;
    private String phone;
    private String source;
    private String notes;
    private String chatSessionId;
    private Set<String> tags;
}
