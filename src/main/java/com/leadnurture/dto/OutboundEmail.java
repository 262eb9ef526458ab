package com.leadnurture.dto;

import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OutboundEmail {
    private String to;
    private String subject;
    private String html;
    private String text;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    // <leadId>:<templateId>, used for open/click tracking URLs
    private String trackingId;
}
