package com.leadnurture.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

@Getter
@AllArgsConstructor
public class ChatTurn {
    private final ChatRole role;
    private final String content;
    private final Instant timestamp;
}
