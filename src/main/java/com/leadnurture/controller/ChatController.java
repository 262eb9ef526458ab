package com.leadnurture.controller;

import com.leadnurture.dto.ChatRequest;
import com.leadnurture.dto.ChatResponse;
import com.leadnurture.dto.ChatStats;
import com.leadnurture.dto.SessionStatus;
import com.leadnurture.service.ChatService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;

/**
 * Website chat endpoint.
 *
 * POST /api/chat/message
 * {
 *   "sessionId": "chat_9f1c...",      (optional, omitted on the first message)
 *   "userName": "Maria",              (optional)
 *   "message": "I'd like to schedule a tour"
 * }
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;
    private final Clock clock;

    @PostMapping("/message")
    public ResponseEntity<ChatResponse> message(@Valid @RequestBody ChatRequest request) {
        return ResponseEntity.ok(chatService.handleMessage(
                request.getSessionId(), request.getUserName(), request.getMessage(), clock.instant()));
    }

    @GetMapping("/sessions/{id}")
    public ResponseEntity<SessionStatus> session(@PathVariable String id) {
        return ResponseEntity.ok(chatService.sessionStatus(id));
    }

    @GetMapping("/stats")
    public ResponseEntity<ChatStats> stats() {
        return ResponseEntity.ok(chatService.stats(clock.instant()));
    }
}
