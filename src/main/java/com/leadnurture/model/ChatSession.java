package com.leadnurture.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Ephemeral conversation state for one chat visitor.
 * Held in SessionManager's memory only and reaped after inactivity.
 *
 * leadPromoted flips to true at most once; after that the session can
 * never produce another lead.
 */
@Getter
public class ChatSession {

    private final String id;
    private final Instant createdAt;
    private final List<ChatTurn> turns = new ArrayList<>();

    @Setter
    private String userName;

    @Setter
    private Instant lastActivity;

    private boolean leadPromoted;
    private UUID promotedLeadId;

    public ChatSession(String id, String userName, Instant createdAt) {
        this.id = id;
        this.userName = userName;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    public List<ChatTurn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public void addTurn(ChatTurn turn) {
        turns.add(turn);
    }

    public int turnCount() {
        return turns.size();
    }

    /** All user-authored text, in order, joined by the given separator. */
    public String userText(String separator) {
        return turns.stream()
                .filter(t -> t.getRole() == ChatRole.USER)
                .map(ChatTurn::getContent)
                .collect(Collectors.joining(separator));
    }

    public List<ChatTurn> recentTurns(int count) {
        int from = Math.max(0, turns.size() - count);
        return Collections.unmodifiableList(turns.subList(from, turns.size()));
    }

    public void markPromoted(UUID leadId) {
        if (leadPromoted) {
            throw new IllegalStateException("Session " + id + " already promoted");
        }
        this.leadPromoted = true;
        this.promotedLeadId = leadId;
    }
}
