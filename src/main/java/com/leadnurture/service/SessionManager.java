package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.ChatStats;
import com.leadnurture.dto.SessionStatus;
import com.leadnurture.model.ChatRole;
import com.leadnurture.model.ChatSession;
import com.leadnurture.model.ChatTurn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory chat sessions plus the lead-promotion heuristic.
 *
 * The map is kept in last-activity order: every touch removes the session and
 * re-inserts it at the tail, so the head is always the least recently active
 * session. sweepExpired() walks from the head and stops at the first session
 * that is still live, instead of scanning every session.
 *
 * All access is synchronized on this manager.
 */
@Component
@Slf4j
public class SessionManager {

    private static final int RECENT_TURNS = 6;

    private final NurtureProperties.Chat config;

    private final LinkedHashMap<String, ChatSession> sessions = new LinkedHashMap<>();
    private long totalPromoted;

    public SessionManager(NurtureProperties properties) {
        this.config = properties.getChat();
    }

    /**
     * Returns the session for {@code sessionId}, creating it when the id is blank or
     * unknown. Either way the session's lastActivity moves to {@code now}.
     */
    public synchronized ChatSession getOrCreate(String sessionId, String userName, Instant now) {
        ChatSession session = sessionId == null || sessionId.isBlank() ? null : sessions.get(sessionId);
        if (session == null) {
            String id = sessionId == null || sessionId.isBlank() ? "chat_" + UUID.randomUUID() : sessionId;
            session = new ChatSession(id, userName, now);
            log.info("New chat session: {}", id);
        } else if (userName != null && !userName.isBlank() && session.getUserName() == null) {
            session.setUserName(userName);
        }
        touch(session, now);
        return session;
    }

    public synchronized Optional<ChatSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public synchronized Optional<SessionStatus> status(String sessionId) {
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        return Optional.of(SessionStatus.builder()
                .sessionId(session.getId())
                .userName(session.getUserName())
                .turnCount(session.turnCount())
                .createdAt(session.getCreatedAt())
                .lastActivity(session.getLastActivity())
                .leadPromoted(session.isLeadPromoted())
                .promotedLeadId(session.getPromotedLeadId())
                .recentTurns(new ArrayList<>(session.recentTurns(RECENT_TURNS)))
                .build());
    }

    public synchronized void appendTurn(ChatSession session, ChatRole role, String content, Instant now) {
        session.addTurn(new ChatTurn(role, content, now));
        touch(session, now);
    }

    /**
     * True iff the session has not produced a lead yet, has at least the minimum
     * number of turns, and its user-authored text mentions a lead keyword.
     */
    public synchronized boolean shouldPromote(ChatSession session) {
        if (session.isLeadPromoted() || session.turnCount() < config.getPromotionMinTurns()) {
            return false;
        }
        String userText = session.userText(" ").toLowerCase(Locale.ROOT);
        return config.getLeadKeywords().stream()
                .anyMatch(keyword -> userText.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    /** User-authored text of the session, sentences joined with ". ". */
    public synchronized String transcript(ChatSession session) {
        return session.userText(". ");
    }

    public synchronized void rename(ChatSession session, String userName) {
        session.setUserName(userName);
    }

    public synchronized void markPromoted(ChatSession session, UUID leadId) {
        session.markPromoted(leadId);
        totalPromoted++;
    }

    /** Removes sessions idle for longer than {@code timeout}; returns how many were removed. */
    public synchronized int sweepExpired(Instant now, Duration timeout) {
        Instant cutoff = now.minus(timeout);
        int removed = 0;
        Iterator<ChatSession> it = sessions.values().iterator();
        while (it.hasNext()) {
            ChatSession session = it.next();
            if (!session.getLastActivity().isBefore(cutoff)) {
                break;
            }
            it.remove();
            removed++;
            log.info("Cleaned up expired session: {}", session.getId());
        }
        return removed;
    }

    public int sweepExpired(Instant now) {
        return sweepExpired(now, config.getSessionTimeout());
    }

    public synchronized int activeCount() {
        return sessions.size();
    }

    public synchronized ChatStats stats(Instant now) {
        Instant dayAgo = now.minus(Duration.ofDays(1));
        int turns = sessions.values().stream().mapToInt(ChatSession::turnCount).sum();
        return ChatStats.builder()
                .activeSessions(sessions.size())
                .sessionsLast24h(sessions.values().stream().filter(s -> s.getCreatedAt().isAfter(dayAgo)).count())
                .leadsGenerated(totalPromoted)
                .averageTurnsPerSession(sessions.isEmpty() ? 0 : Math.round((double) turns / sessions.size()))
                .build();
    }

    private void touch(ChatSession session, Instant now) {
        if (session.getLastActivity() == null || now.isAfter(session.getLastActivity())) {
            session.setLastActivity(now);
        }
        sessions.remove(session.getId());
        sessions.put(session.getId(), session);
    }
}
