package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.ChatResponse;
import com.leadnurture.dto.ChatStats;
import com.leadnurture.dto.InteractionRecord;
import com.leadnurture.dto.LeadSummary;
import com.leadnurture.dto.SessionStatus;
import com.leadnurture.model.ChatRole;
import com.leadnurture.model.ChatSession;
import com.leadnurture.model.InteractionType;
import com.leadnurture.repository.LeadStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chat surface of the engine.
 *
 * handleMessage():
 *   validate length → session.getOrCreate → user turn → keyword reply → assistant turn
 *     → shouldPromote? → insertLead + CHAT_PROMOTED interaction → markPromoted
 *
 * Promotion happens at most once per session: the check and the insert run
 * under the session's monitor, and markPromoted only after the insert succeeded,
 * so a failed insert leaves the session eligible for the next message.
 * Internal failures never reach the caller; they get the fallback reply instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatService {

    static final int SUMMARY_TEXT_LIMIT = 200;
    static final String CHAT_SOURCE = "website_chat";
    static final String DEFAULT_VISITOR_NAME = "Web Chat Visitor";

    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern PHONE = Pattern.compile("(?:\\+?1[\\s.-]?)?\\(?\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4}");

    private final SessionManager sessionManager;
    private final ChatResponder responder;
    private final LeadStore leadStore;
    private final NurtureProperties properties;

    /** Topics detected in a transcript, with the tag copied onto the promoted lead. */
    enum Topic {
        VETERANS("Veterans Program", "veteran", "veteran", "military"),
        RECOVERY("Recovery Housing", "recovery", "recovery", "sober"),
        REENTRY("Reentry Support", "reentry", "reentry", "prison"),
        CONSULTATION("Consultation Request", "consultation", "schedule", "appointment");

        private final String label;
        private final String tag;
        private final List<String> keywords;

        Topic(String label, String tag, String... keywords) {
            this.label = label;
            this.tag = tag;
            this.keywords = List.of(keywords);
        }

        boolean matches(String lowerText) {
            return keywords.stream().anyMatch(lowerText::contains);
        }
    }

    public ChatResponse handleMessage(String sessionId, String userName, String text, Instant now) {
        String message = text == null ? "" : text.trim();
        int max = properties.getChat().getMaxMessageLength();
        if (message.isEmpty() || message.length() > max) {
            throw new IllegalArgumentException("Message must be between 1 and " + max + " characters");
        }

        ChatSession session = null;
        try {
            session = sessionManager.getOrCreate(sessionId, userName, now);
            sessionManager.appendTurn(session, ChatRole.USER, message, now);

            ChatResponder.Reply reply = responder.respond(message, session.getUserName());
            if (reply.getDetectedName() != null) {
                sessionManager.rename(session, reply.getDetectedName());
            }
            sessionManager.appendTurn(session, ChatRole.ASSISTANT, reply.getText(), now);

            boolean promoted = maybePromote(session, now);
            return ChatResponse.builder()
                    .replyText(reply.getText())
                    .sessionId(session.getId())
                    .leadPromoted(promoted)
                    .build();
        } catch (RuntimeException e) {
            // A session created by this message is still handed back so the visitor keeps it
            String replySessionId = session != null ? session.getId() : sessionId;
            log.error("Chat message failed for session {}: {}", replySessionId, e.getMessage(), e);
            return ChatResponse.builder()
                    .replyText(fallbackMessage())
                    .sessionId(replySessionId)
                    .build();
        }
    }

    public SessionStatus sessionStatus(String sessionId) {
        return sessionManager.status(sessionId)
                .orElseThrow(() -> new NoSuchElementException("Chat session not found: " + sessionId));
    }

    public ChatStats stats(Instant now) {
        return sessionManager.stats(now);
    }

    public String fallbackMessage() {
        NurtureProperties.Business business = properties.getBusiness();
        return "I'm sorry, I'm having trouble responding right now. Please call us at " + business.getPhone()
                + " or email " + business.getEmail() + " and a member of our team will help you.";
    }

    private boolean maybePromote(ChatSession session, Instant now) {
        synchronized (session) {
            if (!sessionManager.shouldPromote(session)) {
                return false;
            }
            try {
                UUID leadId = leadStore.insertLead(summarize(session, sessionManager.transcript(session)));
                sessionManager.markPromoted(session, leadId);
                leadStore.insertInteraction(leadId, InteractionRecord.builder()
                        .type(InteractionType.CHAT_PROMOTED)
                        .payload(Map.of("sessionId", session.getId(), "turns", session.turnCount()))
                        .occurredAt(now)
                        .build());
                log.info("Lead {} created from chat session {}", leadId, session.getId());
                return true;
            } catch (RuntimeException e) {
                log.error("Failed to create lead from chat session {}: {}", session.getId(), e.getMessage(), e);
                return session.isLeadPromoted();
            }
        }
    }

    LeadSummary summarize(ChatSession session, String userText) {
        String lower = userText.toLowerCase(Locale.ROOT);

        List<String> labels = new ArrayList<>();
        Set<String> tags = new LinkedHashSet<>();
        for (Topic topic : Topic.values()) {
            if (topic.matches(lower)) {
                labels.add(topic.label);
                tags.add(topic.tag);
            }
        }

        String excerpt = userText.length() > SUMMARY_TEXT_LIMIT
                ? userText.substring(0, SUMMARY_TEXT_LIMIT) + "..."
                : userText;
        String notes = "Web chat inquiry" + (labels.isEmpty() ? "" : " about: " + String.join(", ", labels))
                + ". " + excerpt;

        return LeadSummary.builder()
                .name(session.getUserName() != null ? session.getUserName() : DEFAULT_VISITOR_NAME)
                .email(firstMatch(EMAIL, userText))
                .phone(firstMatch(PHONE, userText))
                .source(CHAT_SOURCE)
                .notes(notes)
                .chatSessionId(session.getId())
                .tags(tags)
                .build();
    }

    private static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group().trim() : null;
    }
}
