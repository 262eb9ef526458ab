package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in keyword replies for the website chat.
 *
 * Checked in order, first match wins:
 *   crisis → name introduction → veteran → recovery → reentry → cost → scheduling → default
 */
@Component
@RequiredArgsConstructor
public class ChatResponder {

    private static final Pattern MY_NAME_IS =
            Pattern.compile("(?i)\\bmy name is\\s+([a-z][a-z'-]*(?:\\s+[a-z][a-z'-]*)?)");
    // "Call me Jo" but not "call me back": like "I'm", only a capitalised word counts
    private static final Pattern CALL_ME =
            Pattern.compile("\\b(?:Call me|call me)\\s+([A-Z][a-z'-]+(?:\\s+[A-Z][a-z'-]+)?)");
    // "I'm Maria" but not "I'm a veteran": the name must be capitalised
    private static final Pattern I_AM_NAME =
            Pattern.compile("\\b(?:I'm|I am|i'm|i am)\\s+([A-Z][a-z'-]+(?:\\s+[A-Z][a-z'-]+)?)");
    // Words that follow these phrases in ordinary requests; a name stops at the first one
    private static final Set<String> NOT_A_NAME = Set.of(
            "to", "back", "at", "about", "when", "on", "in", "after", "before", "later", "now",
            "soon", "today", "tomorrow", "tonight", "please", "asap", "and", "or", "but", "if",
            "so", "because", "for", "a", "an", "the", "not", "looking", "interested", "here");

    private static final List<String> CRISIS = List.of("crisis", "emergency", "homeless", "suicide");
    private static final List<String> VETERAN = List.of("veteran", "military");
    private static final List<String> RECOVERY = List.of("recovery", "sober", "addiction");
    private static final List<String> REENTRY = List.of("reentry", "prison", "incarceration");
    private static final List<String> COST = List.of("cost", "price", "money", "payment");
    private static final List<String> SCHEDULING = List.of("schedule", "appointment", "consultation", "tour");

    private final NurtureProperties properties;

    @Getter
    @AllArgsConstructor
    public static class Reply {
        private final String text;
        // Non-null when the message introduced the visitor's name
        private final String detectedName;
    }

    public Reply respond(String message, String knownName) {
        String lower = message.toLowerCase(Locale.ROOT);
        NurtureProperties.Business business = properties.getBusiness();

        if (containsAny(lower, CRISIS)) {
            return reply("I understand you may be in a difficult situation right now. If this is an emergency, "
                    + "please call 911. For crisis support, the Suicide & Crisis Lifeline is available 24/7 at 988. "
                    + "For immediate housing assistance, please call our main line at " + business.getPhone()
                    + ". How can I best help you right now?");
        }

        if (knownName == null) {
            Optional<String> name = detectName(message);
            if (name.isPresent()) {
                return new Reply("Nice to meet you, " + name.get() + "! What brings you to "
                        + business.getName() + " today? Are you interested in our veterans program, "
                        + "recovery housing, or reentry support?", name.get());
            }
        }

        if (containsAny(lower, VETERAN)) {
            return reply(greeting(knownName, "Thank you for your service! ")
                    + "Our Veterans Transitional Housing program is designed specifically for veterans "
                    + "transitioning to civilian life. I'd love to set up a personalized consultation to discuss "
                    + "the program and see if it's a good fit. Would you like help scheduling that?");
        }
        if (containsAny(lower, RECOVERY)) {
            return reply("Our Sober Living program is a supportive home for people with 30+ days of sobriety "
                    + "who are ready for the next step. I can schedule a consultation to go over requirements "
                    + "and availability. Would that be helpful?");
        }
        if (containsAny(lower, REENTRY)) {
            return reply("Our Reentry Housing program helps returning citizens transition back into the community "
                    + "with stable housing and support services. Shall I schedule a consultation to talk about "
                    + "your needs and timeline?");
        }
        if (containsAny(lower, COST)) {
            return reply("Costs depend on your situation and the housing option, so we go over exact numbers "
                    + "and payment options in a personalized consultation. Would you like to schedule one?");
        }
        if (containsAny(lower, SCHEDULING)) {
            return reply("Perfect! Consultations usually take 30-45 minutes and cover program details, costs "
                    + "and next steps. What's the best phone number or email to reach you, and do you prefer "
                    + "mornings or afternoons?");
        }
        return reply(greeting(knownName, "")
                + "I'm here to help you learn about " + business.getName() + "'s transitional housing programs: "
                + "veterans, recovery and reentry. What would be most helpful for you?");
    }

    Optional<String> detectName(String message) {
        for (Pattern pattern : List.of(MY_NAME_IS, CALL_ME, I_AM_NAME)) {
            Matcher matcher = pattern.matcher(message);
            if (matcher.find()) {
                Optional<String> name = stripNonNames(matcher.group(1));
                if (name.isPresent()) {
                    return name.map(ChatResponder::capitalise);
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> stripNonNames(String candidate) {
        List<String> words = new ArrayList<>();
        for (String word : candidate.trim().split("\\s+")) {
            if (NOT_A_NAME.contains(word.toLowerCase(Locale.ROOT))) {
                break;
            }
            words.add(word);
        }
        return words.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", words));
    }

    private static Reply reply(String text) {
        return new Reply(text, null);
    }

    private static String greeting(String name, String fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        return fallback.isEmpty() ? name + ", " : name + ", " + fallback.substring(0, 1).toLowerCase() + fallback.substring(1);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    private static String capitalise(String name) {
        StringBuilder out = new StringBuilder();
        for (String part : name.split("\\s+")) {
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return out.toString();
    }
}
