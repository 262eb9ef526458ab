package com.leadnurture.service;

import com.leadnurture.config.NurtureProperties;
import com.leadnurture.dto.OutboundEmail;
import com.leadnurture.model.CampaignStep;
import com.leadnurture.model.CampaignType;
import com.leadnurture.model.Lead;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a campaign step into a personalised email for one lead.
 *
 * Placeholders: {name}, {firstName}, {businessName}, {businessPhone}.
 * Every absolute link in the HTML body is rewritten to
 *   <website>/track/click/<trackingId>?url=<original>
 * and an open pixel <website>/track/open/<trackingId> is appended.
 */
@Component
@RequiredArgsConstructor
public class EmailTemplateRenderer {

    private static final Pattern LINK = Pattern.compile("href=\"(https?://[^\"]+)\"");
    private static final String DEFAULT_NAME = "Friend";

    private final NurtureProperties properties;

    public OutboundEmail render(Lead lead, CampaignType campaign, CampaignStep step) {
        String trackingId = trackingId(lead, step);
        String subject = personalise(step.getSubject(), lead);
        String headline = personalise(step.getHeadline(), lead);
        String body = personalise(step.getBody(), lead);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Campaign-ID", campaign.tag() + ":" + step.getTemplateId());
        headers.put("X-Lead-ID", String.valueOf(lead.getId()));

        return OutboundEmail.builder()
                .to(lead.getEmail())
                .subject(subject)
                .html(html(headline, body, trackingId))
                .text(text(headline, body))
                .headers(headers)
                .trackingId(trackingId)
                .build();
    }

    public static String trackingId(Lead lead, CampaignStep step) {
        return lead.getId() + ":" + step.getTemplateId();
    }

    String personalise(String template, Lead lead) {
        if (template == null) {
            return "";
        }
        NurtureProperties.Business business = properties.getBusiness();
        return template
                .replace("{name}", displayName(lead))
                .replace("{firstName}", firstName(lead))
                .replace("{businessName}", business.getName())
                .replace("{businessPhone}", business.getPhone());
    }

    String addLinkTracking(String html, String trackingId) {
        String base = properties.getEmail().getTrackingBaseUrl();
        Matcher matcher = LINK.matcher(html);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String tracked = "href=\"" + base + "/track/click/" + trackingId
                    + "?url=" + URLEncoder.encode(matcher.group(1), StandardCharsets.UTF_8) + "\"";
            matcher.appendReplacement(out, Matcher.quoteReplacement(tracked));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String html(String headline, String body, String trackingId) {
        NurtureProperties.Business business = properties.getBusiness();
        StringBuilder html = new StringBuilder()
                .append("<div style=\"font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto;\">")
                .append("<h2>").append(HtmlUtils.htmlEscape(headline)).append("</h2>");
        for (String paragraph : body.split("\\n\\s*\\n")) {
            html.append("<p>").append(HtmlUtils.htmlEscape(paragraph.trim()).replace("\n", "<br>")).append("</p>");
        }
        html.append("<hr>")
                .append("<p style=\"font-size: 12px; color: #666;\">")
                .append(HtmlUtils.htmlEscape(business.getName())).append(" | ")
                .append(HtmlUtils.htmlEscape(business.getPhone())).append(" | ")
                .append("<a href=\"").append(business.getWebsite()).append("\">")
                .append(business.getWebsite()).append("</a>")
                .append("</p></div>");

        String base = properties.getEmail().getTrackingBaseUrl();
        return addLinkTracking(html.toString(), trackingId)
                + "<img src=\"" + base + "/track/open/" + trackingId
                + "\" width=\"1\" height=\"1\" style=\"display:none;\">";
    }

    private String text(String headline, String body) {
        NurtureProperties.Business business = properties.getBusiness();
        return headline + "\n\n" + body + "\n\n--\n"
                + business.getName() + "\n" + business.getPhone() + "\n" + business.getWebsite();
    }

    private static String displayName(Lead lead) {
        return lead.getName() == null || lead.getName().isBlank() ? DEFAULT_NAME : lead.getName().trim();
    }

    private static String firstName(Lead lead) {
        return displayName(lead).split("\\s+")[0];
    }
}
