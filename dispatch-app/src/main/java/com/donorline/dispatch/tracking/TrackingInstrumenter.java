package com.donorline.dispatch.tracking;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a plain-text message body into tracked HTML: every http(s) URL becomes a
 * click-tracking redirect, blank-line separated blocks become paragraphs, single
 * newlines become line breaks, and a 1x1 open pixel is appended.
 */
@Component
public class TrackingInstrumenter {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"{}|\\\\^`\\[\\]]+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final String TRAILING_PUNCTUATION = ".,;:!?)'";

    private final String baseUrl;

    public TrackingInstrumenter(@Value("${dispatch.tracking.base-url:http://localhost:8080}") String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static String newTrackingId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public InstrumentedContent instrument(String body, String trackingId) {
        String text = body == null ? "" : body.replace("\r\n", "\n").replace('\r', '\n').trim();
        List<TrackedLink> links = new ArrayList<>();

        StringBuilder html = new StringBuilder();
        Matcher matcher = URL_PATTERN.matcher(text);
        int last = 0;
        while (matcher.find()) {
            String url = stripTrailingPunctuation(matcher.group());
            int urlEnd = matcher.start() + url.length();
            html.append(HtmlUtils.htmlEscape(text.substring(last, matcher.start())));

            TrackedLink link = new TrackedLink(newTrackingId(), url);
            links.add(link);
            html.append("<a href=\"").append(clickUrl(link)).append("\">")
                    .append(HtmlUtils.htmlEscape(url))
                    .append("</a>");
            last = urlEnd;
        }
        html.append(HtmlUtils.htmlEscape(text.substring(last)));

        StringBuilder document = new StringBuilder();
        for (String paragraph : PARAGRAPH_BREAK.split(html.toString())) {
            if (paragraph.isBlank()) {
                continue;
            }
            document.append("<p>").append(paragraph.trim().replace("\n", "<br>")).append("</p>");
        }
        document.append("<img src=\"").append(baseUrl).append("/api/track/open/").append(trackingId)
                .append("\" width=\"1\" height=\"1\" alt=\"\" style=\"display:none\" />");

        return new InstrumentedContent(document.toString(), text, List.copyOf(links));
    }

    private String clickUrl(TrackedLink link) {
        return baseUrl + "/api/track/click/" + link.linkId()
                + "?url=" + URLEncoder.encode(link.originalUrl(), StandardCharsets.UTF_8);
    }

    private static String stripTrailingPunctuation(String url) {
        int end = url.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
