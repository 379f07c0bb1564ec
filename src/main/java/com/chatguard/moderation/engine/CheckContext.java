package com.chatguard.moderation.engine;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The message under evaluation plus values derived from it once, shared by all checks.
 */
@Data
@Builder
public class CheckContext {

    private static final Pattern URL_PATTERN =
            Pattern.compile("(?i)\\b((?:https?://|www\\.)[^\\s<>\"]+|[a-z0-9-]+(?:\\.[a-z0-9-]+)*\\.(?:com|net|org|io|me|xyz|ru|info|biz|top|click|link)(?:/[^\\s<>\"]*)?)");

    private String messageId;
    private String communityId;
    private String accountId;
    private String text;

    public static CheckContext of(String messageId, String communityId, String accountId, String text) {
        return CheckContext.builder()
                .messageId(messageId)
                .communityId(communityId)
                .accountId(accountId)
                .text(text != null ? text : "")
                .build();
    }

    /**
     * Lowercased text with whitespace collapsed.
     */
    public String normalizedText() {
        return text.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    public List<String> urls() {
        List<String> urls = new ArrayList<>();
        Matcher m = URL_PATTERN.matcher(text);
        while (m.find()) {
            urls.add(m.group(1));
        }
        return urls;
    }
}
