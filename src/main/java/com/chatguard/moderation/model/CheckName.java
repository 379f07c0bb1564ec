package com.chatguard.moderation.model;

public enum CheckName {
    STOP_WORDS("Stop Words"),
    SPACING("Letter Spacing"),
    INVISIBLE_CHARS("Invisible Characters"),
    SIMILARITY("Spam Similarity"),
    BAYES("Naive Bayes"),
    URL_REPUTATION("URL Reputation");

    private final String displayName;

    CheckName(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
