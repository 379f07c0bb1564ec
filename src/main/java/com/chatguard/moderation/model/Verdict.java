package com.chatguard.moderation.model;

public enum Verdict {
    SPAM,
    CLEAN
}
