package com.chatguard.moderation.model;

public enum ReviewStatus {
    PENDING,
    CONFIRMED_SPAM,
    CONFIRMED_HAM
}
