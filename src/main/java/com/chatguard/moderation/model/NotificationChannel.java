package com.chatguard.moderation.model;

public enum NotificationChannel {
    PRIVATE_MESSAGE,
    COMMUNITY_MENTION,
    NONE
}
