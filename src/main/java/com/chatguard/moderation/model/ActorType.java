package com.chatguard.moderation.model;

public enum ActorType {
    ADMIN,
    AUTO_DETECTION,
    SYSTEM
}
