package com.chatguard.moderation.model;

public enum DetectionSource {
    AUTOMATIC,
    MANUAL
}
