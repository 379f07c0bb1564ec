package com.chatguard.moderation.model;

/**
 * What the engine decided to do with an evaluated message.
 */
public enum DetectionAction {
    AUTO_BAN,
    REVIEW_QUEUE,
    ALLOW
}
