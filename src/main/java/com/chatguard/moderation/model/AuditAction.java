package com.chatguard.moderation.model;

public enum AuditAction {
    DETECTION_DECISION,
    BAN,
    MUTE,
    TEMP_BAN,
    TRUST,
    UNTRUST,
    UNBAN,
    MESSAGE_DELETED,
    EXPIRY_REVERSAL,
    REVIEW_FEEDBACK,
    TRAINING_LABEL_CHANGED,
    CHECK_CONFIG_CHANGED;

    public static AuditAction of(ActionKind kind) {
        return AuditAction.valueOf(kind.name());
    }
}
