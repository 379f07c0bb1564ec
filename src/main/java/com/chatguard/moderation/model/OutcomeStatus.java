package com.chatguard.moderation.model;

public enum OutcomeStatus {
    SUCCEEDED,
    PARTIALLY_SUCCEEDED,
    NO_OP,
    FAILED,
    REJECTED,
    CANCELLED;

    public boolean isSuccess() {
        return this == SUCCEEDED || this == PARTIALLY_SUCCEEDED || this == NO_OP;
    }
}
