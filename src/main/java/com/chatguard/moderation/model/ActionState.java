package com.chatguard.moderation.model;

public enum ActionState {
    ACTIVE,
    EXPIRED,
    REVERSED
}
