package com.chatguard.moderation.model;

public enum MemberRole {
    MEMBER,
    ADMIN,
    OWNER;

    public boolean isAdmin() {
        return this == ADMIN || this == OWNER;
    }
}
