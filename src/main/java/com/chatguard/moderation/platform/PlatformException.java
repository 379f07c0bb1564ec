package com.chatguard.moderation.platform;

public class PlatformException extends RuntimeException {

    private final String communityId;

    public PlatformException(String communityId, String message) {
        super(message);
        this.communityId = communityId;
    }

    public PlatformException(String communityId, String message, Throwable cause) {
        super(message, cause);
        this.communityId = communityId;
    }

    public String getCommunityId() {
        return communityId;
    }
}
