package com.chatguard.moderation.engine.reputation;

public class ReputationLookupException extends RuntimeException {

    public ReputationLookupException(String message) {
        super(message);
    }

    public ReputationLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
