package com.chatguard.moderation.engine;

/**
 * No decision could be made for a message. Distinct from a clean decision.
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
