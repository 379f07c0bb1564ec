package com.chatguard.moderation.engine;

/**
 * The evaluating thread was interrupted; in-flight checks were cancelled.
 */
public class EvaluationCancelledException extends EvaluationException {

    public EvaluationCancelledException(String message) {
        super(message);
    }
}
