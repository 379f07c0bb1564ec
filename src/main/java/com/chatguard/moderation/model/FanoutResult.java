package com.chatguard.moderation.model;

import java.util.List;

/**
 * Per-community results of one fan-out. {@code firstError} is the first failure in community order.
 */
public record FanoutResult(List<String> succeeded, List<String> failed, String firstError, boolean cancelled) {

    public int successCount() {
        return succeeded.size();
    }

    public int failureCount() {
        return failed.size();
    }

    public boolean allFailed() {
        return succeeded.isEmpty() && !failed.isEmpty();
    }
}
