package com.chatguard.moderation.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reviewed item, plus the ban outcome when the reviewer asked to ban the author.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewFeedbackResult(ReviewQueueItem item, boolean applied, ActionOutcome enforcement) {
}
