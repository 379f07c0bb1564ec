package com.chatguard.moderation.model;

/**
 * How individual check confidences combine into the net confidence.
 * Only SPAM verdicts contribute; abstaining results never do.
 */
public enum AggregationPolicy {
    /** Highest confidence x weight among SPAM verdicts. */
    WEIGHTED_MAX,
    /** Sum of confidence x weight over SPAM verdicts. */
    ADDITIVE,
    /** Weighted mean over SPAM verdicts. */
    WEIGHTED_AVERAGE
}
