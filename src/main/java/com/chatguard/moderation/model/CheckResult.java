package com.chatguard.moderation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Verdict of a single content check")
public class CheckResult {

    @Schema(description = "Check that produced this result", example = "STOP_WORDS")
    CheckName checkName;

    @Schema(description = "Check verdict", example = "SPAM")
    Verdict verdict;

    @Schema(description = "Confidence in the verdict (0-100)", example = "70")
    int confidence;

    @Schema(description = "Aggregation weight taken from the check's configuration", example = "1.0")
    @Builder.Default
    double weight = 1.0;

    @Schema(description = "Time the check took in milliseconds", example = "12")
    long durationMs;

    @Schema(description = "True when the check failed or timed out and does not vote", example = "false")
    boolean abstained;

    @Schema(description = "True when the check ran only because it is always-run; feeds accuracy tracking only",
            example = "false")
    boolean accuracyOnly;

    @Schema(description = "Human-readable explanation", example = "Matched stop words: airdrop, crypto")
    String details;

    public static CheckResult spam(CheckName checkName, int confidence, String details) {
        return CheckResult.builder()
                .checkName(checkName)
                .verdict(Verdict.SPAM)
                .confidence(Math.max(0, Math.min(100, confidence)))
                .details(details)
                .build();
    }

    public static CheckResult clean(CheckName checkName, String details) {
        return CheckResult.builder()
                .checkName(checkName)
                .verdict(Verdict.CLEAN)
                .confidence(0)
                .details(details)
                .build();
    }

    /**
     * Neutral result for a check that could not produce a verdict.
     */
    public static CheckResult abstain(CheckName checkName, String details, long durationMs) {
        return CheckResult.builder()
                .checkName(checkName)
                .verdict(Verdict.CLEAN)
                .confidence(0)
                .abstained(true)
                .durationMs(durationMs)
                .details(details)
                .build();
    }

    public boolean votesSpam() {
        return !abstained && verdict == Verdict.SPAM;
    }
}
