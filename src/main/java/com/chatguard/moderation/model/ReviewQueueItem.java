package com.chatguard.moderation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A message waiting for a moderator's verdict")
public class ReviewQueueItem {

    @Schema(description = "Decision under review", example = "-1001234567890:4521:v0")
    private String decisionId;

    @Schema(description = "Reviewed message", example = "-1001234567890:4521")
    private String messageId;

    @Schema(description = "Community the message was posted in", example = "-1001234567890")
    private String communityId;

    @Schema(description = "Author account", example = "584930211")
    private String accountId;

    @Schema(description = "Net confidence of the decision", example = "62")
    private int netConfidence;

    @Schema(description = "Checks that voted SPAM", example = "[\"STOP_WORDS\", \"BAYES\"]")
    private List<String> spamChecks;

    @Schema(description = "Message text", example = "Earn 500$ a day, DM me")
    private String text;

    @Schema(description = "Enqueue time in epoch milliseconds", example = "1739886764000")
    private long enqueuedAt;

    @Schema(description = "Review status", example = "PENDING")
    private ReviewStatus status;

    @Schema(description = "Review time in epoch milliseconds; 0 while pending", example = "0")
    private long reviewedAt;

    @Schema(description = "Reviewer", example = "42")
    private String reviewedBy;
}
