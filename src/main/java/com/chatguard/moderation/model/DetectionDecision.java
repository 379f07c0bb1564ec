package com.chatguard.moderation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@Schema(description = "Aggregated outcome of evaluating one message version against the content checks")
public class DetectionDecision {

    @Schema(description = "Decision identifier: messageId plus edit version", example = "-1001234567890:4521:v0")
    private String decisionId;

    @Schema(description = "Evaluated message", example = "-1001234567890:4521")
    private String messageId;

    @Schema(description = "Community the message was posted in", example = "-1001234567890")
    private String communityId;

    @Schema(description = "Author account", example = "584930211")
    private String accountId;

    @Schema(description = "Evaluation timestamp in epoch milliseconds", example = "1739886764000")
    private long evaluatedAt;

    @Schema(description = "Overall verdict", example = "SPAM")
    private Verdict verdict;

    @Schema(description = "Net confidence used for enforcement (0-100)", example = "90")
    private int netConfidence;

    @Schema(description = "Net confidence including always-run checks (0-100), used for accuracy tracking", example = "90")
    private int accuracyConfidence;

    @Schema(description = "Individual check results")
    private List<CheckResult> checkResults;

    @Schema(description = "How the detection was triggered", example = "AUTOMATIC")
    private DetectionSource source;

    @Schema(description = "Message edit version this decision belongs to", example = "0")
    private int editVersion;

    @Schema(description = "Classification result", example = "AUTO_BAN")
    private DetectionAction action;

    @Schema(description = "True when automatic enforcement was downgraded to review by the short-message veto", example = "false")
    private boolean vetoed;

    @Schema(description = "True when enforcement was suppressed by training mode", example = "false")
    private boolean trainingMode;

    @Schema(description = "True when a later edit of the same message had already been evaluated", example = "false")
    private boolean superseded;

    @Schema(description = "Whether this decision feeds the training corpus", example = "true")
    private boolean trainingEligible;

    @Schema(description = "Result of the automatic ban, present only on the response that triggered it")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private ActionOutcome enforcement;
}
