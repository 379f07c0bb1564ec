package com.chatguard.moderation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A labelled message used to train statistical checks")
public class TrainingSample {

    @Schema(description = "Decision the sample came from", example = "-1001234567890:4521:v0")
    private String decisionId;

    @Schema(description = "Message text", example = "Free crypto airdrop, DM me now")
    private String text;

    @Schema(description = "Label", example = "SPAM")
    private TrainingLabel label;

    @Schema(description = "Whether a human provided the label", example = "EXPLICIT")
    private SampleSource source;

    @Schema(description = "Community of the original message", example = "-1001234567890")
    private String communityId;

    @Schema(description = "Who labelled the sample", example = "ADMIN:42")
    private String labeledBy;

    @Schema(description = "Creation time in epoch milliseconds", example = "1739886764000")
    private long createdAt;
}
