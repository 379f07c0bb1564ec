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
@Schema(description = "A chat message submitted for spam evaluation")
public class ContentMessage {

    @Schema(description = "Platform message identifier, unique per community", example = "-1001234567890:4521")
    private String messageId;

    @Schema(description = "Community (group chat) identifier", example = "-1001234567890")
    private String communityId;

    @Schema(description = "Author account identifier", example = "584930211")
    private String accountId;

    @Schema(description = "Message text (caption for media messages)", example = "Free crypto airdrop, DM me now")
    private String text;

    @Schema(description = "Edit version: 0 for the original message, incremented by the platform on every edit", example = "0")
    private int editVersion;

    @Schema(description = "AUTOMATIC for live traffic, MANUAL when an admin reported the message", example = "AUTOMATIC")
    @Builder.Default
    private DetectionSource source = DetectionSource.AUTOMATIC;

    @Schema(description = "Send time in epoch milliseconds. Defaults to current time if not provided.", example = "1739886764000")
    private long sentAt;
}
