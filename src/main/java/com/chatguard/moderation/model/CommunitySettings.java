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
@Schema(description = "Per-community moderation settings")
public class CommunitySettings {

    @Schema(description = "Community identifier", example = "-1001234567890")
    private String communityId;

    @Schema(description = "Display title", example = "Rust Learners")
    private String title;

    @Schema(description = "Record decisions but never enforce them", example = "false")
    private boolean trainingMode;

    @Schema(description = "Send community admins a private alert on automatic bans", example = "true")
    private boolean adminAlerts;

    @Schema(description = "Last update in epoch milliseconds", example = "1739886764000")
    private long updatedAt;
}
