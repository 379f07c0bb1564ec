package com.chatguard.moderation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Communities an account is known to be in, and whether it can be messaged privately")
public class AccountMembership {

    @Schema(description = "Account identifier", example = "584930211")
    private String accountId;

    @Schema(description = "Role per community id")
    @Builder.Default
    private Map<String, MemberRole> communities = new LinkedHashMap<>();

    @Schema(description = "True once the account has opened a private chat with the bot", example = "true")
    private boolean privateChatOpen;

    @Schema(description = "Last update in epoch milliseconds", example = "1739886764000")
    private long updatedAt;

    public List<String> communityIds() {
        return List.copyOf(communities.keySet());
    }

    public boolean isAdminAnywhere() {
        return communities.values().stream().anyMatch(MemberRole::isAdmin);
    }
}
