package com.chatguard.moderation.controller;

import com.chatguard.moderation.model.AccountMembership;
import com.chatguard.moderation.model.MemberRole;
import com.chatguard.moderation.service.CommunityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Membership events reported by the platform adapter. Bans do not remove
 * membership; only voluntary leaves are reported as departures.
 */
@RestController
@RequestMapping("/api/v1/memberships")
@Tag(name = "Memberships", description = "Track which communities an account is in")
public class MembershipController {

    private final CommunityService communityService;

    public MembershipController(CommunityService communityService) {
        this.communityService = communityService;
    }

    @Operation(summary = "Get an account's known communities")
    @GetMapping("/{accountId}")
    public ResponseEntity<AccountMembership> getMembership(
            @Parameter(description = "Account ID", example = "123456789")
            @PathVariable String accountId) {
        return ResponseEntity.ok(communityService.getMembership(accountId));
    }

    @Operation(summary = "Record that an account is present in a community",
            description = "Called on join, on any message and on role changes. Role defaults to MEMBER.")
    @PutMapping("/{accountId}/communities/{communityId}")
    public ResponseEntity<?> recordPresence(@PathVariable String accountId,
                                            @PathVariable String communityId,
                                            @RequestBody(required = false) Map<String, Object> body) {
        MemberRole role = MemberRole.MEMBER;
        if (body != null && body.get("role") != null) {
            try {
                role = MemberRole.valueOf(body.get("role").toString().toUpperCase());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown role: " + body.get("role"), "field", "role"));
            }
        }
        return ResponseEntity.ok(communityService.recordPresence(accountId, communityId, role));
    }

    @Operation(summary = "Record that an account left a community")
    @DeleteMapping("/{accountId}/communities/{communityId}")
    public ResponseEntity<AccountMembership> recordDeparture(@PathVariable String accountId,
                                                             @PathVariable String communityId) {
        return ResponseEntity.ok(communityService.recordDeparture(accountId, communityId));
    }

    @Operation(summary = "Record that an account opened a private chat with the bot",
            description = "Notifications are sent privately from then on.")
    @PostMapping("/{accountId}/private-chat")
    public ResponseEntity<AccountMembership> markPrivateChatOpen(@PathVariable String accountId) {
        return ResponseEntity.ok(communityService.markPrivateChatOpen(accountId));
    }
}
