package com.chatguard.moderation.controller;

import com.chatguard.moderation.model.ActionKind;
import com.chatguard.moderation.model.ActionOutcome;
import com.chatguard.moderation.model.ActionRecord;
import com.chatguard.moderation.model.Actor;
import com.chatguard.moderation.model.EnforcementIntent;
import com.chatguard.moderation.repository.ActionRecordRepository;
import com.chatguard.moderation.service.ModerationOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Manual moderation actions issued by community admins. Every endpoint builds
 * an enforcement intent and hands it to the orchestrator; the outcome is
 * returned as-is with a status code derived from it.
 */
@RestController
@RequestMapping("/api/v1/moderation")
@Tag(name = "Moderation", description = "Ban, mute, trust and reverse actions across every community an account is in")
public class ModerationController {

    private final ModerationOrchestrator orchestrator;
    private final ActionRecordRepository actionRecordRepository;

    public ModerationController(ModerationOrchestrator orchestrator,
                                ActionRecordRepository actionRecordRepository) {
        this.orchestrator = orchestrator;
        this.actionRecordRepository = actionRecordRepository;
    }

    // ── Restrictions ──

    @Operation(summary = "Ban an account permanently",
            description = "Bans the account in every community it is a member of. Revokes trust.")
    @PostMapping("/ban")
    public ResponseEntity<?> ban(@RequestBody Map<String, Object> body) {
        return execute(ActionKind.BAN, body);
    }

    @Operation(summary = "Ban an account for a limited time",
            description = "Requires durationSeconds. The ban is lifted by the expiry reconciler.")
    @PostMapping("/tempban")
    public ResponseEntity<?> tempBan(@RequestBody Map<String, Object> body) {
        return execute(ActionKind.TEMP_BAN, body);
    }

    @Operation(summary = "Mute an account for a limited time",
            description = "Requires durationSeconds. The account is unmuted by the expiry reconciler.")
    @PostMapping("/mute")
    public ResponseEntity<?> mute(@RequestBody Map<String, Object> body) {
        return execute(ActionKind.MUTE, body);
    }

    @Operation(summary = "Lift an active ban",
            description = "Set restoreTrust to re-trust the account afterwards.")
    @PostMapping("/unban")
    public ResponseEntity<?> unban(@RequestBody Map<String, Object> body) {
        return execute(ActionKind.UNBAN, body);
    }

    // ── Trust ──

    @Operation(summary = "Trust an account",
            description = "Trusted accounts only run always-run checks.")
    @PostMapping("/trust")
    public ResponseEntity<?> trust(@RequestBody Map<String, Object> body) {
        return execute(ActionKind.TRUST, body);
    }

    @Operation(summary = "Remove trust from an account")
    @PostMapping("/untrust")
    public ResponseEntity<?> untrust(@RequestBody Map<String, Object> body) {
        return execute(ActionKind.UNTRUST, body);
    }

    // ── History ──

    @Operation(summary = "List action records for an account",
            description = "Every recorded action, active or not, newest first.")
    @GetMapping("/accounts/{accountId}/actions")
    public ResponseEntity<List<ActionRecord>> getActions(
            @Parameter(description = "Account ID", example = "123456789")
            @PathVariable String accountId) {
        return ResponseEntity.ok(actionRecordRepository.findByAccountId(accountId));
    }

    // ── Helpers ──

    private ResponseEntity<?> execute(ActionKind kind, Map<String, Object> body) {
        String accountId = toStr(body, "accountId");
        String executorId = toStr(body, "executorId");
        if (accountId == null) return badRequest("accountId is required", "accountId");
        if (executorId == null) return badRequest("executorId is required", "executorId");

        Long durationSeconds = toLong(body, "durationSeconds", 0);
        if (durationSeconds == null) return badRequest("durationSeconds must be a whole number", "durationSeconds");
        if (durationSeconds < 0) return badRequest("durationSeconds must be >= 0", "durationSeconds");

        EnforcementIntent intent = EnforcementIntent.builder()
                .targetAccountId(accountId)
                .executor(Actor.admin(executorId))
                .kind(kind)
                .duration(durationSeconds > 0 ? Duration.ofSeconds(durationSeconds) : null)
                .reason(toStr(body, "reason"))
                .originMessageId(toStr(body, "originMessageId"))
                .originCommunityId(toStr(body, "originCommunityId"))
                .restoreTrust(Boolean.TRUE.equals(body.get("restoreTrust")))
                .build();

        ActionOutcome outcome = orchestrator.execute(intent);
        switch (outcome.getStatus()) {
            case REJECTED:
                return ResponseEntity.badRequest().body(outcome);
            case FAILED:
                return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(outcome);
            case CANCELLED:
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(outcome);
            default:
                return ResponseEntity.ok(outcome);
        }
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private String toStr(Map<String, Object> body, String key) {
        Object v = body.get(key);
        if (v == null) return null;
        String s = v.toString();
        return s.isBlank() ? null : s;
    }

    /**
     * @return the value, {@code defaultVal} when absent, or null when present but not a whole number
     */
    private Long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Integer || v instanceof Long) return ((Number) v).longValue();
        if (v instanceof Number) return null;
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
