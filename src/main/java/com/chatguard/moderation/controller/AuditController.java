package com.chatguard.moderation.controller;

import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.model.AuditEntry;
import com.chatguard.moderation.model.PagedResponse;
import com.chatguard.moderation.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit", description = "Read the audit trail of detection decisions and moderation actions")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @Operation(summary = "List audit entries about an account",
            description = "Newest first. Supports cursor-based pagination and an optional action filter.")
    @GetMapping("/accounts/{accountId}")
    public ResponseEntity<?> getByAccount(
            @Parameter(description = "Account ID", example = "123456789")
            @PathVariable String accountId,
            @Parameter(description = "Only entries of this action", example = "BAN")
            @RequestParam(required = false) String action,
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Cursor: return entries with timestamp before this value")
            @RequestParam(required = false) Long before) {
        AuditAction auditAction = null;
        if (action != null) {
            try {
                auditAction = AuditAction.valueOf(action.toUpperCase());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown action: " + action));
            }
        }
        PagedResponse<AuditEntry> entries = auditService.findByTarget(accountId, auditAction, limit, before);
        return ResponseEntity.ok(entries);
    }
}
