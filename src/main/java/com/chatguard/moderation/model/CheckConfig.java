package com.chatguard.moderation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Configuration of one content check, either the global default or a community override")
public class CheckConfig {

    @Schema(description = "Check this configuration applies to", example = "STOP_WORDS")
    private CheckName checkName;

    @Schema(description = "Community the override belongs to; null for the global record", example = "-1001234567890")
    private String communityId;

    @Schema(description = "Whether the check runs and votes", example = "true")
    private boolean enabled;

    @Schema(description = "On a community override: ignore every other field and use the global record", example = "false")
    private boolean useGlobal;

    @Schema(description = "Minimum confidence (0-100) at which the check reports SPAM", example = "50")
    private int confidenceThreshold;

    @Schema(description = "Run even when disabled, for accuracy tracking only", example = "false")
    private boolean alwaysRun;

    @Schema(description = "Weight applied to the check's confidence during aggregation", example = "1.0")
    @Builder.Default
    private double weight = 1.0;

    @Schema(description = "Per-check timeout in milliseconds; 0 uses the engine default", example = "3000")
    private long timeoutMs;

    @Schema(description = "Check-specific parameters")
    @Builder.Default
    private Map<String, String> params = new HashMap<>();

    @Schema(description = "Who last modified this configuration", example = "admin:42")
    private String modifiedBy;

    @Schema(description = "Last modification time in epoch milliseconds", example = "1739886764000")
    private long modifiedAt;

    @JsonIgnore
    public boolean isGlobal() {
        return communityId == null || communityId.isEmpty();
    }

    public double doubleParam(String key, double defaultVal) {
        String v = params != null ? params.get(key) : null;
        if (v == null) return defaultVal;
        try { return Double.parseDouble(v); } catch (NumberFormatException e) { return defaultVal; }
    }

    public int intParam(String key, int defaultVal) {
        String v = params != null ? params.get(key) : null;
        if (v == null) return defaultVal;
        try { return Integer.parseInt(v); } catch (NumberFormatException e) { return defaultVal; }
    }
}
