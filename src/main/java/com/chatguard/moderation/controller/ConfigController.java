package com.chatguard.moderation.controller;

import com.chatguard.moderation.config.AerospikeConfig;
import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.config.ModerationConfig;
import com.chatguard.moderation.model.AggregationPolicy;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.model.CommunitySettings;
import com.chatguard.moderation.service.CheckConfigService;
import com.chatguard.moderation.service.CommunityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify runtime configuration (thresholds, checks, community settings)")
public class ConfigController {

    private final DetectionConfig detectionConfig;
    private final ModerationConfig moderationConfig;
    private final AerospikeConfig aerospikeConfig;
    private final CheckConfigService checkConfigService;
    private final CommunityService communityService;

    public ConfigController(DetectionConfig detectionConfig,
                            ModerationConfig moderationConfig,
                            AerospikeConfig aerospikeConfig,
                            CheckConfigService checkConfigService,
                            CommunityService communityService) {
        this.detectionConfig = detectionConfig;
        this.moderationConfig = moderationConfig;
        this.aerospikeConfig = aerospikeConfig;
        this.checkConfigService = checkConfigService;
        this.communityService = communityService;
    }

    // ── Thresholds ──

    @Operation(summary = "Get global detection thresholds")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("autoBanThreshold", detectionConfig.getAutoBanThreshold());
        response.put("reviewQueueThreshold", detectionConfig.getReviewQueueThreshold());
        response.put("maxConfidenceVetoThreshold", detectionConfig.getMaxConfidenceVetoThreshold());
        response.put("minMessageLength", detectionConfig.getMinMessageLength());
        response.put("trainingMode", detectionConfig.isTrainingMode());
        response.put("aggregationPolicy", detectionConfig.getAggregationPolicy());
        response.put("alwaysRunVotes", detectionConfig.isAlwaysRunVotes());
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Update global detection thresholds",
            description = "Changes apply to the next evaluation but reset on restart.")
    @PutMapping("/thresholds")
    public ResponseEntity<?> updateThresholds(@RequestBody Map<String, Object> body) {
        int autoBan = toInt(body, "autoBanThreshold", detectionConfig.getAutoBanThreshold());
        int review = toInt(body, "reviewQueueThreshold", detectionConfig.getReviewQueueThreshold());
        int veto = toInt(body, "maxConfidenceVetoThreshold", detectionConfig.getMaxConfidenceVetoThreshold());
        int minLength = toInt(body, "minMessageLength", detectionConfig.getMinMessageLength());
        boolean trainingMode = toBoolean(body, "trainingMode", detectionConfig.isTrainingMode());
        boolean alwaysRunVotes = toBoolean(body, "alwaysRunVotes", detectionConfig.isAlwaysRunVotes());

        AggregationPolicy policy = detectionConfig.getAggregationPolicy();
        Object rawPolicy = body.get("aggregationPolicy");
        if (rawPolicy != null) {
            try {
                policy = AggregationPolicy.valueOf(rawPolicy.toString().toUpperCase());
            } catch (IllegalArgumentException e) {
                return badRequest("Unknown aggregationPolicy: " + rawPolicy, "aggregationPolicy");
            }
        }

        if (review < 0 || review > 100) return badRequest("reviewQueueThreshold must be in [0, 100]", "reviewQueueThreshold");
        if (autoBan < 0 || autoBan > 100) return badRequest("autoBanThreshold must be in [0, 100]", "autoBanThreshold");
        if (review > autoBan) return badRequest("reviewQueueThreshold must not exceed autoBanThreshold", "reviewQueueThreshold");
        if (veto < 0 || veto > 100) return badRequest("maxConfidenceVetoThreshold must be in [0, 100]", "maxConfidenceVetoThreshold");
        if (minLength < 0) return badRequest("minMessageLength must be >= 0", "minMessageLength");

        detectionConfig.setAutoBanThreshold(autoBan);
        detectionConfig.setReviewQueueThreshold(review);
        detectionConfig.setMaxConfidenceVetoThreshold(veto);
        detectionConfig.setMinMessageLength(minLength);
        detectionConfig.setTrainingMode(trainingMode);
        detectionConfig.setAlwaysRunVotes(alwaysRunVotes);
        detectionConfig.setAggregationPolicy(policy);

        return getThresholds();
    }

    // ── Checks ──

    @Operation(summary = "List global check configurations")
    @GetMapping("/checks")
    public ResponseEntity<List<CheckConfig>> getGlobalChecks() {
        return ResponseEntity.ok(checkConfigService.getGlobalConfigs());
    }

    @Operation(summary = "Create or replace the global configuration of a check")
    @PutMapping("/checks/{checkName}")
    public ResponseEntity<?> saveGlobalCheck(
            @Parameter(description = "Check name", example = "STOP_WORDS")
            @PathVariable String checkName,
            @Parameter(description = "Admin making the change", example = "42")
            @RequestParam String modifiedBy,
            @RequestBody CheckConfig config) {
        return saveCheck(checkName, null, modifiedBy, config);
    }

    @Operation(summary = "List a community's check overrides")
    @GetMapping("/communities/{communityId}/checks")
    public ResponseEntity<List<CheckConfig>> getCommunityChecks(@PathVariable String communityId) {
        return ResponseEntity.ok(checkConfigService.getCommunityOverrides(communityId));
    }

    @Operation(summary = "Get the configuration every check runs with in a community",
            description = "Override or global record per check, after scope resolution. Checks without any record are absent.")
    @GetMapping("/communities/{communityId}/checks/effective")
    public ResponseEntity<Map<CheckName, CheckConfig>> getEffectiveChecks(@PathVariable String communityId) {
        return ResponseEntity.ok(checkConfigService.getEffectiveConfigs(communityId));
    }

    @Operation(summary = "Create or replace a community override of a check",
            description = "Set useGlobal=true to keep the override record but fall back to the global configuration.")
    @PutMapping("/communities/{communityId}/checks/{checkName}")
    public ResponseEntity<?> saveCommunityCheck(@PathVariable String communityId,
                                                @PathVariable String checkName,
                                                @RequestParam String modifiedBy,
                                                @RequestBody CheckConfig config) {
        return saveCheck(checkName, communityId, modifiedBy, config);
    }

    @Operation(summary = "Remove a community override of a check")
    @DeleteMapping("/communities/{communityId}/checks/{checkName}")
    public ResponseEntity<?> removeCommunityCheck(@PathVariable String communityId,
                                                  @PathVariable String checkName,
                                                  @RequestParam String modifiedBy) {
        CheckName name = parseCheckName(checkName);
        if (name == null) return badRequest("Unknown check: " + checkName, "checkName");
        if (!checkConfigService.removeOverride(name, communityId, modifiedBy)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    // ── Community Settings ──

    @Operation(summary = "List community settings")
    @GetMapping("/communities")
    public ResponseEntity<List<CommunitySettings>> getCommunities() {
        return ResponseEntity.ok(communityService.getAllSettings());
    }

    @Operation(summary = "Get a community's settings")
    @GetMapping("/communities/{communityId}")
    public ResponseEntity<CommunitySettings> getCommunity(@PathVariable String communityId) {
        CommunitySettings settings = communityService.getSettings(communityId);
        if (settings == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(settings);
    }

    @Operation(summary = "Update a community's settings",
            description = "Training mode and admin alerts. Unspecified fields keep their current value.")
    @PutMapping("/communities/{communityId}")
    public ResponseEntity<CommunitySettings> updateCommunity(@PathVariable String communityId,
                                                             @RequestBody Map<String, Object> body) {
        CommunitySettings settings = communityService.getSettings(communityId);
        if (settings == null) {
            settings = CommunitySettings.builder().communityId(communityId).build();
        }
        Object title = body.get("title");
        if (title != null) {
            settings.setTitle(title.toString());
        }
        settings.setTrainingMode(toBoolean(body, "trainingMode", settings.isTrainingMode()));
        settings.setAdminAlerts(toBoolean(body, "adminAlerts", settings.isAdminAlerts()));
        return ResponseEntity.ok(communityService.saveSettings(settings));
    }

    // ── Moderation ──

    @Operation(summary = "Get moderation settings (read-only)")
    @GetMapping("/moderation")
    public ResponseEntity<Map<String, Object>> getModerationConfig() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("maxConcurrentCommunities", moderationConfig.getMaxConcurrentCommunities());
        response.put("communityCallTimeoutMs", moderationConfig.getCommunityCallTimeoutMs());
        response.put("executeDeadlineMs", moderationConfig.getExecuteDeadlineMs());
        response.put("deleteMessageOnAutoBan", moderationConfig.isDeleteMessageOnAutoBan());
        response.put("retentionDays", moderationConfig.getRetentionDays());
        response.put("expirySweepIntervalSeconds", moderationConfig.getExpiry().getSweepIntervalSeconds());
        return ResponseEntity.ok(response);
    }

    // ── Aerospike (read-only) ──

    @Operation(summary = "Get Aerospike connection info (read-only)")
    @GetMapping("/aerospike")
    public ResponseEntity<Map<String, Object>> getAerospikeInfo() {
        return ResponseEntity.ok(Map.of(
                "host", aerospikeConfig.getHost(),
                "port", aerospikeConfig.getPort(),
                "namespace", aerospikeConfig.getNamespace()
        ));
    }

    // ── Helpers ──

    private ResponseEntity<?> saveCheck(String checkName, String communityId, String modifiedBy, CheckConfig config) {
        CheckName name = parseCheckName(checkName);
        if (name == null) return badRequest("Unknown check: " + checkName, "checkName");
        if (config.getConfidenceThreshold() < 0 || config.getConfidenceThreshold() > 100) {
            return badRequest("confidenceThreshold must be in [0, 100]", "confidenceThreshold");
        }
        if (config.getWeight() < 0) return badRequest("weight must be >= 0", "weight");
        if (config.getTimeoutMs() < 0) return badRequest("timeoutMs must be >= 0", "timeoutMs");
        if (communityId == null && config.isUseGlobal()) {
            return badRequest("useGlobal only applies to community overrides", "useGlobal");
        }

        config.setCheckName(name);
        config.setCommunityId(communityId);
        if (config.getParams() == null) {
            config.setParams(new HashMap<>());
        }
        return ResponseEntity.ok(checkConfigService.save(config, modifiedBy));
    }

    private CheckName parseCheckName(String value) {
        try {
            return CheckName.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}
