package com.chatguard.moderation.service;

import com.chatguard.moderation.config.DetectionConfig;
import com.chatguard.moderation.engine.ScopeResolver;
import com.chatguard.moderation.model.Actor;
import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckConfigSnapshot;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.repository.CheckConfigRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Service layer for check configuration: global defaults and per-community
 * overrides. Starts the config cache refresh on startup.
 */
@Service
public class CheckConfigService {

    private final CheckConfigRepository repository;
    private final ScopeResolver scopeResolver;
    private final AuditService auditService;
    private final DetectionConfig detectionConfig;
    private final Clock clock;

    public CheckConfigService(CheckConfigRepository repository,
                              ScopeResolver scopeResolver,
                              AuditService auditService,
                              DetectionConfig detectionConfig,
                              Clock clock) {
        this.repository = repository;
        this.scopeResolver = scopeResolver;
        this.auditService = auditService;
        this.detectionConfig = detectionConfig;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        repository.startCacheRefresh(detectionConfig.getConfigCacheRefreshSeconds());
    }

    @PreDestroy
    public void shutdown() {
        repository.stopCacheRefresh();
    }

    public List<CheckConfig> getGlobalConfigs() {
        return repository.findByScope(null);
    }

    public List<CheckConfig> getCommunityOverrides(String communityId) {
        return repository.findByScope(communityId);
    }

    public CheckConfig getConfig(CheckName checkName, String communityId) {
        return repository.findById(checkName, communityId);
    }

    /**
     * The configuration each check would run with in this community.
     */
    public Map<CheckName, CheckConfig> getEffectiveConfigs(String communityId) {
        CheckConfigSnapshot snapshot = repository.snapshotFor(communityId);
        Map<CheckName, CheckConfig> effective = new EnumMap<>(CheckName.class);
        for (CheckName name : CheckName.values()) {
            scopeResolver.resolve(name, snapshot).ifPresent(c -> effective.put(name, c));
        }
        return effective;
    }

    /**
     * Create or replace a global record ({@code communityId} null) or a community override.
     */
    public CheckConfig save(CheckConfig config, String modifiedBy) {
        config.setModifiedBy(modifiedBy);
        config.setModifiedAt(clock.millis());
        repository.save(config);

        String scope = config.isGlobal() ? "global" : config.getCommunityId();
        auditService.record(Actor.admin(modifiedBy), scope, AuditAction.CHECK_CONFIG_CHANGED, "SAVED",
                String.format("%s enabled=%s useGlobal=%s threshold=%d alwaysRun=%s weight=%.2f",
                        config.getCheckName(), config.isEnabled(), config.isUseGlobal(),
                        config.getConfidenceThreshold(), config.isAlwaysRun(), config.getWeight()),
                config.getCommunityId());
        return config;
    }

    public boolean removeOverride(CheckName checkName, String communityId, String removedBy) {
        boolean deleted = repository.delete(checkName, communityId);
        if (deleted) {
            auditService.record(Actor.admin(removedBy), communityId, AuditAction.CHECK_CONFIG_CHANGED, "REMOVED",
                    checkName + " override removed", communityId);
        }
        return deleted;
    }
}
