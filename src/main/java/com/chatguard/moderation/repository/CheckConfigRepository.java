package com.chatguard.moderation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.chatguard.moderation.config.AerospikeConfig;
import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckConfigSnapshot;
import com.chatguard.moderation.model.CheckName;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-check configuration, one record per (scope, check). The global scope
 * is stored under the scope key {@value #GLOBAL_SCOPE}.
 */
@Repository
public class CheckConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(CheckConfigRepository.class);

    static final String GLOBAL_SCOPE = "global";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    // scope -> check -> config, swapped wholesale on refresh
    private final AtomicReference<Map<String, Map<CheckName, CheckConfig>>> cache =
            new AtomicReference<>(Collections.emptyMap());

    private ScheduledExecutorService scheduler;

    public CheckConfigRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public synchronized void startCacheRefresh(int intervalSeconds) {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "check-config-refresh");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refreshCache, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    public synchronized void stopCacheRefresh() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    public void refreshCache() {
        try {
            Map<String, Map<CheckName, CheckConfig>> byScope = new HashMap<>();
            for (CheckConfig config : scanAll()) {
                byScope.computeIfAbsent(scopeOf(config.getCommunityId()), s -> new EnumMap<>(CheckName.class))
                        .put(config.getCheckName(), config);
            }
            cache.set(byScope);
            log.debug("Check config cache refreshed, {} scopes loaded", byScope.size());
        } catch (Exception e) {
            log.error("Failed to refresh check config cache", e);
        }
    }

    /**
     * Both configuration levels for one community, taken from the cache.
     */
    public CheckConfigSnapshot snapshotFor(String communityId) {
        Map<String, Map<CheckName, CheckConfig>> current = cache.get();
        Map<CheckName, CheckConfig> globals = current.getOrDefault(GLOBAL_SCOPE, Collections.emptyMap());
        Map<CheckName, CheckConfig> overrides = communityId != null
                ? current.getOrDefault(scopeOf(communityId), Collections.emptyMap())
                : Collections.emptyMap();
        return new CheckConfigSnapshot(communityId, globals, overrides);
    }

    public List<CheckConfig> findByScope(String communityId) {
        return new ArrayList<>(cache.get()
                .getOrDefault(scopeOf(communityId), Collections.emptyMap())
                .values());
    }

    public CheckConfig findById(CheckName checkName, String communityId) {
        Key key = key(checkName, communityId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<CheckConfig> findAll() {
        return scanAll();
    }

    public void save(CheckConfig config) {
        Key key = key(config.getCheckName(), config.getCommunityId());

        Bin checkNameBin = new Bin("checkName", config.getCheckName().name());
        Bin communityBin = new Bin("communityId", config.isGlobal() ? "" : config.getCommunityId());
        Bin enabledBin = new Bin("enabled", config.isEnabled());
        Bin useGlobalBin = new Bin("useGlobal", config.isUseGlobal());
        Bin thresholdBin = new Bin("confThreshold", config.getConfidenceThreshold());
        Bin alwaysRunBin = new Bin("alwaysRun", config.isAlwaysRun());
        Bin weightBin = new Bin("weight", config.getWeight());
        Bin timeoutBin = new Bin("timeoutMs", config.getTimeoutMs());
        Bin paramsBin = new Bin("params", serializeParams(config.getParams()));
        Bin modifiedByBin = new Bin("modifiedBy", config.getModifiedBy() != null ? config.getModifiedBy() : "");
        Bin modifiedAtBin = new Bin("modifiedAt", config.getModifiedAt());

        client.put(writePolicy, key,
                checkNameBin, communityBin, enabledBin, useGlobalBin, thresholdBin,
                alwaysRunBin, weightBin, timeoutBin, paramsBin, modifiedByBin, modifiedAtBin);

        refreshCache();
    }

    public boolean delete(CheckName checkName, String communityId) {
        boolean deleted = client.delete(writePolicy, key(checkName, communityId));
        if (deleted) {
            refreshCache();
        }
        return deleted;
    }

    private List<CheckConfig> scanAll() {
        List<CheckConfig> configs = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CHECK_CONFIGS,
                (key, record) -> {
                    try {
                        synchronized (configs) {
                            configs.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize check config record: {}", e.getMessage());
                    }
                });
        return configs;
    }

    private Key key(CheckName checkName, String communityId) {
        return new Key(namespace, AerospikeConfig.SET_CHECK_CONFIGS, scopeOf(communityId) + ":" + checkName.name());
    }

    private static String scopeOf(String communityId) {
        return communityId == null || communityId.isEmpty() ? GLOBAL_SCOPE : communityId;
    }

    private CheckConfig mapRecord(Record record) {
        String communityId = record.getString("communityId");
        String modifiedBy = record.getString("modifiedBy");
        return CheckConfig.builder()
                .checkName(CheckName.valueOf(record.getString("checkName")))
                .communityId(communityId != null && !communityId.isEmpty() ? communityId : null)
                .enabled(record.getBoolean("enabled"))
                .useGlobal(record.getBoolean("useGlobal"))
                .confidenceThreshold(record.getInt("confThreshold"))
                .alwaysRun(record.getBoolean("alwaysRun"))
                .weight(record.getDouble("weight"))
                .timeoutMs(record.getLong("timeoutMs"))
                .params(deserializeParams(record.getString("params")))
                .modifiedBy(modifiedBy != null && !modifiedBy.isEmpty() ? modifiedBy : null)
                .modifiedAt(record.getLong("modifiedAt"))
                .build();
    }

    private String serializeParams(Map<String, String> params) {
        try {
            return objectMapper.writeValueAsString(params != null ? params : Collections.emptyMap());
        } catch (Exception e) {
            return "{}";
        }
    }

    private Map<String, String> deserializeParams(String json) {
        if (json == null || json.isEmpty()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, String>>() {});
        } catch (Exception e) {
            return new HashMap<>();
        }
    }
}
