package com.chatguard.moderation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.chatguard.moderation.config.AerospikeConfig;
import com.chatguard.moderation.model.CommunitySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class CommunityRepository {

    private static final Logger log = LoggerFactory.getLogger(CommunityRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public CommunityRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(CommunitySettings settings) {
        Key key = new Key(namespace, AerospikeConfig.SET_COMMUNITIES, settings.getCommunityId());
        client.put(writePolicy, key,
                new Bin("communityId", settings.getCommunityId()),
                new Bin("title", settings.getTitle() != null ? settings.getTitle() : ""),
                new Bin("trainingMode", settings.isTrainingMode()),
                new Bin("adminAlerts", settings.isAdminAlerts()),
                new Bin("updatedAt", settings.getUpdatedAt()));
    }

    public CommunitySettings findById(String communityId) {
        Key key = new Key(namespace, AerospikeConfig.SET_COMMUNITIES, communityId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public boolean isTrainingMode(String communityId) {
        CommunitySettings settings = findById(communityId);
        return settings != null && settings.isTrainingMode();
    }

    public List<CommunitySettings> findAll() {
        List<CommunitySettings> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_COMMUNITIES,
                (key, record) -> {
                    try {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read community record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private CommunitySettings mapRecord(Record record) {
        return CommunitySettings.builder()
                .communityId(record.getString("communityId"))
                .title(record.getString("title"))
                .trainingMode(record.getBoolean("trainingMode"))
                .adminAlerts(record.getBoolean("adminAlerts"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
