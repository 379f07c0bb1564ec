package com.chatguard.moderation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.chatguard.moderation.config.AerospikeConfig;
import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.model.AuditEntry;
import com.chatguard.moderation.model.PagedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only: entries are created with CREATE_ONLY and never updated.
 */
@Repository
public class AuditLogRepository {

    private static final Logger log = LoggerFactory.getLogger(AuditLogRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;
    private final WritePolicy writePolicy;

    public AuditLogRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.createOnlyPolicy = new WritePolicy(writePolicy);
        this.createOnlyPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
    }

    public void append(AuditEntry entry) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_LOG, entry.getEntryId());

        client.put(createOnlyPolicy, key,
                new Bin("entryId", entry.getEntryId()),
                new Bin("actor", entry.getActor()),
                new Bin("target", entry.getTarget() != null ? entry.getTarget() : ""),
                new Bin("action", entry.getAction().name()),
                new Bin("outcome", entry.getOutcome()),
                new Bin("details", entry.getDetails() != null ? entry.getDetails() : ""),
                new Bin("communityId", entry.getCommunityId() != null ? entry.getCommunityId() : ""),
                new Bin("timestamp", entry.getTimestamp()));
    }

    public PagedResponse<AuditEntry> findByTarget(String target, AuditAction action, int limit, Long before) {
        List<AuditEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOG,
                (key, record) -> {
                    try {
                        if (!target.equals(record.getString("target"))) return;
                        if (action != null && !action.name().equals(record.getString("action"))) return;
                        if (before != null && record.getLong("timestamp") >= before) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AuditEntry::getTimestamp).reversed());
        return PagedResponse.of(results, limit, AuditEntry::getTimestamp);
    }

    /**
     * Bulk retention cleanup, the only way entries leave the log.
     */
    public int deleteOlderThan(long cutoff) {
        List<Key> expired = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOG,
                (key, record) -> {
                    if (record.getLong("timestamp") < cutoff) {
                        synchronized (expired) {
                            expired.add(key);
                        }
                    }
                });

        int deleted = 0;
        for (Key key : expired) {
            if (client.delete(writePolicy, key)) {
                deleted++;
            }
        }
        return deleted;
    }

    private AuditEntry mapRecord(Record record) {
        String communityId = record.getString("communityId");
        return AuditEntry.builder()
                .entryId(record.getString("entryId"))
                .actor(record.getString("actor"))
                .target(record.getString("target"))
                .action(AuditAction.valueOf(record.getString("action")))
                .outcome(record.getString("outcome"))
                .details(record.getString("details"))
                .communityId(communityId != null && !communityId.isEmpty() ? communityId : null)
                .timestamp(record.getLong("timestamp"))
                .build();
    }
}
