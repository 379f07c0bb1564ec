package com.chatguard.moderation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.Value;
import com.aerospike.client.cdt.ListOperation;
import com.aerospike.client.cdt.ListOrder;
import com.aerospike.client.cdt.ListPolicy;
import com.aerospike.client.cdt.ListReturnType;
import com.aerospike.client.cdt.ListWriteFlags;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.chatguard.moderation.config.AerospikeConfig;
import com.chatguard.moderation.model.ActionKind;
import com.chatguard.moderation.model.ActionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Action records, one Aerospike record each, plus a per-account index record
 * listing the account's record ids. Account lookups read the index and batch-get
 * the records; only the expiry sweep and retention cleanup scan the set.
 */
@Repository
public class ActionRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(ActionRecordRepository.class);

    private static final String BIN_RECORD_IDS = "recordIds";
    private static final ListPolicy UNIQUE_IDS =
            new ListPolicy(ListOrder.UNORDERED, ListWriteFlags.ADD_UNIQUE | ListWriteFlags.NO_FAIL);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final BatchPolicy batchPolicy = new BatchPolicy();

    public ActionRecordRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(ActionRecord record) {
        Key key = recordKey(record.getRecordId());

        client.put(writePolicy, key,
                new Bin("recordId", record.getRecordId()),
                new Bin("accountId", record.getAccountId()),
                new Bin("kind", record.getKind().name()),
                new Bin("issuedBy", record.getIssuedBy()),
                new Bin("issuedAt", record.getIssuedAt()),
                new Bin("expiresAt", record.getExpiresAt()),
                new Bin("reason", record.getReason() != null ? record.getReason() : ""),
                new Bin("originMsgId", record.getOriginMessageId() != null ? record.getOriginMessageId() : ""),
                new Bin("reversedAt", record.getReversedAt()),
                new Bin("reversedBy", record.getReversedBy() != null ? record.getReversedBy() : ""),
                new Bin("claimedBy", record.getClaimedBy() != null ? record.getClaimedBy() : ""),
                new Bin("claimedAt", record.getClaimedAt()));

        client.operate(writePolicy, indexKey(record.getAccountId()),
                ListOperation.append(UNIQUE_IDS, BIN_RECORD_IDS, Value.get(record.getRecordId())));
    }

    public ActionRecord findById(String recordId) {
        Record record = client.get(readPolicy, recordKey(recordId));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Records of the given kinds for an account that are active at {@code now}, newest first.
     */
    public List<ActionRecord> findActive(String accountId, List<ActionKind> kinds, long now) {
        return forAccount(accountId, r -> kinds.contains(r.getKind()) && r.isActiveAt(now));
    }

    /**
     * Records of the given kinds for an account that nobody has reversed yet,
     * whether still active or expired and waiting for the sweep. Newest first.
     */
    public List<ActionRecord> findUnreversed(String accountId, List<ActionKind> kinds) {
        return forAccount(accountId, r -> kinds.contains(r.getKind()) && r.getReversedAt() == 0);
    }

    public List<ActionRecord> findByAccountId(String accountId) {
        return forAccount(accountId, r -> true);
    }

    /**
     * Timed records whose expiry has passed and that nobody has reversed yet.
     */
    public List<ActionRecord> findExpiredUnreversed(long now) {
        List<ActionRecord> results = scan(r -> !r.isPermanent()
                && r.getExpiresAt() <= now
                && r.getReversedAt() == 0);
        results.sort(Comparator.comparingLong(ActionRecord::getExpiresAt));
        return results;
    }

    /**
     * Claim a record for reversal. Succeeds only if the record is unchanged since
     * it was read (same generation), is not reversed, and carries no live claim.
     *
     * @return true if this caller now owns the record
     */
    public boolean tryClaim(ActionRecord record, String owner, long now, long leaseMs) {
        if (record.getReversedAt() > 0 || record.isClaimedAt(now, leaseMs)) {
            return false;
        }

        Key key = recordKey(record.getRecordId());
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = record.getGeneration();
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;

        try {
            client.put(policy, key, new Bin("claimedBy", owner), new Bin("claimedAt", now));
            record.setClaimedBy(owner);
            record.setClaimedAt(now);
            record.setGeneration(record.getGeneration() + 1);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR
                    || e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) {
                log.debug("Lost claim on action record {}: {}", record.getRecordId(), e.getMessage());
                return false;
            }
            throw e;
        }
    }

    /**
     * Persist a reversal. Conditional on the generation the caller holds, so a
     * record changed underneath (reversed manually, claimed elsewhere) is left alone.
     *
     * @return true if the reversal was written
     */
    public boolean markReversed(ActionRecord record) {
        Key key = recordKey(record.getRecordId());
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = record.getGeneration();
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;

        try {
            client.put(policy, key,
                    new Bin("reversedAt", record.getReversedAt()),
                    new Bin("reversedBy", record.getReversedBy()),
                    new Bin("claimedBy", ""));
            record.setGeneration(record.getGeneration() + 1);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR
                    || e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) {
                log.warn("Action record {} changed before reversal could be stored", record.getRecordId());
                return false;
            }
            throw e;
        }
    }

    /**
     * Bulk retention cleanup: delete records whose issuance and expiry (or
     * reversal) both lie before {@code cutoff}. Active permanent records are kept.
     */
    public int deleteRetired(long cutoff) {
        List<ActionRecord> retired = scan(r -> {
            if (r.getIssuedAt() >= cutoff) return false;
            if (r.getReversedAt() > 0) return r.getReversedAt() < cutoff;
            return !r.isPermanent() && r.getExpiresAt() < cutoff;
        });

        int deleted = 0;
        for (ActionRecord r : retired) {
            if (client.delete(writePolicy, recordKey(r.getRecordId()))) {
                client.operate(writePolicy, indexKey(r.getAccountId()),
                        ListOperation.removeByValue(BIN_RECORD_IDS, Value.get(r.getRecordId()), ListReturnType.NONE));
                deleted++;
            }
        }
        return deleted;
    }

    private List<ActionRecord> forAccount(String accountId, Predicate<ActionRecord> filter) {
        List<ActionRecord> results = new ArrayList<>();
        Record index = client.get(readPolicy, indexKey(accountId));
        if (index == null) return results;
        List<?> ids = index.getList(BIN_RECORD_IDS);
        if (ids == null || ids.isEmpty()) return results;

        Key[] keys = ids.stream().map(id -> recordKey(id.toString())).toArray(Key[]::new);
        Record[] records = client.get(batchPolicy, keys);
        for (Record record : records) {
            if (record == null) continue;
            try {
                ActionRecord mapped = mapRecord(record);
                if (filter.test(mapped)) {
                    results.add(mapped);
                }
            } catch (Exception e) {
                log.warn("Failed to read action record of {}: {}", accountId, e.getMessage());
            }
        }
        results.sort(Comparator.comparingLong(ActionRecord::getIssuedAt).reversed());
        return results;
    }

    private List<ActionRecord> scan(Predicate<ActionRecord> filter) {
        List<ActionRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ACTION_RECORDS,
                (key, record) -> {
                    try {
                        ActionRecord mapped = mapRecord(record);
                        if (filter.test(mapped)) {
                            synchronized (results) {
                                results.add(mapped);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read action record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Key recordKey(String recordId) {
        return new Key(namespace, AerospikeConfig.SET_ACTION_RECORDS, recordId);
    }

    private Key indexKey(String accountId) {
        return new Key(namespace, AerospikeConfig.SET_ACCOUNT_ACTIONS, accountId);
    }

    private ActionRecord mapRecord(Record record) {
        return ActionRecord.builder()
                .recordId(record.getString("recordId"))
                .accountId(record.getString("accountId"))
                .kind(ActionKind.valueOf(record.getString("kind")))
                .issuedBy(record.getString("issuedBy"))
                .issuedAt(record.getLong("issuedAt"))
                .expiresAt(record.getLong("expiresAt"))
                .reason(emptyToNull(record.getString("reason")))
                .originMessageId(emptyToNull(record.getString("originMsgId")))
                .reversedAt(record.getLong("reversedAt"))
                .reversedBy(emptyToNull(record.getString("reversedBy")))
                .claimedBy(emptyToNull(record.getString("claimedBy")))
                .claimedAt(record.getLong("claimedAt"))
                .generation(record.generation)
                .build();
    }

    private static String emptyToNull(String s) {
        return s != null && !s.isEmpty() ? s : null;
    }
}
