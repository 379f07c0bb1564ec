package com.chatguard.moderation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.chatguard.moderation.config.AerospikeConfig;
import com.chatguard.moderation.model.CheckResult;
import com.chatguard.moderation.model.DetectionAction;
import com.chatguard.moderation.model.DetectionDecision;
import com.chatguard.moderation.model.DetectionSource;
import com.chatguard.moderation.model.Verdict;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Decisions are written once per (message, edit version) and never overwritten.
 * A separate pointer record per message tracks the highest edit version seen and
 * only ever moves forward.
 */
@Repository
public class DetectionDecisionRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectionDecisionRepository.class);

    private static final int MAX_POINTER_ATTEMPTS = 5;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public DetectionDecisionRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public static String decisionId(String messageId, int editVersion) {
        return messageId + ":v" + editVersion;
    }

    /**
     * Store a new decision and advance the message's latest pointer.
     *
     * @return true if this decision is now the latest for its message, false if a
     *         decision for the same or a later edit version was already recorded.
     *         A stored decision that lost to a later edit is flagged superseded.
     */
    public boolean save(DetectionDecision decision) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISIONS, decision.getDecisionId());

        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        try {
            client.put(createOnly, key, toBins(decision));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.info("Decision {} already recorded, keeping the existing one", decision.getDecisionId());
                return false;
            }
            throw e;
        }

        if (!advanceLatest(decision.getMessageId(), decision.getDecisionId(), decision.getEditVersion())) {
            decision.setSuperseded(true);
            client.put(writePolicy, key, new Bin("superseded", true));
            return false;
        }
        return true;
    }

    private boolean advanceLatest(String messageId, String decisionId, int editVersion) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISION_LATEST, messageId);
        Bin decisionBin = new Bin("decisionId", decisionId);
        Bin versionBin = new Bin("editVersion", editVersion);

        for (int attempt = 0; attempt < MAX_POINTER_ATTEMPTS; attempt++) {
            Record current = client.get(readPolicy, key);
            WritePolicy policy = new WritePolicy(writePolicy);
            if (current == null) {
                policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
            } else {
                if (current.getInt("editVersion") >= editVersion) {
                    log.info("Message {} already has a decision for edit version {} (got {}), not advancing",
                            messageId, current.getInt("editVersion"), editVersion);
                    return false;
                }
                policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
                policy.generation = current.generation;
            }

            try {
                client.put(policy, key, decisionBin, versionBin);
                return true;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR
                        && e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) {
                    throw e;
                }
                log.debug("Concurrent update of latest decision for message {}, retrying", messageId);
            }
        }
        log.warn("Gave up advancing latest decision pointer for message {} after {} attempts",
                messageId, MAX_POINTER_ATTEMPTS);
        return false;
    }

    public DetectionDecision findById(String decisionId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISIONS, decisionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public DetectionDecision findLatestByMessageId(String messageId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISION_LATEST, messageId);
        Record pointer = client.get(readPolicy, key);
        if (pointer == null) return null;
        return findById(pointer.getString("decisionId"));
    }

    /**
     * All decisions for a message, oldest edit first.
     */
    public List<DetectionDecision> findHistory(String messageId) {
        List<DetectionDecision> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DECISIONS,
                (key, record) -> {
                    try {
                        if (messageId.equals(record.getString("messageId"))) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read decision record: {}", e.getMessage());
                    }
                });
        results.sort(Comparator.comparingInt(DetectionDecision::getEditVersion));
        return results;
    }

    /**
     * The only mutation a stored decision allows.
     */
    public boolean updateTrainingEligible(String decisionId, boolean eligible) {
        Key key = new Key(namespace, AerospikeConfig.SET_DECISIONS, decisionId);
        WritePolicy updateOnly = new WritePolicy(writePolicy);
        updateOnly.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        try {
            client.put(updateOnly, key, new Bin("trainEligible", eligible));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Bulk retention cleanup: delete decisions evaluated before {@code cutoff}.
     */
    public int deleteEvaluatedBefore(long cutoff) {
        List<Key> expired = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DECISIONS,
                (key, record) -> {
                    if (record.getLong("evaluatedAt") < cutoff) {
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

    private Bin[] toBins(DetectionDecision d) {
        return new Bin[] {
                new Bin("decisionId", d.getDecisionId()),
                new Bin("messageId", d.getMessageId()),
                new Bin("communityId", d.getCommunityId()),
                new Bin("accountId", d.getAccountId()),
                new Bin("evaluatedAt", d.getEvaluatedAt()),
                new Bin("verdict", d.getVerdict().name()),
                new Bin("netConf", d.getNetConfidence()),
                new Bin("accuracyConf", d.getAccuracyConfidence()),
                new Bin("checkResults", serializeResults(d.getCheckResults())),
                new Bin("source", d.getSource().name()),
                new Bin("editVersion", d.getEditVersion()),
                new Bin("action", d.getAction().name()),
                new Bin("vetoed", d.isVetoed()),
                new Bin("trainingMode", d.isTrainingMode()),
                new Bin("trainEligible", d.isTrainingEligible()),
                new Bin("superseded", d.isSuperseded())
        };
    }

    private DetectionDecision mapRecord(Record record) {
        return DetectionDecision.builder()
                .decisionId(record.getString("decisionId"))
                .messageId(record.getString("messageId"))
                .communityId(record.getString("communityId"))
                .accountId(record.getString("accountId"))
                .evaluatedAt(record.getLong("evaluatedAt"))
                .verdict(Verdict.valueOf(record.getString("verdict")))
                .netConfidence(record.getInt("netConf"))
                .accuracyConfidence(record.getInt("accuracyConf"))
                .checkResults(deserializeResults(record.getString("checkResults")))
                .source(DetectionSource.valueOf(record.getString("source")))
                .editVersion(record.getInt("editVersion"))
                .action(DetectionAction.valueOf(record.getString("action")))
                .vetoed(record.getBoolean("vetoed"))
                .trainingMode(record.getBoolean("trainingMode"))
                .trainingEligible(record.getBoolean("trainEligible"))
                .superseded(record.getBoolean("superseded"))
                .build();
    }

    private String serializeResults(List<CheckResult> results) {
        try {
            return objectMapper.writeValueAsString(results != null ? results : Collections.emptyList());
        } catch (Exception e) {
            log.error("Failed to serialize check results", e);
            return "[]";
        }
    }

    private List<CheckResult> deserializeResults(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<CheckResult>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize check results", e);
            return Collections.emptyList();
        }
    }
}
