package com.chatguard.moderation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.chatguard.moderation.config.AerospikeConfig;
import com.chatguard.moderation.model.PagedResponse;
import com.chatguard.moderation.model.ReviewQueueItem;
import com.chatguard.moderation.model.ReviewStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Repository
public class ReviewQueueRepository {

    private static final Logger log = LoggerFactory.getLogger(ReviewQueueRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ReviewQueueRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(ReviewQueueItem item) {
        Key key = new Key(namespace, AerospikeConfig.SET_REVIEW_QUEUE, item.getDecisionId());

        client.put(writePolicy, key,
                new Bin("decisionId", item.getDecisionId()),
                new Bin("messageId", item.getMessageId()),
                new Bin("communityId", item.getCommunityId()),
                new Bin("accountId", item.getAccountId()),
                new Bin("netConf", item.getNetConfidence()),
                new Bin("spamChecks", serializeList(item.getSpamChecks())),
                new Bin("text", item.getText() != null ? item.getText() : ""),
                new Bin("enqueuedAt", item.getEnqueuedAt()),
                new Bin("status", item.getStatus().name()),
                new Bin("reviewedAt", item.getReviewedAt()),
                new Bin("reviewedBy", item.getReviewedBy() != null ? item.getReviewedBy() : ""));
    }

    public ReviewQueueItem findByDecisionId(String decisionId) {
        Key key = new Key(namespace, AerospikeConfig.SET_REVIEW_QUEUE, decisionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public PagedResponse<ReviewQueueItem> findByFilters(ReviewStatus status, String communityId,
                                                        String accountId, int limit, Long before) {
        List<ReviewQueueItem> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_REVIEW_QUEUE,
                (key, record) -> {
                    try {
                        if (status != null && !status.name().equals(record.getString("status"))) return;
                        if (communityId != null && !communityId.isEmpty()
                                && !communityId.equals(record.getString("communityId"))) return;
                        if (accountId != null && !accountId.isEmpty()
                                && !accountId.equals(record.getString("accountId"))) return;
                        if (before != null && record.getLong("enqueuedAt") >= before) return;

                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to filter review queue record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(ReviewQueueItem::getEnqueuedAt).reversed());
        return PagedResponse.of(results, limit, ReviewQueueItem::getEnqueuedAt);
    }

    /**
     * Resolve a pending item. Only updates if the item is still PENDING and
     * unchanged since it was read, so concurrent reviewers cannot both win.
     * @return true if updated, false if the item is missing or already reviewed
     */
    public boolean resolve(String decisionId, ReviewStatus status, String reviewedBy, long reviewedAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_REVIEW_QUEUE, decisionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return false;

        String currentStatus = record.getString("status");
        if (!ReviewStatus.PENDING.name().equals(currentStatus)) {
            log.debug("Queue item {} already has status {}, skipping update", decisionId, currentStatus);
            return false;
        }

        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = record.generation;

        try {
            client.put(policy, key,
                    new Bin("status", status.name()),
                    new Bin("reviewedAt", reviewedAt),
                    new Bin("reviewedBy", reviewedBy));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Queue item {} was reviewed concurrently", decisionId);
                return false;
            }
            throw e;
        }
    }

    public Map<ReviewStatus, Integer> countByStatus() {
        Map<ReviewStatus, Integer> counts = new EnumMap<>(ReviewStatus.class);
        for (ReviewStatus s : ReviewStatus.values()) {
            counts.put(s, 0);
        }
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_REVIEW_QUEUE,
                (key, record) -> {
                    try {
                        ReviewStatus status = ReviewStatus.valueOf(record.getString("status"));
                        synchronized (counts) {
                            counts.merge(status, 1, Integer::sum);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to count review queue record: {}", e.getMessage());
                    }
                });
        return counts;
    }

    private ReviewQueueItem mapRecord(Record record) {
        String reviewedBy = record.getString("reviewedBy");
        return ReviewQueueItem.builder()
                .decisionId(record.getString("decisionId"))
                .messageId(record.getString("messageId"))
                .communityId(record.getString("communityId"))
                .accountId(record.getString("accountId"))
                .netConfidence(record.getInt("netConf"))
                .spamChecks(deserializeList(record.getString("spamChecks")))
                .text(record.getString("text"))
                .enqueuedAt(record.getLong("enqueuedAt"))
                .status(ReviewStatus.valueOf(record.getString("status")))
                .reviewedAt(record.getLong("reviewedAt"))
                .reviewedBy(reviewedBy != null && !reviewedBy.isEmpty() ? reviewedBy : null)
                .build();
    }

    private String serializeList(List<String> list) {
        try {
            return objectMapper.writeValueAsString(list != null ? list : Collections.emptyList());
        } catch (Exception e) {
            log.error("Failed to serialize list", e);
            return "[]";
        }
    }

    private List<String> deserializeList(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize list", e);
            return Collections.emptyList();
        }
    }
}
