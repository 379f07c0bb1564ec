package com.chatguard.moderation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.chatguard.moderation.config.AerospikeConfig;
import com.chatguard.moderation.model.SampleSource;
import com.chatguard.moderation.model.TrainingLabel;
import com.chatguard.moderation.model.TrainingSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * One sample per decision; relabelling a decision overwrites its sample.
 */
@Repository
public class TrainingSampleRepository {

    private static final Logger log = LoggerFactory.getLogger(TrainingSampleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public TrainingSampleRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(TrainingSample sample) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRAINING_SAMPLES, sample.getDecisionId());

        client.put(writePolicy, key,
                new Bin("decisionId", sample.getDecisionId()),
                new Bin("text", sample.getText()),
                new Bin("label", sample.getLabel().name()),
                new Bin("source", sample.getSource().name()),
                new Bin("communityId", sample.getCommunityId() != null ? sample.getCommunityId() : ""),
                new Bin("labeledBy", sample.getLabeledBy() != null ? sample.getLabeledBy() : ""),
                new Bin("createdAt", sample.getCreatedAt()));
    }

    public TrainingSample findByDecisionId(String decisionId) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRAINING_SAMPLES, decisionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public boolean delete(String decisionId) {
        return client.delete(writePolicy, new Key(namespace, AerospikeConfig.SET_TRAINING_SAMPLES, decisionId));
    }

    public List<TrainingSample> findByLabel(TrainingLabel label) {
        List<TrainingSample> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TRAINING_SAMPLES,
                (key, record) -> {
                    try {
                        if (label.name().equals(record.getString("label"))) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read training sample: {}", e.getMessage());
                    }
                });
        return results;
    }

    private TrainingSample mapRecord(Record record) {
        String communityId = record.getString("communityId");
        String labeledBy = record.getString("labeledBy");
        return TrainingSample.builder()
                .decisionId(record.getString("decisionId"))
                .text(record.getString("text"))
                .label(TrainingLabel.valueOf(record.getString("label")))
                .source(SampleSource.valueOf(record.getString("source")))
                .communityId(communityId != null && !communityId.isEmpty() ? communityId : null)
                .labeledBy(labeledBy != null && !labeledBy.isEmpty() ? labeledBy : null)
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
