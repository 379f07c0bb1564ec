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
import com.chatguard.moderation.model.AccountMembership;
import com.chatguard.moderation.model.MemberRole;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One record per account holding every community it is known to be in.
 * Updates are read-modify-write guarded by the record generation.
 */
@Repository
public class MembershipRepository {

    private static final Logger log = LoggerFactory.getLogger(MembershipRepository.class);

    private static final int MAX_UPDATE_ATTEMPTS = 5;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public MembershipRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Never null: an unknown account has no communities.
     */
    public AccountMembership findByAccountId(String accountId) {
        Key key = new Key(namespace, AerospikeConfig.SET_MEMBERSHIPS, accountId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return AccountMembership.builder().accountId(accountId).build();
        }
        return mapRecord(record);
    }

    public List<String> findCommunityIds(String accountId) {
        return findByAccountId(accountId).communityIds();
    }

    public AccountMembership recordPresence(String accountId, String communityId, MemberRole role, long now) {
        return update(accountId, m -> m.getCommunities().put(communityId, role), now);
    }

    public AccountMembership recordDeparture(String accountId, String communityId, long now) {
        return update(accountId, m -> m.getCommunities().remove(communityId), now);
    }

    public AccountMembership markPrivateChatOpen(String accountId, long now) {
        return update(accountId, m -> m.setPrivateChatOpen(true), now);
    }

    /**
     * Admin and owner accounts of one community.
     */
    public List<String> findAdmins(String communityId) {
        List<String> admins = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MEMBERSHIPS,
                (key, record) -> {
                    try {
                        MemberRole role = deserializeCommunities(record.getString("communities")).get(communityId);
                        if (role != null && role.isAdmin()) {
                            synchronized (admins) {
                                admins.add(record.getString("accountId"));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read membership record: {}", e.getMessage());
                    }
                });
        return admins;
    }

    private AccountMembership update(String accountId, Consumer<AccountMembership> change, long now) {
        Key key = new Key(namespace, AerospikeConfig.SET_MEMBERSHIPS, accountId);

        for (int attempt = 0; attempt < MAX_UPDATE_ATTEMPTS; attempt++) {
            Record record = client.get(readPolicy, key);
            AccountMembership membership = record != null
                    ? mapRecord(record)
                    : AccountMembership.builder().accountId(accountId).build();
            change.accept(membership);
            membership.setUpdatedAt(now);

            WritePolicy policy = new WritePolicy(writePolicy);
            if (record == null) {
                policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
            } else {
                policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
                policy.generation = record.generation;
            }

            try {
                client.put(policy, key,
                        new Bin("accountId", accountId),
                        new Bin("communities", serializeCommunities(membership.getCommunities())),
                        new Bin("privateChat", membership.isPrivateChatOpen()),
                        new Bin("updatedAt", now));
                return membership;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR
                        && e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) {
                    throw e;
                }
                log.debug("Concurrent membership update for account {}, retrying", accountId);
            }
        }
        throw new IllegalStateException("Could not update membership of account " + accountId
                + " after " + MAX_UPDATE_ATTEMPTS + " attempts");
    }

    private AccountMembership mapRecord(Record record) {
        return AccountMembership.builder()
                .accountId(record.getString("accountId"))
                .communities(deserializeCommunities(record.getString("communities")))
                .privateChatOpen(record.getBoolean("privateChat"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }

    private String serializeCommunities(Map<String, MemberRole> communities) {
        try {
            return objectMapper.writeValueAsString(communities != null ? communities : Collections.emptyMap());
        } catch (Exception e) {
            log.error("Failed to serialize communities", e);
            return "{}";
        }
    }

    private Map<String, MemberRole> deserializeCommunities(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, MemberRole>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize communities", e);
            return new LinkedHashMap<>();
        }
    }
}
