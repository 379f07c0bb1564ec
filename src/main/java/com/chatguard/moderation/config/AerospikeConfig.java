package com.chatguard.moderation.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
public class AerospikeConfig {

    public static final String SET_CHECK_CONFIGS = "check_configs";
    public static final String SET_DECISIONS = "decisions";
    public static final String SET_DECISION_LATEST = "decision_latest";
    public static final String SET_ACTION_RECORDS = "action_records";
    public static final String SET_ACCOUNT_ACTIONS = "account_actions";
    public static final String SET_AUDIT_LOG = "audit_log";
    public static final String SET_REVIEW_QUEUE = "review_queue";
    public static final String SET_TRAINING_SAMPLES = "training_samples";
    public static final String SET_MEMBERSHIPS = "memberships";
    public static final String SET_COMMUNITIES = "communities";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:moderation}")
    private String namespace;

    @Bean
    @Profile("!test")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 200;
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getNamespace() {
        return namespace;
    }
}
