package com.chatguard.moderation.engine.reputation;

/**
 * External URL reputation lookup.
 */
public interface ReputationClient {

    /**
     * @throws ReputationLookupException if the provider could not be reached or answered with an error
     */
    ReputationVerdict lookup(String url);
}
