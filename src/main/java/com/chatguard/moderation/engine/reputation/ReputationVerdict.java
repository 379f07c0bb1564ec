package com.chatguard.moderation.engine.reputation;

/**
 * Engine counts reported by the reputation provider for one URL.
 * {@code known} is false when the provider has never analysed the URL.
 */
public record ReputationVerdict(String url, int malicious, int suspicious, boolean known) {

    public static ReputationVerdict unknown(String url) {
        return new ReputationVerdict(url, 0, 0, false);
    }
}
