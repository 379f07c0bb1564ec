package com.chatguard.moderation.engine.reputation;

import com.chatguard.moderation.config.ReputationConfig;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Provider quota for reputation lookups: a daily cap and a per-minute cap,
 * both enforced by one token bucket.
 */
@Component
public class ReputationQuota {

    private final Bucket bucket;

    public ReputationQuota(ReputationConfig config) {
        this.bucket = Bucket.builder()
                .addLimit(Bandwidth.classic(config.getDailyLimit(),
                        Refill.intervally(config.getDailyLimit(), Duration.ofDays(1))))
                .addLimit(Bandwidth.classic(config.getPerMinuteLimit(),
                        Refill.intervally(config.getPerMinuteLimit(), Duration.ofMinutes(1))))
                .build();
    }

    /**
     * Take one lookup from the quota.
     *
     * @return false if either cap is exhausted
     */
    public boolean tryAcquire() {
        return bucket.tryConsume(1);
    }

    public long remaining() {
        return bucket.getAvailableTokens();
    }
}
