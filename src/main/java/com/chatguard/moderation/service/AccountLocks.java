package com.chatguard.moderation.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped per-account locks. Every moderation command for one account runs
 * inside that account's lock, so reading and writing its trust and ban
 * status is a single critical section.
 */
@Component
public class AccountLocks {

    private static final int STRIPES = 256;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public AccountLocks() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(String accountId) {
        return locks[Math.floorMod(accountId.hashCode(), STRIPES)];
    }
}
