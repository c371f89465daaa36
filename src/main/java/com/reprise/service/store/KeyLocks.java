package com.reprise.service.store;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped locks keyed by fingerprint. Operations on the same fingerprint are serialized;
 * different fingerprints rarely contend.
 */
public class KeyLocks {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public KeyLocks() {
        this(DEFAULT_STRIPES);
    }

    public KeyLocks(int stripes) {
        if (stripes <= 0) {
            throw new IllegalArgumentException("stripes must be positive");
        }
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(String fingerprint) {
        int hash = fingerprint == null ? 0 : fingerprint.hashCode();
        return stripes[Math.floorMod(hash, stripes.length)];
    }
}
