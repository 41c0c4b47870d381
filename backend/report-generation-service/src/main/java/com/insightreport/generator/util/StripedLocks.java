package com.insightreport.generator.util;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of locks keyed by hash.
 *
 * The same key always maps to the same lock. Distinct keys may share one,
 * so a holder must never wait on a second key from the same pool.
 */
public final class StripedLocks {

    public static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public StripedLocks() {
        this(DEFAULT_STRIPES);
    }

    public StripedLocks(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock get(String key) {
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }

    public int size() {
        return stripes.length;
    }
}
