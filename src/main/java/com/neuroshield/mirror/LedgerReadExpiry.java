package com.neuroshield.mirror;

import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;

/**
 * Expires a mirror entry a fixed window after it was read from the ledger. Event merges and cache
 * hits keep the remaining time, so a lost event can only be hidden until the next ledger read.
 */
public class LedgerReadExpiry implements Expiry<String, MirroredTrust> {

    private final long windowNanos;

    public LedgerReadExpiry(Duration stalenessWindow) {
        this.windowNanos = stalenessWindow.toNanos();
    }

    @Override
    public long expireAfterCreate(String key, MirroredTrust value, long currentTime) {
        return windowNanos;
    }

    @Override
    public long expireAfterUpdate(String key, MirroredTrust value, long currentTime, long currentDuration) {
        return currentDuration;
    }

    @Override
    public long expireAfterRead(String key, MirroredTrust value, long currentTime, long currentDuration) {
        return currentDuration;
    }
}
