package com.fintech.marketdata.cache;

import com.fintech.marketdata.domain.SeriesKey;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One mutual-exclusion lock per series key.
 *
 * <p>Locks are created lazily by an atomic get-or-insert on a concurrent map and are
 * never removed, so every caller for a key contends on the same instance for the
 * life of the process. Waiting on one key's lock never involves any other key.
 */
@Component
public class KeyLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(KeyLockRegistry.class);

    private final ConcurrentHashMap<SeriesKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public KeyLockRegistry(MeterRegistry meterRegistry) {
        meterRegistry.gaugeMapSize("marketdata.locks.registered", Tags.empty(), locks);
    }

    /**
     * Blocks until the key's lock is held by the calling thread.
     *
     * @param key Series to lock
     * @return Handle to close when done
     * @throws InterruptedException if interrupted while waiting (the lock is not held)
     */
    public KeyLock acquire(SeriesKey key) throws InterruptedException {
        ReentrantLock lock = lockFor(key);
        lock.lockInterruptibly();
        return new KeyLock(key, lock);
    }

    public boolean isLocked(SeriesKey key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }

    /** Number of keys that have ever been locked. */
    public int size() {
        return locks.size();
    }

    private ReentrantLock lockFor(SeriesKey key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return locks.computeIfAbsent(key, k -> {
            log.debug("Registering lock for {}", k);
            return new ReentrantLock();
        });
    }
}
