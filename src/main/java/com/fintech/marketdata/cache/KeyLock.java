package com.fintech.marketdata.cache;

import com.fintech.marketdata.domain.SeriesKey;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Held per-key lock, released by {@link #close()}. Intended for try-with-resources
 * so the lock is released on every exit path.
 *
 * <p>Not shareable between threads: it must be closed by the thread that acquired it.
 */
public final class KeyLock implements AutoCloseable {

    private final SeriesKey key;
    private final ReentrantLock lock;
    private boolean released;

    KeyLock(SeriesKey key, ReentrantLock lock) {
        this.key = key;
        this.lock = lock;
    }

    public SeriesKey key() {
        return key;
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            lock.unlock();
        }
    }
}
