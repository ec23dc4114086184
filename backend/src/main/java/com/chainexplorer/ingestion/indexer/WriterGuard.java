package com.chainexplorer.ingestion.indexer;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer section for every indexer cycle (poll, resync, manual verify, resume).
 * Instrumented so callers and tests can observe that a second cycle waited instead of running alongside.
 */
@Slf4j
public class WriterGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicInteger activeWriters = new AtomicInteger();
    private final AtomicInteger maxObservedWriters = new AtomicInteger();
    private final AtomicLong contendedAcquisitions = new AtomicLong();
    private volatile String currentCycle;

    public <T> T runExclusive(String cycle, Supplier<T> work) {
        if (!lock.tryLock()) {
            contendedAcquisitions.incrementAndGet();
            log.debug("{} waits for writer role held by {}", cycle, currentCycle);
            lock.lock();
        }
        boolean outermost = lock.getHoldCount() == 1;
        if (outermost) {
            int active = activeWriters.incrementAndGet();
            maxObservedWriters.accumulateAndGet(active, Math::max);
        }
        String outer = currentCycle;
        currentCycle = cycle;
        try {
            return work.get();
        } finally {
            currentCycle = outer;
            if (outermost) {
                activeWriters.decrementAndGet();
            }
            lock.unlock();
        }
    }

    /** Cycles currently inside the section; anything above 1 would be a second writer. */
    public int getActiveWriters() {
        return activeWriters.get();
    }

    public int getMaxObservedWriters() {
        return maxObservedWriters.get();
    }

    /** Number of cycles that found the section taken and had to wait. */
    public long getContendedAcquisitions() {
        return contendedAcquisitions.get();
    }

    public boolean hasWaitingWriters() {
        return lock.hasQueuedThreads();
    }

    public String getCurrentCycle() {
        return currentCycle;
    }
}
