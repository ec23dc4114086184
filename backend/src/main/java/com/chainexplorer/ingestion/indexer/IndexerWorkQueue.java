package com.chainexplorer.ingestion.indexer;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-consumer queue in front of the indexer. Timers and operator requests only enqueue; the one worker
 * thread of the backing executor runs the cycles in arrival order.
 */
@Slf4j
public class IndexerWorkQueue {

    private final Executor worker;
    private final Map<IndexerCommand, AtomicBoolean> pending = new EnumMap<>(IndexerCommand.class);

    /**
     * @param worker executor with exactly one thread
     */
    public IndexerWorkQueue(Executor worker) {
        this.worker = worker;
        for (IndexerCommand command : IndexerCommand.values()) {
            pending.put(command, new AtomicBoolean(false));
        }
    }

    /**
     * @return false when an identical coalescing command is already pending or the worker is shut down
     */
    public boolean submit(IndexerCommand command, Runnable task) {
        AtomicBoolean flag = pending.get(command);
        if (command.isCoalescing() && !flag.compareAndSet(false, true)) {
            log.trace("{} already pending, coalesced", command);
            return false;
        }
        try {
            worker.execute(() -> run(command, task));
            return true;
        } catch (RejectedExecutionException e) {
            flag.set(false);
            log.debug("{} rejected, indexer worker is shutting down", command);
            return false;
        }
    }

    public boolean isPending(IndexerCommand command) {
        return pending.get(command).get();
    }

    private void run(IndexerCommand command, Runnable task) {
        if (command.isCoalescing()) {
            pending.get(command).set(false);
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Indexer command {} failed", command, e);
        }
    }
}
