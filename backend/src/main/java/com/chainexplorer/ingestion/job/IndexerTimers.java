package com.chainexplorer.ingestion.job;

import com.chainexplorer.config.SchedulerConfig;
import com.chainexplorer.ingestion.config.IndexerProperties;
import com.chainexplorer.ingestion.indexer.ChainIndexer;
import com.chainexplorer.ingestion.indexer.IndexerCommand;
import com.chainexplorer.ingestion.indexer.IndexerWorkQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Poll and resync timers. Each firing only enqueues a command on the indexer work queue; the two timers are
 * cancelled independently and both stop with the application context.
 */
@Component
@Slf4j
public class IndexerTimers implements SmartLifecycle {

    private final ThreadPoolTaskScheduler schedulerPool;
    private final IndexerWorkQueue workQueue;
    private final ChainIndexer chainIndexer;
    private final IndexerProperties properties;

    private ScheduledFuture<?> pollTimer;
    private ScheduledFuture<?> resyncTimer;
    private volatile boolean running;

    public IndexerTimers(@Qualifier(SchedulerConfig.SCHEDULER_POOL) ThreadPoolTaskScheduler schedulerPool,
                         IndexerWorkQueue workQueue,
                         ChainIndexer chainIndexer,
                         IndexerProperties properties) {
        this.schedulerPool = schedulerPool;
        this.workQueue = workQueue;
        this.chainIndexer = chainIndexer;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (!properties.isEnabled()) {
            log.info("Indexer timers disabled (explorer.indexer.enabled=false)");
            return;
        }
        Duration pollInterval = Duration.ofMillis(properties.getPollIntervalMs());
        Duration resyncInterval = Duration.ofMillis(properties.getResyncIntervalMs());
        pollTimer = schedulerPool.scheduleWithFixedDelay(this::firePoll, pollInterval);
        resyncTimer = schedulerPool.scheduleWithFixedDelay(this::fireResync, Instant.now().plus(resyncInterval), resyncInterval);
        running = true;
        log.info("Indexer timers started: poll every {} ms, resync every {} ms over {} blocks",
                properties.getPollIntervalMs(), properties.getResyncIntervalMs(), properties.getResyncDepth());
    }

    @Override
    public synchronized void stop() {
        cancelPollTimer();
        cancelResyncTimer();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public synchronized void cancelPollTimer() {
        if (pollTimer != null) {
            pollTimer.cancel(false);
            pollTimer = null;
            log.info("Poll timer cancelled");
        }
    }

    public synchronized void cancelResyncTimer() {
        if (resyncTimer != null) {
            resyncTimer.cancel(false);
            resyncTimer = null;
            log.info("Resync timer cancelled");
        }
    }

    void firePoll() {
        workQueue.submit(IndexerCommand.POLL, chainIndexer::pollTick);
    }

    void fireResync() {
        workQueue.submit(IndexerCommand.RESYNC, chainIndexer::resyncTick);
    }
}
