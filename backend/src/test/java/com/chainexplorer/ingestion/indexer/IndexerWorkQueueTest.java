package com.chainexplorer.ingestion.indexer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class IndexerWorkQueueTest {

    private final ExecutorService worker = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        worker.shutdownNow();
    }

    @Test
    @DisplayName("timer commands coalesce while one of the same kind is pending")
    void submit_pendingPoll_coalesces() throws Exception {
        IndexerWorkQueue queue = new IndexerWorkQueue(worker);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger polls = new AtomicInteger();
        queue.submit(IndexerCommand.VERIFY_RANGE, () -> awaitQuietly(release));

        assertThat(queue.submit(IndexerCommand.POLL, polls::incrementAndGet)).isTrue();
        assertThat(queue.submit(IndexerCommand.POLL, polls::incrementAndGet)).isFalse();
        assertThat(queue.submit(IndexerCommand.RESYNC, () -> { })).isTrue();
        assertThat(queue.isPending(IndexerCommand.POLL)).isTrue();

        release.countDown();
        drain();

        assertThat(polls).hasValue(1);
        assertThat(queue.isPending(IndexerCommand.POLL)).isFalse();
    }

    @Test
    @DisplayName("operator commands are never coalesced and run in arrival order")
    void submit_operatorCommands_runInOrder() throws Exception {
        IndexerWorkQueue queue = new IndexerWorkQueue(worker);
        List<String> order = new CopyOnWriteArrayList<>();

        queue.submit(IndexerCommand.VERIFY_RANGE, () -> order.add("verify-1"));
        queue.submit(IndexerCommand.VERIFY_RANGE, () -> order.add("verify-2"));
        queue.submit(IndexerCommand.RESUME, () -> order.add("resume"));
        drain();

        assertThat(order).containsExactly("verify-1", "verify-2", "resume");
    }

    @Test
    @DisplayName("a failing command does not stop the worker")
    void submit_failingCommand_workerContinues() throws Exception {
        IndexerWorkQueue queue = new IndexerWorkQueue(worker);
        AtomicInteger polls = new AtomicInteger();

        queue.submit(IndexerCommand.RESYNC, () -> {
            throw new IllegalStateException("boom");
        });
        queue.submit(IndexerCommand.POLL, polls::incrementAndGet);
        drain();

        assertThat(polls).hasValue(1);
        assertThat(queue.isPending(IndexerCommand.RESYNC)).isFalse();
    }

    @Test
    @DisplayName("submissions after shutdown are rejected without leaving a pending flag")
    void submit_afterShutdown_rejected() {
        IndexerWorkQueue queue = new IndexerWorkQueue(worker);
        worker.shutdown();

        assertThat(queue.submit(IndexerCommand.POLL, () -> { })).isFalse();
        assertThat(queue.isPending(IndexerCommand.POLL)).isFalse();
    }

    private void drain() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        worker.execute(done::countDown);
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
