package com.chainexplorer.ingestion.aggregation;

import com.chainexplorer.domain.ChainBlock;
import com.chainexplorer.domain.ThroughputSnapshot;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Rolling throughput over a trailing time window. The window is bounded by time, not block count, and
 * rates divide by the window length, so sparse block production does not inflate throughput.
 * Rates are display values (double); nothing monetary passes through here.
 */
public class ThroughputCalculator {

    private final long windowSeconds;
    private final long currentWindowSeconds;

    public ThroughputCalculator(long windowSeconds, long currentWindowSeconds) {
        this.windowSeconds = windowSeconds;
        this.currentWindowSeconds = currentWindowSeconds;
    }

    /**
     * @param recentBlocks blocks in any order; those outside the window are ignored
     * @param nowEpochSeconds end of the window
     */
    public ThroughputSnapshot compute(List<ChainBlock> recentBlocks, long nowEpochSeconds, long tipHeight, Instant computedAt) {
        List<ChainBlock> inWindow = within(recentBlocks, nowEpochSeconds, windowSeconds);
        List<ChainBlock> current = within(recentBlocks, nowEpochSeconds, currentWindowSeconds);

        ThroughputSnapshot snapshot = ThroughputSnapshot.empty(tipHeight, computedAt);
        long txs = sumTxs(inWindow);
        snapshot.setBlocksInWindow(inWindow.size());
        snapshot.setTxsInWindow(txs);
        snapshot.setAvgTps1h(rate(txs, windowSeconds));
        snapshot.setCurrentTps(rate(sumTxs(current), currentWindowSeconds));
        snapshot.setAvgBlockTime(averageBlockTime(inWindow));
        return snapshot;
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }

    private static List<ChainBlock> within(List<ChainBlock> blocks, long now, long window) {
        long from = now - window;
        return blocks.stream()
                .filter(b -> b.getTimestamp() > from && b.getTimestamp() <= now)
                .sorted(Comparator.comparingLong(ChainBlock::getTimestamp))
                .toList();
    }

    private static long sumTxs(List<ChainBlock> blocks) {
        return blocks.stream().mapToLong(ChainBlock::getTxCount).sum();
    }

    private static double averageBlockTime(List<ChainBlock> sorted) {
        if (sorted.size() < 2) {
            return 0.0;
        }
        long span = sorted.get(sorted.size() - 1).getTimestamp() - sorted.get(0).getTimestamp();
        return round2((double) span / (sorted.size() - 1));
    }

    private static double rate(long count, long seconds) {
        if (seconds <= 0 || count == 0) {
            return 0.0;
        }
        return round2((double) count / seconds);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
