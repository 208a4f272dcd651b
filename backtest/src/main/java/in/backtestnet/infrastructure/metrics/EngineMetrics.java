package in.backtestnet.infrastructure.metrics;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Backtest metrics interface for monitoring long-running replays.
 *
 * Key metrics:
 * - Ticks replayed
 * - Parts started / finished and their duration
 * - Split duration and resulting part count
 * - Cancellations and failures
 * - Progress percentage
 */
public interface EngineMetrics {

    /**
     * Metrics sink that records nothing.
     */
    EngineMetrics NOOP = new EngineMetrics() {
        @Override public void recordTick() {}
        @Override public void recordPartFinished(int partIndex, Duration duration) {}
        @Override public void recordSplit(int parts, Duration duration) {}
        @Override public void recordCancellation() {}
        @Override public void recordFailure() {}
        @Override public void updateProgress(BigDecimal percent) {}
    };

    /**
     * Record one replayed tick (one callback invocation).
     */
    void recordTick();

    /**
     * Record a part whose replay completed.
     *
     * @param partIndex zero-based part position
     * @param duration wall time spent replaying the part
     */
    void recordPartFinished(int partIndex, Duration duration);

    /**
     * Record a split run.
     *
     * @param parts number of parts produced
     * @param duration wall time spent splitting
     */
    void recordSplit(int parts, Duration duration);

    void recordCancellation();

    void recordFailure();

    /**
     * @param percent progress in [0, 100]
     */
    void updateProgress(BigDecimal percent);
}
