package in.backtestnet.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Prometheus implementation of EngineMetrics interface.
 *
 * Key Metrics:
 * - backtest_ticks_total - Callback invocations
 * - backtest_parts_total - Parts replayed to completion
 * - backtest_part_duration_seconds - Replay time per part
 * - backtest_split_duration_seconds - Time spent splitting
 * - backtest_split_parts - Parts produced by the last split
 * - backtest_runs_total{outcome} - Cancelled / failed runs
 * - backtest_progress_percent - Current progress
 *
 * Usage:
 * <pre>
 * PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(new CollectorRegistry());
 * BacktestEngine engine = BacktestEngine.builder().metrics(metrics)...build();
 *
 * // Expose at /metrics endpoint
 * new StatusServer(port, metrics.getRegistry(), engine::getState, engine::getProgress);
 * </pre>
 */
public class PrometheusEngineMetrics implements EngineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEngineMetrics.class);

    private final CollectorRegistry registry;

    private final Counter tickCounter;
    private final Counter partCounter;
    private final Histogram partDuration;
    private final Histogram splitDuration;
    private final Gauge splitParts;
    private final Counter runOutcomeCounter;
    private final Gauge progress;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.tickCounter = Counter.build()
            .name("backtest_ticks_total")
            .help("Total number of replayed ticks")
            .register(registry);

        this.partCounter = Counter.build()
            .name("backtest_parts_total")
            .help("Total number of parts replayed to completion")
            .register(registry);

        this.partDuration = Histogram.build()
            .name("backtest_part_duration_seconds")
            .help("Replay time per part in seconds")
            .buckets(0.1, 0.5, 1.0, 5.0, 15.0, 60.0, 300.0)
            .register(registry);

        this.splitDuration = Histogram.build()
            .name("backtest_split_duration_seconds")
            .help("Time spent splitting history into parts in seconds")
            .buckets(0.01, 0.1, 0.5, 1.0, 5.0, 30.0)
            .register(registry);

        this.splitParts = Gauge.build()
            .name("backtest_split_parts")
            .help("Number of parts produced by the last split")
            .register(registry);

        this.runOutcomeCounter = Counter.build()
            .name("backtest_runs_total")
            .help("Backtest runs that ended early")
            .labelNames("outcome")
            .register(registry);

        this.progress = Gauge.build()
            .name("backtest_progress_percent")
            .help("Backtest progress in percent (0-100)")
            .register(registry);

        log.info("[PrometheusEngineMetrics] Initialized backtest metrics");
    }

    @Override
    public void recordTick() {
        tickCounter.inc();
    }

    @Override
    public void recordPartFinished(int partIndex, Duration duration) {
        partCounter.inc();
        partDuration.observe(duration.toMillis() / 1000.0);
    }

    @Override
    public void recordSplit(int parts, Duration duration) {
        splitParts.set(parts);
        splitDuration.observe(duration.toMillis() / 1000.0);
    }

    @Override
    public void recordCancellation() {
        runOutcomeCounter.labels("cancelled").inc();
    }

    @Override
    public void recordFailure() {
        runOutcomeCounter.labels("failed").inc();
    }

    @Override
    public void updateProgress(BigDecimal percent) {
        progress.set(percent.doubleValue());
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
