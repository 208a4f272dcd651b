package in.backtestnet.service.core;

import in.backtestnet.config.BacktestConfig;
import in.backtestnet.domain.common.BacktestEventStatus;
import in.backtestnet.domain.common.EngineState;
import in.backtestnet.domain.data.SymbolData;
import in.backtestnet.infrastructure.metrics.EngineMetrics;
import in.backtestnet.service.engine.BacktestEngine;
import in.backtestnet.service.engine.CancellationToken;
import in.backtestnet.service.engine.TickHandler;
import in.backtestnet.service.split.SymbolDataSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Backtest Executor - splits history and replays it through a fresh engine.
 *
 * Lifecycle events, in order:
 * STARTED, SPLIT_STARTED, SPLIT_FINISHED, ENGINE_STARTED, ENGINE_FINISHED, FINISHED.
 * A failure emits ERROR with the message and is rethrown.
 */
public final class BacktestExecutor {
    private static final Logger log = LoggerFactory.getLogger(BacktestExecutor.class);

    private static final String VERSION = versionOrDefault();

    private final BacktestConfig config;
    private final TickHandler onTick;
    private final EngineMetrics metrics;
    private final List<BacktestEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile BacktestEngine engine;

    public BacktestExecutor(BacktestConfig config, TickHandler onTick) {
        this(config, onTick, EngineMetrics.NOOP);
    }

    public BacktestExecutor(BacktestConfig config, TickHandler onTick, EngineMetrics metrics) {
        config.validate();
        this.config = config;
        this.onTick = Objects.requireNonNull(onTick, "onTick");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public void addListener(BacktestEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Split and replay the given history.
     *
     * @throws IllegalStateException if a backtest is already running on this executor
     */
    public void perform(List<SymbolData> symbolsData, CancellationToken cancellationToken) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Backtest is already running");
        }

        try {
            notify(BacktestEventStatus.STARTED, VERSION);

            SymbolDataSplitter splitter = new SymbolDataSplitter(
                config.daysPerSplit(),
                config.warmupCandlesCount(),
                config.startTime(),
                config.correctEndIndex(),
                config.warmupTimeframe());

            notify(BacktestEventStatus.SPLIT_STARTED, SymbolDataSplitter.class.getSimpleName());
            long splitStarted = System.nanoTime();
            List<List<SymbolData>> parts = splitter.split(symbolsData);
            metrics.recordSplit(parts.size(), Duration.ofNanos(System.nanoTime() - splitStarted));
            notify(BacktestEventStatus.SPLIT_FINISHED, SymbolDataSplitter.class.getSimpleName());

            try (BacktestEngine current = BacktestEngine.builder()
                    .warmupCandlesCount(config.warmupCandlesCount())
                    .sortCandlesDescending(config.sortCandlesDescending())
                    .useFullCandleForCurrent(config.useFullCandleForCurrent())
                    .parallelism(config.parallelism())
                    .onTick(onTick)
                    .onCancellationFinished(() -> log.info("[BacktestExecutor] Cancellation finished"))
                    .metrics(metrics)
                    .build()) {
                engine = current;

                notify(BacktestEventStatus.ENGINE_STARTED, BacktestEngine.class.getSimpleName());
                current.run(parts, cancellationToken);
                notify(BacktestEventStatus.ENGINE_FINISHED, BacktestEngine.class.getSimpleName());
            }

            notify(BacktestEventStatus.FINISHED, VERSION);

        } catch (RuntimeException e) {
            log.error("[BacktestExecutor] Backtest failed: {}", e.getMessage(), e);
            notify(BacktestEventStatus.ERROR, e.getMessage());
            throw e;

        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Progress of the current (or last) run in percent, 0 before the first run.
     */
    public BigDecimal getProgress() {
        BacktestEngine current = engine;
        return current != null ? current.getProgress() : BigDecimal.ZERO;
    }

    public EngineState getState() {
        BacktestEngine current = engine;
        return current != null ? current.getState() : EngineState.IDLE;
    }

    private void notify(BacktestEventStatus status, String details) {
        for (BacktestEventListener listener : listeners) {
            try {
                listener.onEvent(status, details);
            } catch (RuntimeException e) {
                log.warn("[BacktestExecutor] Listener failed on {}: {}", status, e.getMessage(), e);
            }
        }
    }

    private static String versionOrDefault() {
        String version = BacktestExecutor.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
