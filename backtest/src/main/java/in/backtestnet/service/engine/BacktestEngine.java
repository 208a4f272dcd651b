package in.backtestnet.service.engine;

import in.backtestnet.domain.common.EngineState;
import in.backtestnet.domain.data.Candlestick;
import in.backtestnet.domain.data.SymbolData;
import in.backtestnet.domain.data.Timeframe;
import in.backtestnet.infrastructure.metrics.EngineMetrics;
import in.backtestnet.service.candle.CandleSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;

/**
 * Backtest Engine - replays split parts tick by tick.
 *
 * Per tick, for every part in order:
 * <ol>
 *   <li>Check cancellation</li>
 *   <li>Clone a warmup-bounded window ending at each timeframe's current candle</li>
 *   <li>Mask still-forming current candles (unless full-candle mode)</li>
 *   <li>Reverse windows (descending mode, current candle first)</li>
 *   <li>Invoke the tick handler and await its completion</li>
 *   <li>Advance cursors, lowest timeframe driving higher ones</li>
 * </ol>
 *
 * A part ends once every symbol's lowest timeframe has reached its end index. Symbols
 * that finish earlier drop out of the window while the others keep ticking.
 * Clone, mask and advance fan out per symbol on a daemon worker pool; the steps
 * themselves, ticks and parts run strictly in sequence.
 *
 * Usage:
 * <pre>
 * try (BacktestEngine engine = BacktestEngine.builder()
 *         .warmupCandlesCount(2)
 *         .onTick(window -> strategy.handle(window))
 *         .build()) {
 *     engine.run(parts, token);
 * }
 * </pre>
 */
public final class BacktestEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PROGRESS_SCALE = 4;

    private final int warmupCandlesCount;
    private final boolean sortCandlesDescending;
    private final boolean useFullCandleForCurrent;
    private final TickHandler onTick;
    private final Runnable onCancellationFinished;
    private final EngineMetrics metrics;
    private final ExecutorService workers;

    private final AtomicReference<EngineState> state = new AtomicReference<>(EngineState.IDLE);
    private final AtomicLong progressIndex = new AtomicLong();
    private volatile long maxIndex;

    private BacktestEngine(Builder builder) {
        this.warmupCandlesCount = builder.warmupCandlesCount;
        this.sortCandlesDescending = builder.sortCandlesDescending;
        this.useFullCandleForCurrent = builder.useFullCandleForCurrent;
        this.onTick = builder.onTick;
        this.onCancellationFinished = builder.onCancellationFinished;
        this.metrics = builder.metrics;
        this.workers = builder.parallelism > 1 ? newWorkerPool(builder.parallelism) : null;
    }

    private static ExecutorService newWorkerPool(int parallelism) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "BacktestWorker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    // ═══════════════════════════════════════════════════════════════
    // RUN
    // ═══════════════════════════════════════════════════════════════

    /**
     * Replay every part in order.
     *
     * Cancellation ends the run quietly: state becomes {@code CANCELLED} and the
     * cancellation hook runs once.
     *
     * @throws IllegalStateException if this engine is already running
     * @throws BacktestEngineException if the tick handler fails
     */
    public void run(List<List<SymbolData>> parts, CancellationToken cancellationToken) {
        EngineState current = state.get();
        if (current == EngineState.RUNNING || !state.compareAndSet(current, EngineState.RUNNING)) {
            throw new IllegalStateException("Backtest engine is already running");
        }

        maxIndex = computeMaxIndex(parts);
        progressIndex.set(0);
        log.info("[BacktestEngine] Starting run: {} parts, maxIndex={}", parts.size(), maxIndex);

        long offset = 0;
        int partIndex = 0;
        try {
            for (List<SymbolData> part : parts) {
                long started = System.nanoTime();
                runPart(part, partIndex, offset, cancellationToken);

                offset += partMaxIndex(part);
                progressIndex.accumulateAndGet(offset, Math::max);
                metrics.recordPartFinished(partIndex, Duration.ofNanos(System.nanoTime() - started));
                metrics.updateProgress(getProgress());
                log.debug("[BacktestEngine] Part {} finished, progress {}%", partIndex, getProgress());
                partIndex++;
            }
            state.set(EngineState.FINISHED);
            log.info("[BacktestEngine] Run finished: {} parts", parts.size());

        } catch (CancellationException e) {
            state.set(EngineState.CANCELLED);
            metrics.recordCancellation();
            log.info("[BacktestEngine] Run cancelled in part {} at {}%", partIndex, getProgress());
            if (onCancellationFinished != null) {
                onCancellationFinished.run();
            }

        } catch (BacktestEngineException e) {
            state.set(EngineState.FAILED);
            metrics.recordFailure();
            log.error("[BacktestEngine] Run failed in part {}: {}", partIndex, e.getMessage(), e);
            throw e;

        } catch (RuntimeException e) {
            state.set(EngineState.FAILED);
            metrics.recordFailure();
            log.error("[BacktestEngine] Run failed in part {}: {}", partIndex, e.getMessage(), e);
            throw new BacktestEngineException("Backtest failed in part " + partIndex, partIndex, e);
        }
    }

    private void runPart(List<SymbolData> part, int partIndex, long offset, CancellationToken cancellationToken) {
        List<SymbolData> active = symbolsWithMoreData(part);
        while (!active.isEmpty()) {
            cancellationToken.throwIfCancellationRequested();

            List<SymbolData> window = cloneFeedingWindow(active);
            if (!useFullCandleForCurrent) {
                maskCurrentCandles(window, active);
            }
            if (sortCandlesDescending) {
                reverseWindow(window);
            }

            awaitTick(window, partIndex);
            metrics.recordTick();

            advanceCursors(active);
            progressIndex.accumulateAndGet(offset + lowestCursor(part), Math::max);
            active = symbolsWithMoreData(active);
        }
    }

    private void awaitTick(List<SymbolData> window, int partIndex) {
        try {
            CompletionStage<Void> stage = onTick.onTick(window);
            if (stage == null) {
                throw new BacktestEngineException("Tick handler returned no completion stage", partIndex, null);
            }
            stage.toCompletableFuture().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CancellationException) {
                throw (CancellationException) cause;
            }
            throw new BacktestEngineException("Tick handler failed: " + cause.getMessage(), partIndex, cause);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // TICK STEPS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Copy {@code [max(startIndex, index - warmup), index]} of every timeframe into fresh lists.
     * The window timeframes' cursors point at their current (last) candle.
     */
    public List<SymbolData> cloneFeedingWindow(List<SymbolData> part) {
        SymbolData[] window = new SymbolData[part.size()];
        forEachSymbol(part.size(), s -> {
            SymbolData symbol = part.get(s);
            List<Timeframe> timeframes = new ArrayList<>(symbol.timeframes().size());
            for (Timeframe source : symbol.timeframes()) {
                int from = Math.max(source.getStartIndex(), source.getIndex() - warmupCandlesCount);
                List<Candlestick> candles = new ArrayList<>(source.getCandles().subList(from, source.getIndex() + 1));
                int last = candles.size() - 1;
                timeframes.add(new Timeframe(source.getInterval(), candles, 0, last, last, source.isExhausted()));
            }
            window[s] = new SymbolData(symbol.symbol(), timeframes);
        });
        return new ArrayList<>(Arrays.asList(window));
    }

    /**
     * Replace each window's current candle with what a live feed shows at the lowest
     * timeframe's current open. Higher bars already spanning earlier lowest candles get
     * their high/low consolidated from the part's lowest-timeframe history.
     * {@code window} and {@code part} hold the same symbols in the same order.
     */
    public void maskCurrentCandles(List<SymbolData> window, List<SymbolData> part) {
        forEachSymbol(window.size(), s -> {
            Timeframe sourceLowest = part.get(s).lowestTimeframe();
            Candlestick reference = sourceLowest.getCurrentCandle();
            BigDecimal refOpen = reference.open();
            Instant refOpenTime = reference.openTime();
            Instant refCloseTime = reference.closeTime();

            List<Timeframe> timeframes = window.get(s).timeframes();
            Timeframe lowest = timeframes.get(0);
            lowest.getCandles().set(lowest.getIndex(), reference.maskedToOpen());

            for (Timeframe timeframe : timeframes.subList(1, timeframes.size())) {
                List<Candlestick> candles = timeframe.getCandles();
                int current = timeframe.getIndex();
                Candlestick candle = candles.get(current);

                // Completes together with the reference candle, or already closed (gap in history)
                boolean completesWithReference = candle.closeTime().equals(refCloseTime)
                    && !candle.openTime().equals(refOpenTime);
                if (completesWithReference || candle.closeTime().isBefore(refOpenTime)) {
                    continue;
                }

                BigDecimal high = refOpen;
                BigDecimal low = refOpen;
                if (refOpenTime.isAfter(candle.openTime()) && refCloseTime.isBefore(candle.closeTime())) {
                    List<Candlestick> history = sourceLowest.getCandles();
                    int to = sourceLowest.getIndex();
                    int from = CandleSearch.firstIndexByOpenTime(history, candle.openTime(), 0, to);
                    CandleSearch.HighLow range = CandleSearch.highLow(history, from, to, refOpen, refOpen);
                    high = range.high();
                    low = range.low();
                }
                candles.set(current, candle.withForming(refOpenTime, high, low, refOpen));
            }
        });
    }

    /**
     * Advance one tick. The first timeframe with room left ({@code index + 1 < endIndex})
     * is the base and moves by one; timeframes before it are pinned to their end. Later
     * timeframes roll forward while their current candle closed before the base's new
     * open time and the next candle has already opened. Symbols whose lowest timeframe
     * reached its end are left alone.
     */
    public void advanceCursors(List<SymbolData> part) {
        forEachSymbol(part.size(), s -> {
            List<Timeframe> timeframes = part.get(s).timeframes();
            if (timeframes.isEmpty() || !timeframes.get(0).hasMoreData()) {
                return;
            }

            int base = -1;
            for (int i = 0; i < timeframes.size(); i++) {
                Timeframe tf = timeframes.get(i);
                if (tf.getIndex() + 1 < tf.getEndIndex()) {
                    base = i;
                    break;
                }
                tf.setIndex(tf.getEndIndex());
            }
            if (base < 0) {
                return;
            }

            Timeframe baseTf = timeframes.get(base);
            if (baseTf.getIndex() < baseTf.getStartIndex()) {
                return;
            }
            baseTf.setIndex(baseTf.getIndex() + 1);
            Instant referenceTime = baseTf.getCurrentCandle().openTime();

            for (int i = base + 1; i < timeframes.size(); i++) {
                Timeframe tf = timeframes.get(i);
                while (tf.getIndex() >= tf.getStartIndex() && tf.getIndex() < tf.getEndIndex()
                        && tf.getCurrentCandle().closeTime().isBefore(referenceTime)
                        && !tf.getCandles().get(tf.getIndex() + 1).openTime().isAfter(referenceTime)) {
                    tf.setIndex(tf.getIndex() + 1);
                }
            }
        });
    }

    private static void reverseWindow(List<SymbolData> window) {
        for (SymbolData symbol : window) {
            for (Timeframe timeframe : symbol.timeframes()) {
                Collections.reverse(timeframe.getCandles());
                timeframe.setIndex(0);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // PROGRESS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Progress in percent, 0 before any data and exactly 100 after the last part.
     */
    public BigDecimal getProgress() {
        long max = maxIndex;
        if (max == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(progressIndex.get())
            .multiply(HUNDRED)
            .divide(BigDecimal.valueOf(max), PROGRESS_SCALE, RoundingMode.HALF_UP);
    }

    public EngineState getState() {
        return state.get();
    }

    private static long computeMaxIndex(List<List<SymbolData>> parts) {
        long sum = 0;
        for (List<SymbolData> part : parts) {
            sum += partMaxIndex(part);
        }
        return sum;
    }

    // Cursor distances are measured from startIndex; a lowest slice may carry candles before it
    private static long partMaxIndex(List<SymbolData> part) {
        long max = 0;
        for (SymbolData symbol : part) {
            if (!symbol.timeframes().isEmpty()) {
                Timeframe lowest = symbol.lowestTimeframe();
                max = Math.max(max, lowest.getEndIndex() - lowest.getStartIndex());
            }
        }
        return max;
    }

    private static long lowestCursor(List<SymbolData> part) {
        long max = 0;
        for (SymbolData symbol : part) {
            if (!symbol.timeframes().isEmpty()) {
                Timeframe lowest = symbol.lowestTimeframe();
                max = Math.max(max, lowest.getIndex() - lowest.getStartIndex());
            }
        }
        return max;
    }

    private static List<SymbolData> symbolsWithMoreData(List<SymbolData> symbols) {
        List<SymbolData> active = new ArrayList<>(symbols.size());
        for (SymbolData symbol : symbols) {
            if (!symbol.timeframes().isEmpty() && symbol.lowestTimeframe().hasMoreData()) {
                active.add(symbol);
            }
        }
        return active;
    }

    // ═══════════════════════════════════════════════════════════════
    // FAN-OUT
    // ═══════════════════════════════════════════════════════════════

    private void forEachSymbol(int count, IntConsumer action) {
        if (workers == null || count <= 1) {
            for (int i = 0; i < count; i++) {
                action.accept(i);
            }
            return;
        }

        CompletableFuture<?>[] tasks = new CompletableFuture<?>[count];
        for (int i = 0; i < count; i++) {
            int symbolIndex = i;
            tasks[i] = CompletableFuture.runAsync(() -> action.accept(symbolIndex), workers);
        }
        try {
            CompletableFuture.allOf(tasks).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    @Override
    public void close() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // BUILDER
    // ═══════════════════════════════════════════════════════════════

    public static class Builder {
        private int warmupCandlesCount = 0;
        private boolean sortCandlesDescending = true;
        private boolean useFullCandleForCurrent = false;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private TickHandler onTick;
        private Runnable onCancellationFinished;
        private EngineMetrics metrics = EngineMetrics.NOOP;

        public Builder warmupCandlesCount(int warmupCandlesCount) {
            if (warmupCandlesCount < 0) {
                throw new IllegalArgumentException("warmupCandlesCount must not be negative");
            }
            this.warmupCandlesCount = warmupCandlesCount;
            return this;
        }

        public Builder sortCandlesDescending(boolean sortCandlesDescending) {
            this.sortCandlesDescending = sortCandlesDescending;
            return this;
        }

        public Builder useFullCandleForCurrent(boolean useFullCandleForCurrent) {
            this.useFullCandleForCurrent = useFullCandleForCurrent;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder onTick(TickHandler onTick) {
            this.onTick = onTick;
            return this;
        }

        public Builder onCancellationFinished(Runnable onCancellationFinished) {
            this.onCancellationFinished = onCancellationFinished;
            return this;
        }

        public Builder metrics(EngineMetrics metrics) {
            if (metrics == null) {
                throw new IllegalArgumentException("metrics must not be null");
            }
            this.metrics = metrics;
            return this;
        }

        public BacktestEngine build() {
            if (onTick == null) {
                throw new IllegalArgumentException("onTick handler is required");
            }
            return new BacktestEngine(this);
        }
    }
}
