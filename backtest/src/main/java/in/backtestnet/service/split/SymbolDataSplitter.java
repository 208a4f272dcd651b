package in.backtestnet.service.split;

import in.backtestnet.domain.common.SplitErrorCode;
import in.backtestnet.domain.data.Candlestick;
import in.backtestnet.domain.data.CandlestickInterval;
import in.backtestnet.domain.data.SymbolData;
import in.backtestnet.domain.data.Timeframe;
import in.backtestnet.service.candle.CandleSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Symbol Data Splitter - cuts a full history into sequential, memory-bounded parts.
 *
 * Every part covers {@code daysPerSplit} days of simulated time per symbol. Each
 * timeframe of a part holds a copy of its candles from the warmup start up to the
 * part end, with cursors re-based to the copy:
 * <ul>
 *   <li>startIndex - first warmup candle</li>
 *   <li>index - the lowest timeframe's first candle opening at or after the part's
 *       start time, or the higher bar live at that candle's open</li>
 *   <li>endIndex - first candle closing at or after the part's last second</li>
 * </ul>
 * The lowest timeframe's copy may begin before startIndex, back to the open of the
 * oldest live higher bar.
 *
 * Source candle lists are never modified; exhaustion is tracked per call, so
 * splitting the same input twice yields identical parts.
 */
public final class SymbolDataSplitter {
    private static final Logger log = LoggerFactory.getLogger(SymbolDataSplitter.class);

    private final int daysPerSplit;
    private final int warmupCandlesCount;
    private final Instant backtestingStart;
    private final boolean correctEndIndex;
    private final CandlestickInterval warmupTimeframe;

    public SymbolDataSplitter(int daysPerSplit, int warmupCandlesCount, Instant backtestingStart) {
        this(daysPerSplit, warmupCandlesCount, backtestingStart, false, null);
    }

    /**
     * @param daysPerSplit       days per part, 0 or less disables splitting
     * @param warmupCandlesCount candles of history kept before each part's start
     * @param backtestingStart   simulated time of the first tick
     * @param correctEndIndex    align every timeframe of a symbol to the end of its exhausted
     *                           sibling whose end candle closes earliest
     * @param warmupTimeframe    explicit warmup timeframe, or null to resolve it from data
     */
    public SymbolDataSplitter(int daysPerSplit, int warmupCandlesCount, Instant backtestingStart,
                              boolean correctEndIndex, CandlestickInterval warmupTimeframe) {
        if (warmupCandlesCount < 0) {
            throw new IllegalArgumentException("warmupCandlesCount must not be negative");
        }
        this.daysPerSplit = daysPerSplit;
        this.warmupCandlesCount = warmupCandlesCount;
        this.backtestingStart = Objects.requireNonNull(backtestingStart, "backtestingStart");
        this.correctEndIndex = correctEndIndex;
        this.warmupTimeframe = warmupTimeframe;
    }

    /**
     * Split symbols data into parts.
     *
     * @param symbolsData full history, timeframes ascending by interval, candles ascending by open time
     * @return parts in simulated-time order, none of them empty
     * @throws SymbolDataValidationException if the input is unsorted or contains duplicates
     */
    public List<List<SymbolData>> split(List<SymbolData> symbolsData) {
        validateSorted(symbolsData);
        validateNoDuplicates(symbolsData);

        long started = System.nanoTime();
        List<List<SymbolData>> parts = daysPerSplit <= 0
            ? List.of(singlePart(symbolsData))
            : splitByDays(symbolsData);

        log.info("[Splitter] Split {} symbols into {} parts ({} days per split) in {} ms",
            symbolsData.size(), parts.size(), daysPerSplit,
            Duration.ofNanos(System.nanoTime() - started).toMillis());
        return parts;
    }

    /**
     * Coarsest interval that can be warmed up without reaching before the available history.
     *
     * Starts from the lowest interval present and raises it to every coarser interval
     * holding more than {@code warmupCandlesCount} candles whose candle at position
     * {@code warmupCandlesCount} opens before the backtesting start.
     */
    public CandlestickInterval resolveWarmupTimeframe(List<SymbolData> symbolsData) {
        if (warmupTimeframe != null) {
            return warmupTimeframe;
        }

        CandlestickInterval potential = null;
        for (SymbolData symbol : symbolsData) {
            for (Timeframe timeframe : symbol.timeframes()) {
                if (potential == null || timeframe.getInterval().isLowerThan(potential)) {
                    potential = timeframe.getInterval();
                }
            }
        }
        if (potential == null) {
            return null;
        }

        for (SymbolData symbol : symbolsData) {
            for (Timeframe timeframe : symbol.timeframes()) {
                if (!timeframe.getInterval().isHigherThan(potential)) continue;
                if (timeframe.size() <= warmupCandlesCount) continue;

                Instant warmupDate = timeframe.getCandles().get(warmupCandlesCount).openTime();
                if (warmupDate.isBefore(backtestingStart)) {
                    potential = timeframe.getInterval();
                }
            }
        }
        return potential;
    }

    // ═══════════════════════════════════════════════════════════════
    // SPLITTING
    // ═══════════════════════════════════════════════════════════════

    private List<SymbolData> singlePart(List<SymbolData> symbolsData) {
        List<SymbolData> part = new ArrayList<>(symbolsData.size());
        for (SymbolData symbol : symbolsData) {
            List<Timeframe> timeframes = new ArrayList<>(symbol.timeframes().size());
            Instant firstTick = null;
            for (Timeframe source : symbol.timeframes()) {
                List<Candlestick> candles = source.getCandles();
                if (candles.isEmpty()) continue;

                int index;
                if (firstTick == null) {
                    index = Math.max(CandleSearch.firstIndexByOpenTime(candles, backtestingStart), 0);
                    firstTick = candles.get(index).openTime();
                } else {
                    index = CandleSearch.lastIndexOpenedAtOrBefore(candles, firstTick);
                    // No bar is live yet at the first tick
                    if (index < 0) continue;
                }
                timeframes.add(new Timeframe(
                    source.getInterval(),
                    Collections.unmodifiableList(candles),
                    warmupIndex(index),
                    index,
                    candles.size() - 1,
                    true));
            }
            part.add(new SymbolData(symbol.symbol(), timeframes));
        }
        return part;
    }

    private List<List<SymbolData>> splitByDays(List<SymbolData> symbolsData) {
        CandlestickInterval resolvedWarmup = resolveWarmupTimeframe(symbolsData);
        log.info("[Splitter] Warmup timeframe: {} ({} candles)", resolvedWarmup, warmupCandlesCount);

        Duration splitLength = Duration.ofDays(daysPerSplit);
        List<boolean[]> exhausted = new ArrayList<>(symbolsData.size());
        for (SymbolData symbol : symbolsData) {
            boolean[] flags = new boolean[symbol.timeframes().size()];
            for (int i = 0; i < flags.length; i++) {
                flags[i] = symbol.timeframes().get(i).getCandles().isEmpty();
            }
            exhausted.add(flags);
        }

        List<List<SymbolData>> parts = new ArrayList<>();
        Instant ongoingTime = backtestingStart;
        while (!allSymbolsReachedHistoryEnd(exhausted)) {
            Instant splitEnd = ongoingTime.plus(splitLength);
            List<SymbolData> part = new ArrayList<>();

            for (int s = 0; s < symbolsData.size(); s++) {
                boolean[] flags = exhausted.get(s);
                if (anyExhausted(flags)) continue;

                SymbolData symbolPart = splitSymbol(symbolsData.get(s), flags, ongoingTime, splitEnd);
                if (!symbolPart.timeframes().isEmpty()) {
                    part.add(symbolPart);
                }
            }

            if (!part.isEmpty()) {
                parts.add(part);
                log.debug("[Splitter] Part {} [{} .. {}): {} symbols",
                    parts.size(), ongoingTime, splitEnd, part.size());
            }
            ongoingTime = splitEnd;
        }
        return parts;
    }

    /**
     * Slice one symbol for the part {@code [ongoingTime, splitEnd)}.
     *
     * The lowest timeframe starts at the first candle opening at or after {@code ongoingTime};
     * that candle's open is the part's first tick. Higher timeframes start at the bar live at
     * the first tick. The lowest slice reaches back to the open of the oldest live higher bar
     * so forming bars can be consolidated from their first lowest candle.
     */
    private SymbolData splitSymbol(SymbolData symbol, boolean[] exhausted, Instant ongoingTime, Instant splitEnd) {
        List<Timeframe> sources = symbol.timeframes();
        List<Candlestick> lowest = sources.get(0).getCandles();

        // History has not begun yet for this symbol
        if (!lowest.get(0).openTime().isBefore(splitEnd)) {
            return new SymbolData(symbol.symbol(), List.of());
        }

        int lowestIndex = CandleSearch.firstIndexByOpenTime(lowest, ongoingTime);
        if (lowestIndex < 0) {
            // Every candle opened before this part: nothing left to replay
            exhausted[0] = true;
            return new SymbolData(symbol.symbol(), List.of());
        }
        Instant firstTick = lowest.get(lowestIndex).openTime();

        Instant lastSecond = splitEnd.minusSeconds(1);
        Instant[] endCloseTimes = new Instant[sources.size()];
        List<Range> ranges = new ArrayList<>(sources.size());
        Instant oldestLiveOpen = firstTick;

        for (int t = 0; t < sources.size(); t++) {
            List<Candlestick> candles = sources.get(t).getCandles();

            int index = lowestIndex;
            if (t > 0) {
                index = CandleSearch.lastIndexOpenedAtOrBefore(candles, firstTick);
                // No bar is live yet at the first tick
                if (index < 0) continue;

                Candlestick live = candles.get(index);
                if (index == candles.size() - 1 && live.closeTime().isBefore(firstTick)) {
                    // History ended before this part
                    exhausted[t] = true;
                    endCloseTimes[t] = live.closeTime();
                    continue;
                }
                if (live.openTime().isBefore(oldestLiveOpen)) {
                    oldestLiveOpen = live.openTime();
                }
            }

            int endIndex = CandleSearch.firstIndexByCloseTime(candles, lastSecond);

            if (correctEndIndex && endIndex >= 0) {
                Instant siblingEnd = earliestExhaustedEnd(exhausted, endCloseTimes);
                if (siblingEnd != null) {
                    endIndex = CandleSearch.firstIndexByCloseTime(candles, siblingEnd);
                }
            }

            if (endIndex < 0) {
                endIndex = candles.size() - 1;
                exhausted[t] = true;
            }
            endIndex = Math.max(endIndex, index);
            endCloseTimes[t] = candles.get(endIndex).closeTime();

            ranges.add(new Range(t, warmupIndex(index), index, endIndex));
        }

        List<Timeframe> timeframes = new ArrayList<>(ranges.size());
        for (Range range : ranges) {
            Timeframe source = sources.get(range.timeframe());
            int from = range.start();
            if (range.timeframe() == 0) {
                from = Math.min(from, CandleSearch.firstIndexByOpenTime(lowest, oldestLiveOpen, 0, range.index()));
            }

            List<Candlestick> slice = new ArrayList<>(source.getCandles().subList(from, range.end() + 1));
            timeframes.add(new Timeframe(
                source.getInterval(),
                slice,
                range.start() - from,
                range.index() - from,
                range.end() - from,
                exhausted[range.timeframe()]));
        }
        return new SymbolData(symbol.symbol(), timeframes);
    }

    private record Range(int timeframe, int start, int index, int end) {}

    /**
     * End close time of the exhausted sibling that closes earliest; it bounds the whole symbol.
     */
    private static Instant earliestExhaustedEnd(boolean[] exhausted, Instant[] endCloseTimes) {
        Instant earliest = null;
        for (int i = 0; i < exhausted.length; i++) {
            if (!exhausted[i] || endCloseTimes[i] == null) continue;
            if (earliest == null || endCloseTimes[i].isBefore(earliest)) {
                earliest = endCloseTimes[i];
            }
        }
        return earliest;
    }

    private int warmupIndex(int index) {
        return Math.max(index - warmupCandlesCount, 0);
    }

    private static boolean anyExhausted(boolean[] flags) {
        // A symbol without timeframes has nothing to replay
        if (flags.length == 0) return true;
        for (boolean flag : flags) {
            if (flag) return true;
        }
        return false;
    }

    private static boolean allSymbolsReachedHistoryEnd(List<boolean[]> exhausted) {
        for (boolean[] flags : exhausted) {
            if (!anyExhausted(flags)) return false;
        }
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // VALIDATION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Rough sortedness check: adjacent timeframes and the first two candles of each timeframe.
     */
    private static void validateSorted(List<SymbolData> symbolsData) {
        for (SymbolData symbol : symbolsData) {
            Timeframe prior = null;
            for (Timeframe timeframe : symbol.timeframes()) {
                if (prior != null && timeframe.getInterval().isLowerThan(prior.getInterval())) {
                    throw new SymbolDataValidationException(SplitErrorCode.INVALID_INPUT, symbol.symbol());
                }

                List<Candlestick> candles = timeframe.getCandles();
                if (candles.size() >= 2 && candles.get(1).openTime().isBefore(candles.get(0).openTime())) {
                    throw new SymbolDataValidationException(SplitErrorCode.INVALID_INPUT, symbol.symbol());
                }
                prior = timeframe;
            }
        }
    }

    private static void validateNoDuplicates(List<SymbolData> symbolsData) {
        Set<String> symbols = new HashSet<>();
        for (SymbolData symbol : symbolsData) {
            if (!symbols.add(symbol.symbol())) {
                throw new SymbolDataValidationException(SplitErrorCode.DUPLICATE_DATA, symbol.symbol());
            }

            Set<CandlestickInterval> intervals = EnumSet.noneOf(CandlestickInterval.class);
            for (Timeframe timeframe : symbol.timeframes()) {
                if (!intervals.add(timeframe.getInterval())) {
                    throw new SymbolDataValidationException(SplitErrorCode.DUPLICATE_DATA, symbol.symbol());
                }
            }
        }
    }
}
