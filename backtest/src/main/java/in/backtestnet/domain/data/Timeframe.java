package in.backtestnet.domain.data;

import java.util.List;
import java.util.Objects;

/**
 * Candles of one interval plus the cursor state the engine walks.
 *
 * Cursor invariant for engine-consumed timeframes:
 * {@code startIndex <= index <= endIndex < candles.size()}.
 * Bounds are fixed by the splitter on creation; {@code index} is then moved only
 * by the engine's advance step, and only ever for the timeframe's own symbol.
 */
public final class Timeframe {
    private final CandlestickInterval interval;
    private final List<Candlestick> candles;
    private final int startIndex;
    private int index;
    private final int endIndex;
    private final boolean exhausted;

    public Timeframe(CandlestickInterval interval, List<Candlestick> candles) {
        this(interval, candles, 0, 0, 0, false);
    }

    public Timeframe(CandlestickInterval interval, List<Candlestick> candles,
                     int startIndex, int index, int endIndex, boolean exhausted) {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.candles = Objects.requireNonNull(candles, "candles");
        this.startIndex = startIndex;
        this.index = index;
        this.endIndex = endIndex;
        this.exhausted = exhausted;
    }

    public CandlestickInterval getInterval() {
        return interval;
    }

    public List<Candlestick> getCandles() {
        return candles;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getIndex() {
        return index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    public int getEndIndex() {
        return endIndex;
    }

    /**
     * True when no history exists beyond {@code endIndex} for this slice.
     */
    public boolean isExhausted() {
        return exhausted;
    }

    public boolean hasMoreData() {
        return index < endIndex;
    }

    public Candlestick getCurrentCandle() {
        return candles.get(index);
    }

    public Candlestick getEndCandle() {
        return candles.get(endIndex);
    }

    public int size() {
        return candles.size();
    }

    @Override
    public String toString() {
        return "Timeframe{" + interval
            + ", start=" + startIndex
            + ", index=" + index
            + ", end=" + endIndex
            + ", exhausted=" + exhausted
            + ", candles=" + candles.size() + '}';
    }
}
