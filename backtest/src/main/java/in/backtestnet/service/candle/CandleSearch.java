package in.backtestnet.service.candle;

import in.backtestnet.domain.data.Candlestick;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Binary searches and range scans over candle lists sorted ascending by open time.
 *
 * Close times of a sorted list are ascending too, so both searches are lower bounds.
 */
public final class CandleSearch {

    /**
     * First index whose openTime is at or after {@code target}, or -1 if none.
     */
    public static int firstIndexByOpenTime(List<Candlestick> candles, Instant target) {
        int found = firstIndexByOpenTime(candles, target, 0, candles.size());
        return found < candles.size() ? found : -1;
    }

    /**
     * First index in {@code [from, to)} whose openTime is at or after {@code target},
     * or {@code to} if none.
     */
    public static int firstIndexByOpenTime(List<Candlestick> candles, Instant target, int from, int to) {
        int lo = from;
        int hi = to - 1;
        int result = to;
        while (lo <= hi) {
            int mid = lo + ((hi - lo) >>> 1);
            if (!candles.get(mid).openTime().isBefore(target)) {
                result = mid;
                hi = mid - 1;
            } else {
                lo = mid + 1;
            }
        }
        return result;
    }

    /**
     * Last index whose openTime is at or before {@code target}, i.e. the candle that is
     * live at {@code target}. -1 if every candle opens later.
     */
    public static int lastIndexOpenedAtOrBefore(List<Candlestick> candles, Instant target) {
        int firstAfter = firstIndexByOpenTime(candles, target.plusNanos(1), 0, candles.size());
        return firstAfter - 1;
    }

    /**
     * First index whose closeTime is at or after {@code target}, or -1 if none.
     */
    public static int firstIndexByCloseTime(List<Candlestick> candles, Instant target) {
        int lo = 0;
        int hi = candles.size() - 1;
        int result = -1;
        while (lo <= hi) {
            int mid = lo + ((hi - lo) >>> 1);
            if (!candles.get(mid).closeTime().isBefore(target)) {
                result = mid;
                hi = mid - 1;
            } else {
                lo = mid + 1;
            }
        }
        return result;
    }

    /**
     * Running high/low over candles {@code [from, to)} seeded with the given values.
     */
    public static HighLow highLow(List<Candlestick> candles, int from, int to,
                                  BigDecimal seedHigh, BigDecimal seedLow) {
        BigDecimal high = seedHigh;
        BigDecimal low = seedLow;
        for (int i = from; i < to; i++) {
            Candlestick c = candles.get(i);
            if (c.high().compareTo(high) > 0) high = c.high();
            if (c.low().compareTo(low) < 0) low = c.low();
        }
        return new HighLow(high, low);
    }

    public record HighLow(BigDecimal high, BigDecimal low) {}

    private CandleSearch() {}
}
