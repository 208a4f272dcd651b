package in.backtestnet.domain.data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * OHLCV candlestick.
 *
 * Ingested candles satisfy {@code openTime < closeTime}. A masked current candle
 * collapses to {@code closeTime == openTime}, so only a close before the open is rejected.
 */
public record Candlestick(
    Instant openTime,
    Instant closeTime,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume
) {
    public Candlestick {
        Objects.requireNonNull(openTime, "openTime");
        Objects.requireNonNull(closeTime, "closeTime");
        Objects.requireNonNull(open, "open");
        Objects.requireNonNull(high, "high");
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(close, "close");
        Objects.requireNonNull(volume, "volume");
        if (closeTime.isBefore(openTime)) {
            throw new IllegalArgumentException(
                "closeTime " + closeTime + " is before openTime " + openTime);
        }
    }

    /**
     * Current candle as a live feed shows it at the instant it opens:
     * high, low and close equal the open, closeTime equals openTime.
     */
    public Candlestick maskedToOpen() {
        return new Candlestick(openTime, openTime, open, open, open, open, volume);
    }

    /**
     * Copy with the forming-bar values replaced. Open, openTime and volume are kept.
     */
    public Candlestick withForming(Instant formingCloseTime, BigDecimal formingHigh,
                                   BigDecimal formingLow, BigDecimal formingClose) {
        return new Candlestick(openTime, formingCloseTime, open, formingHigh, formingLow, formingClose, volume);
    }

    public static Candlestick of(Instant openTime, Instant closeTime,
                                 double o, double h, double l, double c, double v) {
        return new Candlestick(
            openTime, closeTime,
            BigDecimal.valueOf(o),
            BigDecimal.valueOf(h),
            BigDecimal.valueOf(l),
            BigDecimal.valueOf(c),
            BigDecimal.valueOf(v)
        );
    }
}
