package in.backtestnet.domain.data;

import java.time.Duration;

/**
 * Candlestick aggregation intervals.
 *
 * Declaration order is ascending granularity, so {@link #compareTo} orders
 * intervals from the finest to the coarsest.
 */
public enum CandlestickInterval {
    M1(60),
    M3(180),
    M5(300),
    M15(900),
    M30(1_800),
    H1(3_600),
    H2(7_200),
    H4(14_400),
    H6(21_600),
    H8(28_800),
    H12(43_200),
    D1(86_400),
    D3(259_200),
    W1(604_800),

    /**
     * Monthly candles. Months vary in length; 30 days is used for arithmetic only.
     */
    MN1(2_592_000);

    private final long seconds;

    CandlestickInterval(long seconds) {
        this.seconds = seconds;
    }

    public Duration getDuration() {
        return Duration.ofSeconds(seconds);
    }

    public boolean isLowerThan(CandlestickInterval other) {
        return compareTo(other) < 0;
    }

    public boolean isHigherThan(CandlestickInterval other) {
        return compareTo(other) > 0;
    }
}
