package in.backtestnet.support;

import in.backtestnet.domain.data.Candlestick;
import in.backtestnet.domain.data.CandlestickInterval;
import in.backtestnet.domain.data.SymbolData;
import in.backtestnet.domain.data.Timeframe;
import in.backtestnet.service.split.SymbolDataSplitter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthetic candle history for tests.
 *
 * Every interval gets {@code count} consecutive candles starting at the given time,
 * with {@code closeTime = openTime + interval - 1s}. Prices are pseudo-random but
 * seeded, so runs are reproducible.
 */
public final class TestCandles {

    public static final List<String> SYMBOLS = List.of("BTCUSDT", "ETHUSDT", "SOLUSDT");
    public static final List<CandlestickInterval> INTRADAY = List.of(
        CandlestickInterval.M5, CandlestickInterval.M15, CandlestickInterval.M30, CandlestickInterval.H1);

    private static final long SEED = 20230101L;

    public static List<SymbolData> generate(List<String> symbols, List<CandlestickInterval> intervals,
                                            Instant firstOpenTime, int count) {
        Random random = new Random(SEED);
        List<SymbolData> result = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            List<Timeframe> timeframes = new ArrayList<>(intervals.size());
            for (CandlestickInterval interval : intervals) {
                timeframes.add(new Timeframe(interval, series(interval, firstOpenTime, count, random)));
            }
            result.add(new SymbolData(symbol, timeframes));
        }
        return result;
    }

    public static List<Candlestick> series(CandlestickInterval interval, Instant firstOpenTime, int count, Random random) {
        List<Candlestick> candles = new ArrayList<>(count);
        Duration step = interval.getDuration();
        for (int i = 0; i < count; i++) {
            Instant openTime = firstOpenTime.plus(step.multipliedBy(i));
            Instant closeTime = openTime.plus(step).minusSeconds(1);

            double base = 1000 + random.nextDouble() * 9000;
            double move = base * 0.05 * random.nextDouble();
            double close = random.nextBoolean() ? base + move * 0.7 : base - move * 0.7;

            candles.add(new Candlestick(openTime, closeTime,
                price(base), price(base + move), price(base - move), price(close), price(random.nextDouble() * 100)));
        }
        return candles;
    }

    /**
     * History generated {@code warmup} hours before {@code start}, then split with
     * end-index correction, the way a full run prepares its parts.
     */
    public static List<List<SymbolData>> parts(List<String> symbols, List<CandlestickInterval> intervals,
                                               Instant start, int count, int daysPerSplit, int warmup) {
        List<SymbolData> history = generate(symbols, intervals, start.minus(Duration.ofHours(warmup)), count);
        return new SymbolDataSplitter(daysPerSplit, warmup, start, true, null).split(history);
    }

    public static Candlestick candle(Instant openTime, Duration length, double o, double h, double l, double c) {
        return Candlestick.of(openTime, openTime.plus(length).minusSeconds(1), o, h, l, c, 0);
    }

    private static BigDecimal price(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    private TestCandles() {}
}
