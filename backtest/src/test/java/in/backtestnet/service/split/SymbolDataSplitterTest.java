package in.backtestnet.service.split;

import in.backtestnet.domain.common.SplitErrorCode;
import in.backtestnet.domain.data.Candlestick;
import in.backtestnet.domain.data.CandlestickInterval;
import in.backtestnet.domain.data.SymbolData;
import in.backtestnet.domain.data.Timeframe;
import in.backtestnet.support.TestCandles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SymbolDataSplitterTest {

    private static final Instant START = Instant.parse("2023-01-01T03:06:50Z");
    private static final int DAYS_PER_SPLIT = 1;
    private static final int WARMUP = 2;
    private static final List<CandlestickInterval> INTERVALS =
        List.of(CandlestickInterval.M5, CandlestickInterval.M15);

    private List<SymbolData> history;
    private List<List<SymbolData>> parts;

    @BeforeEach
    void setUp() {
        history = TestCandles.generate(TestCandles.SYMBOLS, INTERVALS, START.minus(Duration.ofHours(WARMUP)), 672);
        parts = new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, START, true, null).split(history);
    }

    @Test
    void split_producesThreeParts() {
        assertEquals(3, parts.size());
    }

    @Test
    void split_producesNoEmptyParts() {
        for (List<SymbolData> part : parts) {
            assertFalse(part.isEmpty());
            for (SymbolData symbol : part) {
                assertFalse(symbol.timeframes().isEmpty(), "symbol " + symbol.symbol() + " has no timeframes");
            }
        }
    }

    @Test
    void split_currentCandlesOpenTogether() {
        for (List<SymbolData> part : parts) {
            for (SymbolData symbol : part) {
                Instant expected = symbol.lowestTimeframe().getCurrentCandle().openTime();
                for (Timeframe timeframe : symbol.timeframes()) {
                    assertEquals(expected, timeframe.getCurrentCandle().openTime(),
                        symbol.symbol() + " " + timeframe.getInterval());
                }
            }
        }
    }

    @Test
    void split_endCandlesCloseTogether() {
        for (List<SymbolData> part : parts) {
            for (SymbolData symbol : part) {
                Instant expected = symbol.lowestTimeframe().getEndCandle().closeTime();
                for (Timeframe timeframe : symbol.timeframes()) {
                    assertEquals(expected, timeframe.getEndCandle().closeTime(),
                        symbol.symbol() + " " + timeframe.getInterval());
                }
            }
        }
    }

    @Test
    void split_partsAreSequentialWithoutGaps() {
        Instant ongoing = START;
        for (int p = 0; p < parts.size() - 1; p++) {
            Instant next = ongoing.plus(Duration.ofDays(DAYS_PER_SPLIT));
            for (SymbolData symbol : parts.get(p)) {
                for (Timeframe timeframe : symbol.timeframes()) {
                    assertEquals(ongoing, timeframe.getCurrentCandle().openTime());
                    assertEquals(next.minusSeconds(1), timeframe.getEndCandle().closeTime());
                }
            }
            ongoing = next;
        }
    }

    @Test
    void split_cursorsAreRebasedAndWithinBounds() {
        for (List<SymbolData> part : parts) {
            for (SymbolData symbol : part) {
                for (Timeframe timeframe : symbol.timeframes()) {
                    assertEquals(0, timeframe.getStartIndex());
                    assertTrue(timeframe.getIndex() <= WARMUP);
                    assertTrue(timeframe.getIndex() <= timeframe.getEndIndex());
                    assertEquals(timeframe.size() - 1, timeframe.getEndIndex());
                }
            }
        }
        Timeframe firstLowest = parts.get(0).get(0).lowestTimeframe();
        assertEquals(WARMUP, firstLowest.getIndex());
    }

    @Test
    void split_lastPartIsExhausted() {
        List<SymbolData> last = parts.get(parts.size() - 1);
        for (SymbolData symbol : last) {
            assertTrue(symbol.lowestTimeframe().isExhausted());
        }
    }

    @Test
    void split_isIdempotentAndLeavesSourceUntouched() {
        List<Integer> sizesBefore = new ArrayList<>();
        for (SymbolData symbol : history) {
            for (Timeframe timeframe : symbol.timeframes()) {
                sizesBefore.add(timeframe.size());
                assertEquals(0, timeframe.getIndex());
                assertFalse(timeframe.isExhausted());
            }
        }

        List<List<SymbolData>> again = new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, START, true, null).split(history);

        assertEquals(parts.size(), again.size());
        for (int p = 0; p < parts.size(); p++) {
            assertEquals(parts.get(p).size(), again.get(p).size());
            for (int s = 0; s < parts.get(p).size(); s++) {
                List<Timeframe> expected = parts.get(p).get(s).timeframes();
                List<Timeframe> actual = again.get(p).get(s).timeframes();
                assertEquals(expected.size(), actual.size());
                for (int t = 0; t < expected.size(); t++) {
                    assertEquals(expected.get(t).getIndex(), actual.get(t).getIndex());
                    assertEquals(expected.get(t).getEndIndex(), actual.get(t).getEndIndex());
                    assertEquals(expected.get(t).getCandles(), actual.get(t).getCandles());
                }
            }
        }

        int i = 0;
        for (SymbolData symbol : history) {
            for (Timeframe timeframe : symbol.timeframes()) {
                assertEquals(sizesBefore.get(i++), timeframe.size());
                assertEquals(0, timeframe.getIndex());
                assertFalse(timeframe.isExhausted());
            }
        }
    }

    @Test
    void split_higherTimeframesStartOnBarLiveAtFirstTick() {
        Instant midnight = Instant.parse("2023-01-01T00:00:00Z");
        List<SymbolData> aligned = TestCandles.generate(List.of("BTCUSDT"),
            List.of(CandlestickInterval.M5, CandlestickInterval.H1), midnight, 864);

        List<List<SymbolData>> result = new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, START, true, null).split(aligned);

        assertEquals(Instant.parse("2023-01-01T03:00:00Z"),
            result.get(0).get(0).highestTimeframe().getCurrentCandle().openTime());
        for (List<SymbolData> part : result) {
            SymbolData symbol = part.get(0);
            Instant firstTick = symbol.lowestTimeframe().getCurrentCandle().openTime();
            Candlestick hourly = symbol.highestTimeframe().getCurrentCandle();
            assertEquals(CandlestickInterval.H1, symbol.highestTimeframe().getInterval());
            assertFalse(hourly.openTime().isAfter(firstTick), hourly + " opens after " + firstTick);
            assertFalse(hourly.closeTime().isBefore(firstTick), hourly + " closed before " + firstTick);
        }
    }

    @Test
    void split_keepsLongBarThatOpenedBeforeThePart() {
        Instant midnight = Instant.parse("2023-01-01T00:00:00Z");
        Random random = new Random(7);
        List<SymbolData> input = List.of(new SymbolData("BTCUSDT", List.of(
            new Timeframe(CandlestickInterval.M5, TestCandles.series(CandlestickInterval.M5, midnight, 864, random)),
            new Timeframe(CandlestickInterval.W1, TestCandles.series(CandlestickInterval.W1, midnight, 2, random)))));

        List<List<SymbolData>> result = new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, START, true, null).split(input);

        assertEquals(3, result.size());
        for (List<SymbolData> part : result) {
            Timeframe weekly = part.get(0).highestTimeframe();
            assertEquals(CandlestickInterval.W1, weekly.getInterval());
            assertEquals(midnight, weekly.getCurrentCandle().openTime());
        }
    }

    @Test
    void split_lowestSliceReachesBackToOpenOfLiveHigherBar() {
        Instant midnight = Instant.parse("2023-01-01T00:00:00Z");
        Random random = new Random(7);
        List<SymbolData> input = List.of(new SymbolData("BTCUSDT", List.of(
            new Timeframe(CandlestickInterval.M5, TestCandles.series(CandlestickInterval.M5, midnight, 864, random)),
            new Timeframe(CandlestickInterval.W1, TestCandles.series(CandlestickInterval.W1, midnight, 2, random)))));

        List<List<SymbolData>> result = new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, midnight, true, null).split(input);

        Timeframe second = result.get(1).get(0).lowestTimeframe();
        assertEquals(midnight, second.getCandles().get(0).openTime());
        assertEquals(midnight.plus(Duration.ofDays(1)), second.getCurrentCandle().openTime());
        assertEquals(286, second.getStartIndex());
        assertEquals(WARMUP, second.getIndex() - second.getStartIndex());
    }

    @Test
    void split_withoutDaysReturnsSinglePartSharingCandles() {
        List<List<SymbolData>> single = new SymbolDataSplitter(0, WARMUP, START).split(history);

        assertEquals(1, single.size());
        assertEquals(history.size(), single.get(0).size());

        Timeframe source = history.get(0).lowestTimeframe();
        Timeframe timeframe = single.get(0).get(0).lowestTimeframe();
        assertNotSame(source, timeframe);
        assertEquals(24, timeframe.getIndex());
        assertEquals(22, timeframe.getStartIndex());
        assertEquals(source.size() - 1, timeframe.getEndIndex());
        assertTrue(timeframe.isExhausted());
        assertEquals(START, timeframe.getCurrentCandle().openTime());
        assertThrows(UnsupportedOperationException.class, () -> timeframe.getCandles().clear());
    }

    @Test
    void split_withoutDaysStartsAtZeroWhenNothingOpensAfterStart() {
        List<List<SymbolData>> single = new SymbolDataSplitter(0, WARMUP, START.plus(Duration.ofDays(365))).split(history);

        Timeframe timeframe = single.get(0).get(0).lowestTimeframe();
        assertEquals(0, timeframe.getIndex());
        assertEquals(0, timeframe.getStartIndex());
    }

    @Test
    void split_rejectsUnsortedTimeframes() {
        List<Timeframe> reversed = new ArrayList<>(history.get(1).timeframes());
        Collections.reverse(reversed);
        List<SymbolData> input = List.of(history.get(0), new SymbolData("ETHUSDT", reversed));

        SymbolDataValidationException e = assertThrows(SymbolDataValidationException.class,
            () -> new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, START).split(input));

        assertEquals(SplitErrorCode.INVALID_INPUT, e.getErrorCode());
        assertEquals("ETHUSDT", e.getSymbol());
        assertEquals("symbolsData argument contains invalid or not properly sorted data", e.getMessage());
    }

    @Test
    void split_rejectsUnsortedCandles() {
        List<Candlestick> candles = new ArrayList<>(history.get(0).lowestTimeframe().getCandles());
        Collections.swap(candles, 0, 1);
        List<SymbolData> input = List.of(new SymbolData("BTCUSDT",
            List.of(new Timeframe(CandlestickInterval.M5, candles))));

        SymbolDataValidationException e = assertThrows(SymbolDataValidationException.class,
            () -> new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, START).split(input));

        assertEquals(SplitErrorCode.INVALID_INPUT, e.getErrorCode());
    }

    @Test
    void split_rejectsDuplicateSymbols() {
        List<SymbolData> input = List.of(history.get(0), history.get(0));

        SymbolDataValidationException e = assertThrows(SymbolDataValidationException.class,
            () -> new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, START).split(input));

        assertEquals(SplitErrorCode.DUPLICATE_DATA, e.getErrorCode());
        assertEquals("symbolsData contain duplicated symbols or timeframes", e.getMessage());
    }

    @Test
    void split_rejectsDuplicateIntervalInAnySymbol() {
        Timeframe m5 = history.get(2).lowestTimeframe();
        List<SymbolData> input = List.of(history.get(0), history.get(1),
            new SymbolData("SOLUSDT", List.of(m5, new Timeframe(CandlestickInterval.M5, m5.getCandles()))));

        SymbolDataValidationException e = assertThrows(SymbolDataValidationException.class,
            () -> new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, START).split(input));

        assertEquals(SplitErrorCode.DUPLICATE_DATA, e.getErrorCode());
        assertEquals("SOLUSDT", e.getSymbol());
    }

    @Test
    void split_emptyInputProducesNoParts() {
        assertTrue(new SymbolDataSplitter(DAYS_PER_SPLIT, WARMUP, START).split(List.of()).isEmpty());
    }

    @Test
    void resolveWarmupTimeframe_raisesToCoarsestIntervalWithEnoughHistory() {
        List<SymbolData> data = TestCandles.generate(List.of("BTCUSDT"),
            List.of(CandlestickInterval.M5, CandlestickInterval.H1, CandlestickInterval.D1),
            START.minus(Duration.ofHours(WARMUP)), 100);

        // H1 candle #2 opens exactly at START, so only M5 qualifies
        assertEquals(CandlestickInterval.M5, new SymbolDataSplitter(1, WARMUP, START).resolveWarmupTimeframe(data));

        // One more second of lead time lets H1 qualify; D1 candle #2 is still in the future
        SymbolDataSplitter later = new SymbolDataSplitter(1, WARMUP, START.plusSeconds(1));
        assertEquals(CandlestickInterval.H1, later.resolveWarmupTimeframe(data));
    }

    @Test
    void resolveWarmupTimeframe_prefersExplicitInterval() {
        SymbolDataSplitter splitter = new SymbolDataSplitter(1, WARMUP, START, false, CandlestickInterval.H4);

        assertEquals(CandlestickInterval.H4, splitter.resolveWarmupTimeframe(history));
    }
}
