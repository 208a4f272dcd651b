package in.backtestnet.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.backtestnet.domain.data.CandlestickInterval;
import in.backtestnet.util.Env;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Configuration for one backtest run.
 *
 * Loaded from JSON ({@link #fromJson(Path)}) or from environment variables /
 * system properties ({@link #fromEnv()}), falling back to {@link #defaults()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestConfig(
    @JsonProperty("startTime")
    Instant startTime,                      // Simulated time of the first tick

    @JsonProperty("daysPerSplit")
    int daysPerSplit,                       // Days per part, 0 = single part

    @JsonProperty("warmupCandlesCount")
    int warmupCandlesCount,                 // History candles handed to the strategy before the current one

    @JsonProperty("correctEndIndex")
    boolean correctEndIndex,                // Align a symbol's timeframes to its earliest-ending exhausted one

    @JsonProperty("warmupTimeframe")
    CandlestickInterval warmupTimeframe,    // null = resolved from data

    @JsonProperty("sortCandlesDescending")
    boolean sortCandlesDescending,          // Current candle first in every window

    @JsonProperty("useFullCandleForCurrent")
    boolean useFullCandleForCurrent,        // Skip masking of forming candles

    @JsonProperty("parallelism")
    int parallelism                         // Worker threads for per-symbol fan-out
) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static BacktestConfig defaults() {
        return new BacktestConfig(
            Instant.parse("2023-01-01T00:00:00Z"),
            0,
            0,
            false,
            null,
            true,
            false,
            Runtime.getRuntime().availableProcessors()
        );
    }

    /**
     * Read configuration from environment variables, then system properties.
     *
     * @throws IllegalStateException if a value cannot be parsed or is out of range
     */
    public static BacktestConfig fromEnv() {
        BacktestConfig d = defaults();
        BacktestConfig config = new BacktestConfig(
            Env.getInstant("BACKTEST_START", d.startTime()),
            Env.getInt("BACKTEST_DAYS_PER_SPLIT", d.daysPerSplit()),
            Env.getInt("BACKTEST_WARMUP_CANDLES", d.warmupCandlesCount()),
            Env.getBool("BACKTEST_CORRECT_END_INDEX", d.correctEndIndex()),
            Env.getEnum("BACKTEST_WARMUP_TIMEFRAME", CandlestickInterval.class, d.warmupTimeframe()),
            Env.getBool("BACKTEST_SORT_DESC", d.sortCandlesDescending()),
            Env.getBool("BACKTEST_USE_FULL_CANDLE", d.useFullCandleForCurrent()),
            Env.getInt("BACKTEST_PARALLELISM", d.parallelism())
        );
        config.validate();
        return config;
    }

    /**
     * Read configuration from a JSON file. Missing fields keep their {@link #defaults()} value.
     *
     * @throws UncheckedIOException if the file cannot be read or parsed
     * @throws IllegalStateException if a value is out of range
     */
    public static BacktestConfig fromJson(Path path) {
        try {
            ObjectNode merged = MAPPER.valueToTree(defaults());
            JsonNode overrides = MAPPER.readTree(path.toFile());
            if (overrides instanceof ObjectNode) {
                merged.setAll((ObjectNode) overrides);
            } else {
                throw new IllegalStateException("Backtest config " + path + " must be a JSON object");
            }
            BacktestConfig config = MAPPER.treeToValue(merged, BacktestConfig.class);
            config.validate();
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read backtest config from " + path, e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize backtest config", e);
        }
    }

    /**
     * @throws IllegalStateException listing the first invalid value
     */
    public void validate() {
        if (startTime == null) {
            throw new IllegalStateException("startTime is required");
        }
        if (warmupCandlesCount < 0) {
            throw new IllegalStateException("warmupCandlesCount must not be negative: " + warmupCandlesCount);
        }
        if (parallelism < 1) {
            throw new IllegalStateException("parallelism must be at least 1: " + parallelism);
        }
    }
}
