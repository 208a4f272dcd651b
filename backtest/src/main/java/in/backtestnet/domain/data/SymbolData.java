package in.backtestnet.domain.data;

import java.util.List;
import java.util.Objects;

/**
 * A symbol and its timeframes, ascending by interval (index 0 is the lowest).
 */
public record SymbolData(
    String symbol,
    List<Timeframe> timeframes
) {
    public SymbolData {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timeframes, "timeframes");
    }

    public Timeframe lowestTimeframe() {
        return timeframes.get(0);
    }

    public Timeframe highestTimeframe() {
        return timeframes.get(timeframes.size() - 1);
    }
}
