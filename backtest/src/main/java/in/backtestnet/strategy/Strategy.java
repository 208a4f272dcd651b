package in.backtestnet.strategy;

import in.backtestnet.domain.data.SymbolData;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Decision logic evaluated once per tick against the current window.
 */
public interface Strategy {

    /**
     * @param window per-symbol, per-timeframe candles up to the current one
     * @return signals to forward, in execution order (empty when none)
     */
    CompletionStage<List<Signal>> execute(List<SymbolData> window);
}
