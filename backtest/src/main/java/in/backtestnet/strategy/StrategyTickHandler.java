package in.backtestnet.strategy;

import in.backtestnet.domain.data.SymbolData;
import in.backtestnet.service.engine.TickHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Tick handler that runs a strategy and forwards its signals to a trade executor.
 *
 * Signals are executed one after another in the order the strategy returned them;
 * the tick completes after the last trade completes.
 */
public class StrategyTickHandler implements TickHandler {
    private static final Logger log = LoggerFactory.getLogger(StrategyTickHandler.class);

    private final Strategy strategy;
    private final TradeExecutor tradeExecutor;

    public StrategyTickHandler(Strategy strategy, TradeExecutor tradeExecutor) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.tradeExecutor = Objects.requireNonNull(tradeExecutor, "tradeExecutor");
    }

    @Override
    public CompletionStage<Void> onTick(List<SymbolData> window) {
        return strategy.execute(window).thenCompose(this::executeInOrder);
    }

    private CompletionStage<Void> executeInOrder(List<Signal> signals) {
        CompletionStage<Void> chain = CompletableFuture.completedFuture(null);
        if (signals == null || signals.isEmpty()) {
            return chain;
        }

        log.debug("[StrategyTickHandler] Forwarding {} signals", signals.size());
        for (Signal signal : signals) {
            chain = chain.thenCompose(ignored -> tradeExecutor.execute(signal));
        }
        return chain;
    }
}
