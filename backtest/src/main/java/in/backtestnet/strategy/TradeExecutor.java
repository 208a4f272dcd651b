package in.backtestnet.strategy;

import java.util.concurrent.CompletionStage;

/**
 * Receives signals from the strategy. Fills and accounting are up to the implementation.
 */
public interface TradeExecutor {

    CompletionStage<Void> execute(Signal signal);
}
