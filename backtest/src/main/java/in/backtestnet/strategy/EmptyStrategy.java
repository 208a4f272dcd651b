package in.backtestnet.strategy;

import in.backtestnet.domain.data.SymbolData;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Strategy that never signals. Used to measure raw replay throughput.
 */
public class EmptyStrategy implements Strategy {

    @Override
    public CompletionStage<List<Signal>> execute(List<SymbolData> window) {
        return CompletableFuture.completedFuture(List.of());
    }
}
