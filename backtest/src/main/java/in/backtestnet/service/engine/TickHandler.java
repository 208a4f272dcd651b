package in.backtestnet.service.engine;

import in.backtestnet.domain.data.SymbolData;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Per-tick callback. The engine awaits the returned stage before advancing cursors,
 * so the handler owns the window until the stage completes.
 */
@FunctionalInterface
public interface TickHandler {

    CompletionStage<Void> onTick(List<SymbolData> window);
}
