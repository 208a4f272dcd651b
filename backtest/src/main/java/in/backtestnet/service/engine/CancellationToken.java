package in.backtestnet.service.engine;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag shared between a caller and a running backtest.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancellationRequested() {
        if (cancelled) {
            throw new CancellationException("Backtest cancelled");
        }
    }
}
