package in.backtestnet.service.engine;

/**
 * Raised when a tick handler fails. The engine is left in {@code FAILED} state.
 */
public class BacktestEngineException extends RuntimeException {

    private final int partIndex;

    public BacktestEngineException(String message, int partIndex, Throwable cause) {
        super(message, cause);
        this.partIndex = partIndex;
    }

    public int getPartIndex() {
        return partIndex;
    }
}
