package in.backtestnet.domain.common;

/**
 * Lifecycle notifications emitted by the backtest executor.
 */
public enum BacktestEventStatus {
    STARTED,
    FINISHED,

    SPLIT_STARTED,
    SPLIT_FINISHED,

    ENGINE_STARTED,

    /**
     * Engine returned, either after the last part or after a cancellation.
     */
    ENGINE_FINISHED,

    /**
     * Split or engine failed. Details carry the error message.
     */
    ERROR
}
