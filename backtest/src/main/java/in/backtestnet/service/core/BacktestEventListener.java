package in.backtestnet.service.core;

import in.backtestnet.domain.common.BacktestEventStatus;

/**
 * Receives backtest lifecycle notifications.
 */
@FunctionalInterface
public interface BacktestEventListener {

    /**
     * @param status lifecycle step
     * @param details component name, version or error message; may be null
     */
    void onEvent(BacktestEventStatus status, String details);
}
