package in.backtestnet.domain.common;

/**
 * Run state of one engine instance.
 */
public enum EngineState {
    IDLE,
    RUNNING,
    FINISHED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == FINISHED || this == CANCELLED || this == FAILED;
    }
}
