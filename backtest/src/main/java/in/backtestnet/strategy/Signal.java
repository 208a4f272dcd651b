package in.backtestnet.strategy;

/**
 * Trade intent produced by a strategy for one symbol.
 */
public interface Signal {

    String getSymbol();
}
