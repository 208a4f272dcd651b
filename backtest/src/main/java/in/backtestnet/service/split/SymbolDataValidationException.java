package in.backtestnet.service.split;

import in.backtestnet.domain.common.SplitErrorCode;

/**
 * Thrown when the splitter's input fails validation. No partial result is produced.
 */
public class SymbolDataValidationException extends RuntimeException {

    private final SplitErrorCode errorCode;
    private final String symbol;

    public SymbolDataValidationException(SplitErrorCode errorCode, String symbol) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.symbol = symbol;
    }

    public SplitErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * First offending symbol.
     */
    public String getSymbol() {
        return symbol;
    }
}
