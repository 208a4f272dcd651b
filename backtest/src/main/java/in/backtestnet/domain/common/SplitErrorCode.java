package in.backtestnet.domain.common;

/**
 * Reasons the splitter rejects its input.
 */
public enum SplitErrorCode {
    INVALID_INPUT("symbolsData argument contains invalid or not properly sorted data"),
    DUPLICATE_DATA("symbolsData contain duplicated symbols or timeframes");

    private final String message;

    SplitErrorCode(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
