package ibkr;

import ibkr.model.ErrorCategory;

/**
 * Decides what an inbound gateway error means for the session. Codes outside the known tables are
 * {@link ErrorCategory#UNCLASSIFIED} and treated like a request failure, so no caller waits forever.
 */
public class ErrorClassifier {

    public ErrorCategory classify(int code) {
        if (ErrorCodes.CONNECTION_FATAL.contains(code)) {
            return ErrorCategory.CONNECTION_FATAL;
        }
        if (ErrorCodes.INFORMATIONAL.contains(code) || ErrorCodes.WARNINGS.contains(code)) {
            return ErrorCategory.INFORMATIONAL;
        }
        if (code == ErrorCodes.NO_SECURITY_DEFINITION) {
            return ErrorCategory.NO_SECURITY_DEFINITION;
        }
        if (ErrorCodes.MARKET_DATA_PERMISSION.contains(code)) {
            return ErrorCategory.MARKET_DATA_PERMISSION;
        }
        if (ErrorCodes.ORDER_REJECTION.contains(code)) {
            return ErrorCategory.ORDER_REJECTED;
        }
        if (ErrorCodes.REQUEST_TERMINAL.contains(code)) {
            return ErrorCategory.REQUEST_TERMINAL;
        }
        return ErrorCategory.UNCLASSIFIED;
    }

    public boolean isWarning(int code) {
        return ErrorCodes.WARNINGS.contains(code);
    }

    /** True for categories that must wake whoever waits on the referenced id. */
    public boolean wakesWaiter(ErrorCategory category) {
        return category != ErrorCategory.INFORMATIONAL;
    }
}
