package io.bowler.core.error;

import java.util.Map;

/**
 * Raised when the broker closes the connection because of access, authentication or negotiation problems.
 */
public final class InvalidSetupException extends BowlerException {

    InvalidSetupException(String message,
                          int code,
                          Throwable original,
                          Map<String, Object> parameters,
                          Map<String, Object> arguments) {
        super(message, code, original, parameters, arguments);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_SETUP;
    }
}
