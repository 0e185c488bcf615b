package io.bowler.core.error;

import java.util.Map;

/**
 * Any broker-boundary failure that is neither a declaration conflict nor a setup problem.
 */
public final class BowlerGeneralException extends BowlerException {

    BowlerGeneralException(String message,
                           int code,
                           Throwable original,
                           Map<String, Object> parameters,
                           Map<String, Object> arguments) {
        super(message, code, original, parameters, arguments);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.BOWLER_GENERAL;
    }
}
