package io.bowler.core.error;

import java.util.Map;

/**
 * Raised when the broker refuses a declaration because the exchange or queue already exists with different
 * settings (type, durability, arguments).
 */
public final class DeclarationMismatchException extends BowlerException {

    DeclarationMismatchException(String message,
                                 int code,
                                 Throwable original,
                                 Map<String, Object> parameters,
                                 Map<String, Object> arguments) {
        super(message, code, original, parameters, arguments);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DECLARATION_MISMATCH;
    }
}
