package io.bowler.core.error;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Broker failure classified by {@link ExceptionTranslator}.
 * <p>
 * The exception keeps the diagnostic context of the original failure: its message, the AMQP reply code
 * (0 when the broker supplied none), the source location it was raised from and its stack trace. The
 * original failure is the {@linkplain #getCause() cause}; {@link #originalCause()} exposes whatever the
 * original failure itself was chained to. {@link #parameters()} and {@link #arguments()} carry the
 * declaration parameters and queue arguments supplied at the failing call site and are empty, never
 * {@code null}, when there were none.
 */
public abstract sealed class BowlerException extends RuntimeException
    permits DeclarationMismatchException, InvalidSetupException, BowlerGeneralException {

    private final int code;
    private final String sourceFile;
    private final int sourceLine;
    private final String originalTrace;
    private final Map<String, Object> parameters;
    private final Map<String, Object> arguments;

    BowlerException(String message,
                    int code,
                    Throwable original,
                    Map<String, Object> parameters,
                    Map<String, Object> arguments) {
        super(message, Objects.requireNonNull(original, "original"));
        this.code = code;
        StackTraceElement[] trace = original.getStackTrace();
        if (trace.length > 0) {
            this.sourceFile = trace[0].getFileName();
            this.sourceLine = trace[0].getLineNumber();
        } else {
            this.sourceFile = null;
            this.sourceLine = -1;
        }
        this.originalTrace = render(original);
        this.parameters = copy(parameters);
        this.arguments = copy(arguments);
        setStackTrace(trace);
    }

    public abstract ErrorKind kind();

    /**
     * AMQP reply code reported by the broker, or 0 when the failure carried none.
     */
    public int code() {
        return code;
    }

    /**
     * Source file of the frame that raised the original failure, {@code null} when unknown.
     */
    public String sourceFile() {
        return sourceFile;
    }

    /**
     * Line of the frame that raised the original failure, negative when unknown.
     */
    public int sourceLine() {
        return sourceLine;
    }

    /**
     * Stack trace of the original failure in its printed form, including its causes.
     */
    public String originalTrace() {
        return originalTrace;
    }

    /**
     * Whatever the original failure was chained to, {@code null} when it had no cause.
     */
    public Throwable originalCause() {
        return getCause().getCause();
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    public Map<String, Object> arguments() {
        return arguments;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static String render(Throwable original) {
        StringWriter writer = new StringWriter();
        original.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
