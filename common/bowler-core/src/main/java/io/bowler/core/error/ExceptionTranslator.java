package io.bowler.core.error;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ProtocolVersionMismatchException;
import com.rabbitmq.client.ShutdownSignalException;
import io.bowler.core.consumer.Delivery;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps failures raised by the RabbitMQ client into the {@link BowlerException} taxonomy and hands them to
 * the application's {@link BowlerExceptionHandler}.
 * <p>
 * Classification walks the cause chain of the failure because the client usually wraps the protocol
 * signal in an {@link java.io.IOException}. The first rule that matches wins:
 * <ol>
 *     <li>a {@code channel.close} sent by the broker (for example {@code PRECONDITION_FAILED} on
 *         {@code exchange.declare}) becomes a {@link DeclarationMismatchException};</li>
 *     <li>a {@code connection.close} sent by the broker (for example {@code ACCESS_REFUSED}), an
 *         authentication failure or a protocol version mismatch becomes an {@link InvalidSetupException};</li>
 *     <li>anything else becomes a {@link BowlerGeneralException}, including channels or connections the
 *         application closed itself and connections lost without a protocol close.</li>
 * </ol>
 * Every classified error is reported, then rendered, before it is returned to the caller.
 */
public final class ExceptionTranslator {

    private static final Logger log = LoggerFactory.getLogger(ExceptionTranslator.class);

    private final BowlerExceptionHandler exceptionHandler;

    public ExceptionTranslator(BowlerExceptionHandler exceptionHandler) {
        this.exceptionHandler = Objects.requireNonNull(exceptionHandler, "exceptionHandler");
    }

    public BowlerExceptionHandler exceptionHandler() {
        return exceptionHandler;
    }

    /**
     * Classifies a failure raised outside message processing.
     *
     * @see #translate(Throwable, Map, Map, Delivery)
     */
    public BowlerException translate(Throwable error,
                                     Map<String, Object> parameters,
                                     Map<String, Object> arguments) {
        return translate(error, parameters, arguments, null);
    }

    /**
     * Classifies {@code error}, reports it and renders it.
     * <p>
     * When {@code delivery} is {@code null} the general {@code reportError}/{@code renderError} hooks are
     * used, otherwise the queue-specific {@code reportQueue}/{@code renderQueue} hooks receive the delivery.
     * Errors that are already classified are returned as they are without being reported a second time.
     *
     * @param error      failure raised at the broker boundary
     * @param parameters declaration parameters of the failing call, may be {@code null}
     * @param arguments  declaration arguments of the failing call, may be {@code null}
     * @param delivery   delivery being processed when the failure happened, may be {@code null}
     * @return the classified error, for the caller to throw
     */
    public BowlerException translate(Throwable error,
                                     Map<String, Object> parameters,
                                     Map<String, Object> arguments,
                                     Delivery delivery) {
        Objects.requireNonNull(error, "error");
        if (error instanceof BowlerException classified) {
            return classified;
        }
        BowlerException classified = classify(error, parameters, arguments);
        notifyHandler(classified, delivery);
        return classified;
    }

    static BowlerException classify(Throwable error,
                                    Map<String, Object> parameters,
                                    Map<String, Object> arguments) {
        Map<String, Object> safeParameters = parameters == null ? Map.of() : parameters;
        Map<String, Object> safeArguments = arguments == null ? Map.of() : arguments;
        ShutdownSignalException signal = findCause(error, ShutdownSignalException.class);
        if (signal != null && !signal.isInitiatedByApplication()) {
            Method reason = signal.getReason();
            if (reason instanceof AMQP.Channel.Close close) {
                return new DeclarationMismatchException(
                    messageOf(error, signal), close.getReplyCode(), error, safeParameters, safeArguments);
            }
            if (reason instanceof AMQP.Connection.Close close) {
                return new InvalidSetupException(
                    messageOf(error, signal), close.getReplyCode(), error, safeParameters, safeArguments);
            }
        }
        Throwable setupFailure = findCause(error, PossibleAuthenticationFailureException.class);
        if (setupFailure == null) {
            setupFailure = findCause(error, ProtocolVersionMismatchException.class);
        }
        if (setupFailure != null) {
            return new InvalidSetupException(
                messageOf(error, setupFailure), 0, error, safeParameters, safeArguments);
        }
        return new BowlerGeneralException(messageOf(error, error), 0, error, safeParameters, safeArguments);
    }

    private void notifyHandler(BowlerException error, Delivery delivery) {
        try {
            if (delivery == null) {
                exceptionHandler.reportError(error, null);
            } else {
                exceptionHandler.reportQueue(error, delivery);
            }
        } catch (RuntimeException ex) {
            log.error("Exception handler failed to report {}", error.kind(), ex);
        }
        try {
            if (delivery == null) {
                exceptionHandler.renderError(error, null);
            } else {
                exceptionHandler.renderQueue(error, delivery);
            }
        } catch (RuntimeException ex) {
            log.error("Exception handler failed to render {}", error.kind(), ex);
        }
    }

    private static String messageOf(Throwable error, Throwable matched) {
        if (error.getMessage() != null && !error.getMessage().isBlank()) {
            return error.getMessage();
        }
        if (matched.getMessage() != null && !matched.getMessage().isBlank()) {
            return matched.getMessage();
        }
        return error.getClass().getName();
    }

    private static <T extends Throwable> T findCause(Throwable throwable, Class<T> type) {
        Throwable current = throwable;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            if (current.getCause() == current) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }
}
