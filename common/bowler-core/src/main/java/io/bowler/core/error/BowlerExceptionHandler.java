package io.bowler.core.error;

import io.bowler.core.consumer.Delivery;

/**
 * Application hook that reports (logging, alerting) and renders errors raised by Bowler.
 * <p>
 * Bowler always calls the report variant before the render variant for the same error. {@code delivery}
 * is {@code null} for failures that happen outside message processing, such as topology declaration.
 */
public interface BowlerExceptionHandler {

    void reportError(Throwable error, Delivery delivery);

    void renderError(Throwable error, Delivery delivery);

    /**
     * Reports a classified broker failure raised while handling {@code delivery}.
     */
    default void reportQueue(BowlerException error, Delivery delivery) {
        reportError(error, delivery);
    }

    /**
     * Renders a classified broker failure raised while handling {@code delivery}.
     */
    default void renderQueue(BowlerException error, Delivery delivery) {
        renderError(error, delivery);
    }
}
