package io.bowler.core.consumer;

/**
 * Application callback driven by {@link QueueConsumer}.
 * <p>
 * {@link #handle(Delivery)} runs once per delivery. Returning normally acknowledges the delivery; throwing
 * leaves it unacknowledged, reports the failure and then calls {@link #handleError(Throwable, Delivery)} so
 * the handler can nack, reject or retry explicitly.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Delivery delivery) throws Exception;

    /**
     * Called once, before the consumer registers with the broker.
     */
    default void setConsumer(QueueConsumer consumer) {
    }

    /**
     * Recovery hook for a failed {@link #handle(Delivery)}. Settle the delivery here through
     * {@link Delivery#nack(boolean, boolean)} or {@link Delivery#reject(boolean)} to decide its fate;
     * otherwise the consumer's {@link FailurePolicy} applies.
     */
    default void handleError(Throwable error, Delivery delivery) throws Exception {
    }
}
