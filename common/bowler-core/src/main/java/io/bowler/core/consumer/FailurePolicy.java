package io.bowler.core.consumer;

/**
 * What {@link QueueConsumer} does with a delivery whose handler failed and whose recovery hook left it
 * unsettled.
 */
public enum FailurePolicy {

    /**
     * Leave the delivery unacknowledged. With a prefetch of one the consumer receives nothing else until the
     * channel closes, at which point the broker requeues the message.
     */
    LEAVE_UNACKNOWLEDGED,

    /** Reject without requeue, sending the message to the queue's dead-letter exchange if it has one. */
    REJECT,

    /** Nack with requeue so the broker redelivers the message. */
    REQUEUE
}
