package io.bowler.core.consumer;

/**
 * Last settlement issued for a {@link Delivery}.
 */
public enum Settlement {
    PENDING,
    ACKED,
    NACKED,
    REJECTED
}
