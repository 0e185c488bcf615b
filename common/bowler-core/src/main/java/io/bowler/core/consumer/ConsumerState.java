package io.bowler.core.consumer;

/**
 * Lifecycle of a {@link QueueConsumer}.
 */
public enum ConsumerState {
    IDLE,
    DECLARED,
    CONSUMING,
    STOPPED
}
