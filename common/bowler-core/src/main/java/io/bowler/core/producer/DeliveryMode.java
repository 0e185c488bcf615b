package io.bowler.core.producer;

/**
 * AMQP delivery mode of published messages.
 */
public enum DeliveryMode {

    /** Kept in memory only; lost on broker restart. */
    NON_PERSISTENT(1),

    /** Written to disk when routed to a durable queue. */
    PERSISTENT(2);

    private final int code;

    DeliveryMode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static DeliveryMode fromCode(int code) {
        for (DeliveryMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported delivery mode: " + code);
    }
}
