package io.bowler.core.topology;

import java.util.Locale;

/**
 * AMQP 0-9-1 exchange types understood by the broker.
 * <ul>
 *     <li>{@link #FANOUT} routes to every bound queue and ignores the routing key.</li>
 *     <li>{@link #DIRECT} routes on an exact routing key match. The nameless default exchange is a
 *         direct exchange that binds every queue under its own name.</li>
 *     <li>{@link #TOPIC} routes on dotted routing key patterns ({@code *} and {@code #}).</li>
 *     <li>{@link #HEADERS} routes on message header values instead of the routing key.</li>
 * </ul>
 */
public enum ExchangeType {

    FANOUT("fanout"),
    DIRECT("direct"),
    TOPIC("topic"),
    HEADERS("headers");

    private final String wireName;

    ExchangeType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the name used on the wire by {@code exchange.declare}.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves an exchange type from its wire name, ignoring case.
     *
     * @throws IllegalArgumentException when the value names no known exchange type
     */
    public static ExchangeType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("exchange type must not be null or blank");
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (ExchangeType type : values()) {
            if (type.wireName.equals(normalised)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported exchange type: " + value);
    }
}
