package io.bowler.core.topology;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exchange to declare before consuming or publishing.
 *
 * @param name       exchange name; empty for the broker's default exchange
 * @param type       routing behaviour of the exchange
 * @param passive    only check that the exchange exists, never create or modify it
 * @param durable    survive broker restarts
 * @param autoDelete delete once the last bound queue is unbound
 */
public record ExchangeDefinition(String name, ExchangeType type, boolean passive, boolean durable, boolean autoDelete) {

    public ExchangeDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Non-passive, transient, non auto-deleting exchange of the given type.
     */
    public static ExchangeDefinition of(String name, ExchangeType type) {
        return new ExchangeDefinition(name, type, false, false, false);
    }

    /**
     * Non-passive, durable exchange of the given type.
     */
    public static ExchangeDefinition durable(String name, ExchangeType type) {
        return new ExchangeDefinition(name, type, false, true, false);
    }

    public boolean isDefaultExchange() {
        return name.isEmpty();
    }

    Map<String, Object> describe() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("exchangeName", name);
        parameters.put("exchangeType", type.wireName());
        parameters.put("passive", passive);
        parameters.put("durable", durable);
        parameters.put("autoDelete", autoDelete);
        return parameters;
    }
}
