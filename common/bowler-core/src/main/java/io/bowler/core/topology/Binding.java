package io.bowler.core.topology;

import java.util.Objects;

/**
 * Queue to exchange binding. Bindings created through {@link #routingKey(String)} leave queue and exchange
 * empty; {@link TopologyDeclarator} fills them in from the topology it declares.
 *
 * @param queue      bound queue, empty to use the declared queue
 * @param exchange   source exchange, empty to use the declared exchange
 * @param routingKey binding key, empty for fanout semantics
 */
public record Binding(String queue, String exchange, String routingKey) {

    public Binding {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(exchange, "exchange");
        routingKey = routingKey == null ? "" : routingKey;
    }

    public static Binding routingKey(String routingKey) {
        return new Binding("", "", routingKey);
    }

    Binding resolve(String declaredQueue, String declaredExchange) {
        return new Binding(
            queue.isEmpty() ? declaredQueue : queue,
            exchange.isEmpty() ? declaredExchange : exchange,
            routingKey);
    }
}
