package io.bowler.core.topology;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the queue arguments that make the broker route rejected, expired or negatively acknowledged
 * (without requeue) messages to a dead-letter exchange. The redirection itself is done by the broker.
 */
public final class DeadLetter {

    public static final String EXCHANGE_ARGUMENT = "x-dead-letter-exchange";
    public static final String ROUTING_KEY_ARGUMENT = "x-dead-letter-routing-key";

    private DeadLetter() {
    }

    /**
     * Dead-letters to {@code exchange}, keeping each message's original routing key.
     */
    public static Map<String, Object> withDeadLetter(String exchange) {
        return withDeadLetter(exchange, null);
    }

    /**
     * Dead-letters to {@code exchange}, replacing the routing key with {@code routingKey} when it is not
     * {@code null}.
     *
     * @throws IllegalArgumentException when {@code exchange} is null or blank
     */
    public static Map<String, Object> withDeadLetter(String exchange, String routingKey) {
        if (exchange == null || exchange.isBlank()) {
            throw new IllegalArgumentException("dead-letter exchange must not be null or blank");
        }
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put(EXCHANGE_ARGUMENT, exchange);
        if (routingKey != null) {
            arguments.put(ROUTING_KEY_ARGUMENT, routingKey);
        }
        return Map.copyOf(arguments);
    }

    /**
     * Declares the dead-letter exchange and a durable queue bound to it so dead-lettered messages are kept.
     * With a routing key override the exchange is direct and the queue is bound on that key. Without one,
     * messages keep their original keys, so the exchange is a fanout and the queue is bound with no key.
     *
     * @param declarator declarator bound to the channel that will host the dead-letter topology
     * @param exchange   dead-letter exchange name
     * @param queue      queue collecting dead-lettered messages
     * @param routingKey routing key override passed to {@link #withDeadLetter(String, String)}, may be
     *                   {@code null}
     */
    public static DeclaredTopology declareTarget(TopologyDeclarator declarator,
                                                 String exchange,
                                                 String queue,
                                                 String routingKey) {
        Objects.requireNonNull(declarator, "declarator");
        if (exchange == null || exchange.isBlank()) {
            throw new IllegalArgumentException("dead-letter exchange must not be null or blank");
        }
        Objects.requireNonNull(queue, "queue");
        ExchangeDefinition target = routingKey == null
            ? ExchangeDefinition.durable(exchange, ExchangeType.FANOUT)
            : ExchangeDefinition.durable(exchange, ExchangeType.DIRECT);
        List<Binding> bindings = routingKey == null ? List.of() : List.of(Binding.routingKey(routingKey));
        return declarator.declare(target, QueueDefinition.durable(queue), bindings);
    }
}
