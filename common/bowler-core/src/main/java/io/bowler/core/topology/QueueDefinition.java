package io.bowler.core.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Queue to declare and consume from.
 * <p>
 * An empty {@link #name()} asks the broker to generate one; the generated name is reported through
 * {@link DeclaredTopology#queueName()}. {@link #arguments()} carries optional queue arguments such as the
 * dead-letter directives produced by {@link DeadLetter}.
 *
 * @param name       queue name, empty for a broker-generated name
 * @param passive    only check that the queue exists
 * @param durable    survive broker restarts
 * @param exclusive  restrict the queue to the declaring connection
 * @param autoDelete delete once the last consumer is cancelled
 * @param arguments  optional {@code x-} arguments, never {@code null}
 */
public record QueueDefinition(String name,
                              boolean passive,
                              boolean durable,
                              boolean exclusive,
                              boolean autoDelete,
                              Map<String, Object> arguments) {

    public QueueDefinition {
        Objects.requireNonNull(name, "name");
        arguments = arguments == null || arguments.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        if (arguments.containsKey(DeadLetter.EXCHANGE_ARGUMENT)) {
            Object target = arguments.get(DeadLetter.EXCHANGE_ARGUMENT);
            if (!(target instanceof String exchange) || exchange.isBlank()) {
                throw new IllegalArgumentException(
                    "Queue '" + name + "' enables dead-lettering without a target exchange");
            }
        }
    }

    /**
     * Non-durable, non-exclusive queue with no arguments.
     */
    public static QueueDefinition named(String name) {
        return new QueueDefinition(name, false, false, false, false, Map.of());
    }

    /**
     * Durable, non-exclusive queue with no arguments.
     */
    public static QueueDefinition durable(String name) {
        return new QueueDefinition(name, false, true, false, false, Map.of());
    }

    /**
     * Broker-named, exclusive, auto-deleting queue, the usual shape for a private subscription.
     */
    public static QueueDefinition serverNamed() {
        return new QueueDefinition("", false, false, true, true, Map.of());
    }

    /**
     * Returns a copy with {@code extra} merged over the current arguments.
     */
    public QueueDefinition withArguments(Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(arguments);
        merged.putAll(extra);
        return new QueueDefinition(name, passive, durable, exclusive, autoDelete, merged);
    }

    public boolean isServerNamed() {
        return name.isEmpty();
    }

    Map<String, Object> describe() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("queueName", name);
        parameters.put("queuePassive", passive);
        parameters.put("queueDurable", durable);
        parameters.put("queueExclusive", exclusive);
        parameters.put("queueAutoDelete", autoDelete);
        return parameters;
    }
}
