package io.bowler.core.topology;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link TopologyDeclarator#declare}.
 *
 * @param queueName resolved queue name, generated by the broker when the definition left it empty
 * @param exchange  exchange that was declared
 * @param bindings  bindings issued against the broker, already resolved to the declared names
 */
public record DeclaredTopology(String queueName, ExchangeDefinition exchange, List<Binding> bindings) {

    public DeclaredTopology {
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(exchange, "exchange");
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
    }
}
