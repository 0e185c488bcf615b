package io.bowler.core.topology;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.bowler.core.error.BowlerException;
import io.bowler.core.error.ExceptionTranslator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares an exchange, a queue and the bindings between them on a channel.
 * <p>
 * Declarations are idempotent on the broker side: declaring the same topology twice with identical settings
 * succeeds. A conflicting declaration closes the channel with {@code PRECONDITION_FAILED}, which the
 * {@link ExceptionTranslator} turns into a {@link io.bowler.core.error.DeclarationMismatchException} carrying
 * the full declaration parameter set. The classified exception is always thrown since the topology cannot
 * be used.
 */
public final class TopologyDeclarator {

    private static final Logger log = LoggerFactory.getLogger(TopologyDeclarator.class);

    private final Channel channel;
    private final ExceptionTranslator translator;

    public TopologyDeclarator(Channel channel, ExceptionTranslator translator) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.translator = Objects.requireNonNull(translator, "translator");
    }

    /**
     * Declares {@code exchange}, then {@code queue}, then each binding. When {@code bindings} is empty a single
     * binding with an empty routing key is created. The default exchange accepts neither declarations nor
     * bindings, so both are skipped when {@code exchange} names it.
     *
     * @return the declared topology, including the broker-generated queue name when one was requested
     * @throws BowlerException when the broker rejects any of the declarations
     */
    public DeclaredTopology declare(ExchangeDefinition exchange, QueueDefinition queue, List<Binding> bindings) {
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(queue, "queue");
        List<Binding> requested = bindings == null || bindings.isEmpty()
            ? List.of(Binding.routingKey(""))
            : List.copyOf(bindings);
        Map<String, Object> parameters = describe(exchange, queue, requested);
        try {
            declareExchange(exchange);
            String queueName = declareQueue(queue);
            List<Binding> issued = new ArrayList<>(requested.size());
            if (!exchange.isDefaultExchange()) {
                for (Binding binding : requested) {
                    Binding resolved = binding.resolve(queueName, exchange.name());
                    channel.queueBind(resolved.queue(), resolved.exchange(), resolved.routingKey());
                    issued.add(resolved);
                }
            }
            if (log.isDebugEnabled()) {
                log.debug("Declared topology exchange={} ({}) queue={} bindings={}",
                    exchange.name(), exchange.type().wireName(), queueName, issued.size());
            }
            return new DeclaredTopology(queueName, exchange, issued);
        } catch (IOException | RuntimeException ex) {
            throw translator.translate(ex, parameters, queue.arguments());
        }
    }

    /**
     * Declares only {@code exchange}. Used by publishers that have no queue of their own.
     *
     * @throws BowlerException when the broker rejects the declaration
     */
    public void declareExchange(ExchangeDefinition exchange, Map<String, Object> arguments) {
        Objects.requireNonNull(exchange, "exchange");
        try {
            declareExchange(exchange);
        } catch (IOException | RuntimeException ex) {
            throw translator.translate(ex, exchange.describe(), arguments);
        }
    }

    private void declareExchange(ExchangeDefinition exchange) throws IOException {
        if (exchange.isDefaultExchange()) {
            return;
        }
        if (exchange.passive()) {
            channel.exchangeDeclarePassive(exchange.name());
            return;
        }
        channel.exchangeDeclare(exchange.name(), exchange.type().wireName(), exchange.durable(),
            exchange.autoDelete(), null);
    }

    private String declareQueue(QueueDefinition queue) throws IOException {
        AMQP.Queue.DeclareOk declareOk;
        if (queue.passive()) {
            declareOk = channel.queueDeclarePassive(queue.name());
        } else {
            declareOk = channel.queueDeclare(queue.name(), queue.durable(), queue.exclusive(), queue.autoDelete(),
                queue.arguments().isEmpty() ? null : queue.arguments());
        }
        if (declareOk != null && declareOk.getQueue() != null && !declareOk.getQueue().isEmpty()) {
            return declareOk.getQueue();
        }
        return queue.name();
    }

    private static Map<String, Object> describe(ExchangeDefinition exchange,
                                                QueueDefinition queue,
                                                List<Binding> bindings) {
        Map<String, Object> parameters = new LinkedHashMap<>(exchange.describe());
        parameters.putAll(queue.describe());
        parameters.put("routingKeys", bindings.stream().map(Binding::routingKey).toList());
        return parameters;
    }
}
