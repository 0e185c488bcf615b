package io.bowler.core.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.bowler.core.connection.BrokerConnection;
import io.bowler.core.error.BowlerException;
import io.bowler.core.error.BowlerExceptionHandler;
import io.bowler.core.error.ExceptionTranslator;
import io.bowler.core.error.LoggingExceptionHandler;
import io.bowler.core.topology.Binding;
import io.bowler.core.topology.DeadLetter;
import io.bowler.core.topology.DeclaredTopology;
import io.bowler.core.topology.ExchangeDefinition;
import io.bowler.core.topology.QueueDefinition;
import io.bowler.core.topology.TopologyDeclarator;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Blocking consumption loop over a single channel.
 * <p>
 * {@link #listenToQueue(MessageHandler)} declares the configured topology, limits the channel to one
 * unacknowledged delivery, registers a manual-acknowledgment consumer and then processes deliveries one at a
 * time on the calling thread. The RabbitMQ client's dispatch thread only hands deliveries over; handler code
 * never runs on it.
 * <p>
 * Acknowledgment rules:
 * <ul>
 *     <li>a handler that returns normally gets exactly one {@code basic.ack} for the delivery's tag, unless it
 *         settled the delivery itself;</li>
 *     <li>a handler that throws, an {@link Error} included, is never acknowledged. The failure is passed to
 *         {@link BowlerExceptionHandler#reportError} and then {@link BowlerExceptionHandler#renderError}, after
 *         which {@link MessageHandler#handleError} may settle the delivery. A delivery still pending after
 *         that is treated according to the {@link FailurePolicy}.</li>
 * </ul>
 * Handler failures other than a {@link VirtualMachineError} never end the loop. It ends when {@link #stop()}
 * is called, when the broker reports that no consumer registration is left (cancel-ok, a broker-initiated
 * cancel or channel shutdown) or when the thread is interrupted.
 * <p>
 * One instance owns one channel. Run several instances, each on its own channel, for parallelism.
 */
public final class QueueConsumer {

    public static final String MDC_CONSUMER_TAG = "bowler.consumerTag";
    public static final String MDC_DELIVERY_TAG = "bowler.deliveryTag";
    public static final String MDC_ROUTING_KEY = "bowler.routingKey";

    private static final Logger log = LoggerFactory.getLogger(QueueConsumer.class);
    private static final int PREFETCH_COUNT = 1;

    private final Channel channel;
    private final ExchangeDefinition exchange;
    private final QueueDefinition queue;
    private final List<Binding> bindings;
    private final ExceptionTranslator translator;
    private final String requestedConsumerTag;
    private final Duration pollInterval;
    private final FailurePolicy failurePolicy;
    private final ConsumerMetrics metrics;
    private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
    private final AtomicInteger activeConsumers = new AtomicInteger();
    private final AtomicBoolean cancelIssued = new AtomicBoolean();
    private volatile boolean stopRequested;
    private volatile ConsumerState state = ConsumerState.IDLE;
    private volatile String queueName;
    private volatile String consumerTag;

    private QueueConsumer(Builder builder, Channel channel, QueueDefinition queue, ExceptionTranslator translator) {
        this.channel = channel;
        this.exchange = builder.exchange;
        this.queue = queue;
        this.bindings = List.copyOf(builder.bindings);
        this.translator = translator;
        this.requestedConsumerTag = builder.consumerTag;
        this.pollInterval = builder.pollInterval;
        this.failurePolicy = builder.failurePolicy;
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Declares the topology and consumes until the consumer is stopped or cancelled.
     * <p>
     * When declaration fails the classified exception is thrown, the consumer stays {@link ConsumerState#IDLE}
     * and nothing is registered with the broker.
     *
     * @param handler application callback invoked for each delivery
     * @throws BowlerException       when the topology cannot be declared or the consumer cannot be registered
     * @throws IllegalStateException when the consumer has already been started
     */
    public void listenToQueue(MessageHandler handler) {
        Objects.requireNonNull(handler, "handler");
        synchronized (this) {
            if (state != ConsumerState.IDLE) {
                throw new IllegalStateException("Consumer already started (state=" + state + ")");
            }
            DeclaredTopology topology = new TopologyDeclarator(channel, translator).declare(exchange, queue, bindings);
            queueName = topology.queueName();
            state = ConsumerState.DECLARED;
        }
        handler.setConsumer(this);
        try {
            register();
        } catch (BowlerException ex) {
            state = ConsumerState.STOPPED;
            throw ex;
        }
        state = ConsumerState.CONSUMING;
        log.info("Consuming from queue {} (exchange={}, consumerTag={})", queueName, exchange.name(), consumerTag);
        try {
            consume(handler);
        } finally {
            cancelRegistration();
            state = ConsumerState.STOPPED;
            log.info("Stopped consuming from queue {} (consumerTag={})", queueName, consumerTag);
        }
    }

    /**
     * Asks the loop to exit after the delivery currently being handled and cancels the broker registration.
     * Safe to call from any thread, including from inside a handler.
     */
    public void stop() {
        stopRequested = true;
        cancelRegistration();
    }

    private void cancelRegistration() {
        String tag = consumerTag;
        if (tag == null || activeConsumers.get() == 0 || !cancelIssued.compareAndSet(false, true)) {
            return;
        }
        try {
            channel.basicCancel(tag);
        } catch (ShutdownSignalException ex) {
            log.debug("Channel already closed while cancelling consumer {}", tag, ex);
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to cancel consumer {} on queue {}", tag, queueName, ex);
        }
    }

    /**
     * Acknowledges a single delivery on the channel that produced it.
     *
     * @throws BowlerException when the broker rejects the acknowledgment; the failure has been reported
     */
    public void ack(Delivery delivery) {
        Objects.requireNonNull(delivery, "delivery");
        settle(delivery, Settlement.ACKED, "basic.ack", false, false, delivery::ack);
    }

    /**
     * Negatively acknowledges a delivery.
     *
     * @param multiple also nack every unsettled delivery with a lower tag
     * @param requeue  requeue instead of discarding or dead-lettering
     * @throws BowlerException when the broker rejects the nack; the failure has been reported
     */
    public void nack(Delivery delivery, boolean multiple, boolean requeue) {
        Objects.requireNonNull(delivery, "delivery");
        settle(delivery, Settlement.NACKED, "basic.nack", multiple, requeue,
            () -> delivery.nack(multiple, requeue));
    }

    /**
     * Rejects a delivery. Without requeue the message goes to the queue's dead-letter exchange, if any.
     *
     * @throws BowlerException when the broker rejects the reject; the failure has been reported
     */
    public void reject(Delivery delivery, boolean requeue) {
        Objects.requireNonNull(delivery, "delivery");
        settle(delivery, Settlement.REJECTED, "basic.reject", false, requeue, () -> delivery.reject(requeue));
    }

    public ConsumerState state() {
        return state;
    }

    /**
     * Queue being consumed, resolved after declaration; {@code null} before.
     */
    public String queueName() {
        return queueName;
    }

    /**
     * Consumer tag assigned at registration; {@code null} before.
     */
    public String consumerTag() {
        return consumerTag;
    }

    public Channel channel() {
        return channel;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    private void register() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("queueName", queueName);
        parameters.put("consumerTag", requestedConsumerTag);
        parameters.put("prefetchCount", PREFETCH_COUNT);
        parameters.put("autoAck", false);
        activeConsumers.incrementAndGet();
        try {
            channel.basicQos(0, PREFETCH_COUNT, false);
            consumerTag = channel.basicConsume(queueName, false, requestedConsumerTag, false, false, null,
                new BufferingConsumer(channel));
        } catch (IOException | RuntimeException ex) {
            activeConsumers.decrementAndGet();
            throw translator.translate(ex, parameters, Map.of());
        }
    }

    private void consume(MessageHandler handler) {
        while (!stopRequested) {
            Delivery delivery;
            try {
                delivery = deliveries.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.info("Consumer {} interrupted while waiting for deliveries", consumerTag);
                return;
            }
            if (delivery != null) {
                process(handler, delivery);
            } else if (activeConsumers.get() == 0) {
                return;
            }
        }
    }

    private void process(MessageHandler handler, Delivery delivery) {
        MDC.put(MDC_CONSUMER_TAG, String.valueOf(delivery.consumerTag()));
        MDC.put(MDC_DELIVERY_TAG, Long.toString(delivery.deliveryTag()));
        MDC.put(MDC_ROUTING_KEY, String.valueOf(delivery.routingKey()));
        try {
            if (log.isDebugEnabled()) {
                log.debug("Handling {}", delivery);
            }
            Timer.Sample sample = metrics.startHandling();
            Throwable failure = null;
            try {
                handler.handle(delivery);
            } catch (VirtualMachineError ex) {
                throw ex;
            } catch (Throwable ex) {
                failure = ex;
            }
            metrics.stopHandling(sample, queueName, failure == null);
            if (failure == null) {
                acknowledge(delivery);
            } else {
                recover(handler, delivery, failure);
            }
        } finally {
            MDC.remove(MDC_CONSUMER_TAG);
            MDC.remove(MDC_DELIVERY_TAG);
            MDC.remove(MDC_ROUTING_KEY);
        }
    }

    private void acknowledge(Delivery delivery) {
        if (delivery.isSettled()) {
            metrics.settled(queueName, delivery.settlement());
            if (log.isDebugEnabled()) {
                log.debug("Handler settled delivery {} itself ({})", delivery.deliveryTag(), delivery.settlement());
            }
            return;
        }
        try {
            ack(delivery);
        } catch (BowlerException ex) {
            log.debug("Acknowledgment of delivery {} failed and was reported", delivery.deliveryTag());
        }
    }

    private void recover(MessageHandler handler, Delivery delivery, Throwable failure) {
        reportAndRender(failure, delivery);
        try {
            handler.handleError(failure, delivery);
        } catch (VirtualMachineError ex) {
            throw ex;
        } catch (Throwable ex) {
            reportAndRender(ex, delivery);
        }
        if (delivery.isSettled()) {
            metrics.settled(queueName, delivery.settlement());
            return;
        }
        try {
            switch (failurePolicy) {
                case REJECT -> reject(delivery, false);
                case REQUEUE -> nack(delivery, false, true);
                case LEAVE_UNACKNOWLEDGED -> {
                    if (log.isDebugEnabled()) {
                        log.debug("Leaving failed delivery {} unacknowledged", delivery.deliveryTag());
                    }
                }
            }
        } catch (BowlerException ex) {
            log.debug("Settlement of failed delivery {} failed and was reported", delivery.deliveryTag());
        }
    }

    private void reportAndRender(Throwable error, Delivery delivery) {
        BowlerExceptionHandler exceptionHandler = translator.exceptionHandler();
        try {
            exceptionHandler.reportError(error, delivery);
        } catch (RuntimeException ex) {
            log.error("Exception handler failed to report handler failure for delivery {}",
                delivery.deliveryTag(), ex);
        }
        try {
            exceptionHandler.renderError(error, delivery);
        } catch (RuntimeException ex) {
            log.error("Exception handler failed to render handler failure for delivery {}",
                delivery.deliveryTag(), ex);
        }
    }

    private void settle(Delivery delivery,
                        Settlement settlement,
                        String operation,
                        boolean multiple,
                        boolean requeue,
                        SettleAction action) {
        try {
            action.run();
        } catch (IOException | RuntimeException ex) {
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("operation", operation);
            parameters.put("deliveryTag", delivery.deliveryTag());
            parameters.put("multiple", multiple);
            parameters.put("requeue", requeue);
            parameters.put("queueName", queueName);
            throw translator.translate(ex, parameters, Map.of(), delivery);
        }
        metrics.settled(queueName, settlement);
        if (log.isDebugEnabled()) {
            log.debug("{} delivery {} (multiple={}, requeue={})", operation, delivery.deliveryTag(), multiple, requeue);
        }
    }

    @FunctionalInterface
    private interface SettleAction {
        void run() throws IOException;
    }

    /**
     * Hands deliveries from the client's dispatch thread to the consuming thread and tracks whether the
     * registration is still alive.
     */
    private final class BufferingConsumer extends DefaultConsumer {

        private final AtomicBoolean active = new AtomicBoolean(true);

        BufferingConsumer(Channel channel) {
            super(channel);
        }

        @Override
        public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            deliveries.offer(new Delivery(getChannel(), tag, envelope, properties, body));
        }

        @Override
        public void handleCancelOk(String tag) {
            deactivate();
            log.info("Consumer {} cancelled", tag);
        }

        @Override
        public void handleCancel(String tag) {
            deactivate();
            log.warn("Consumer {} cancelled by the broker (queue={})", tag, queueName);
        }

        @Override
        public void handleShutdownSignal(String tag, ShutdownSignalException signal) {
            deactivate();
            int dropped = deliveries.size();
            deliveries.clear();
            if (signal.isInitiatedByApplication()) {
                log.info("Channel closed for consumer {} ({} buffered deliveries dropped)", tag, dropped);
            } else {
                log.warn("Channel shut down for consumer {} ({} buffered deliveries dropped): {}",
                    tag, dropped, signal.getMessage());
            }
        }

        private void deactivate() {
            if (active.compareAndSet(true, false)) {
                activeConsumers.decrementAndGet();
            }
        }
    }

    /**
     * Builder for {@link QueueConsumer}.
     * <p>
     * An exchange definition and a channel (directly or through a {@link BrokerConnection}) are required.
     * Without an explicit queue a broker-named queue is declared. Without an {@link ExceptionTranslator} or
     * exception handler, failures are reported through {@link LoggingExceptionHandler}.
     */
    public static final class Builder {

        private Channel channel;
        private BrokerConnection connection;
        private ExchangeDefinition exchange;
        private QueueDefinition queue = QueueDefinition.named("");
        private final List<Binding> bindings = new ArrayList<>();
        private Map<String, Object> deadLetterArguments = Map.of();
        private ExceptionTranslator translator;
        private BowlerExceptionHandler exceptionHandler;
        private String consumerTag = "";
        private Duration pollInterval = Duration.ofSeconds(1);
        private FailurePolicy failurePolicy = FailurePolicy.LEAVE_UNACKNOWLEDGED;
        private ConsumerMetrics metrics = ConsumerMetrics.noop();

        private Builder() {
        }

        /**
         * Channel owned by the consumer. Takes precedence over {@link #connection(BrokerConnection)}.
         */
        public Builder channel(Channel channel) {
            this.channel = Objects.requireNonNull(channel, "channel");
            return this;
        }

        /**
         * Connection from which the consumer opens its own channel.
         */
        public Builder connection(BrokerConnection connection) {
            this.connection = Objects.requireNonNull(connection, "connection");
            return this;
        }

        public Builder exchange(ExchangeDefinition exchange) {
            this.exchange = Objects.requireNonNull(exchange, "exchange");
            return this;
        }

        public Builder queue(QueueDefinition queue) {
            this.queue = Objects.requireNonNull(queue, "queue");
            return this;
        }

        public Builder binding(Binding binding) {
            this.bindings.add(Objects.requireNonNull(binding, "binding"));
            return this;
        }

        public Builder bindings(List<Binding> bindings) {
            Objects.requireNonNull(bindings, "bindings").forEach(this::binding);
            return this;
        }

        /**
         * Adds one binding per routing key between the declared queue and exchange.
         */
        public Builder routingKeys(String... routingKeys) {
            for (String routingKey : routingKeys) {
                binding(Binding.routingKey(routingKey));
            }
            return this;
        }

        /**
         * Dead-letters rejected and expired messages to {@code exchange}, optionally overriding their routing
         * key. Merged into the queue arguments at build time.
         */
        public Builder deadLetter(String exchange, String routingKey) {
            this.deadLetterArguments = DeadLetter.withDeadLetter(exchange, routingKey);
            return this;
        }

        public Builder translator(ExceptionTranslator translator) {
            this.translator = Objects.requireNonNull(translator, "translator");
            return this;
        }

        public Builder exceptionHandler(BowlerExceptionHandler exceptionHandler) {
            this.exceptionHandler = Objects.requireNonNull(exceptionHandler, "exceptionHandler");
            return this;
        }

        /**
         * Consumer tag requested from the broker; empty lets the broker generate one.
         */
        public Builder consumerTag(String consumerTag) {
            this.consumerTag = Objects.requireNonNull(consumerTag, "consumerTag");
            return this;
        }

        /**
         * How long the loop waits for a delivery before checking its stop conditions again.
         */
        public Builder pollInterval(Duration pollInterval) {
            Objects.requireNonNull(pollInterval, "pollInterval");
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
            return this;
        }

        public Builder metrics(ConsumerMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        /**
         * Builds a consumer. Without an explicit {@link #channel(Channel)} every call opens a new channel on
         * the configured connection, so one builder can produce several independent consumers.
         */
        public QueueConsumer build() {
            Objects.requireNonNull(exchange, "exchange");
            if (channel == null && connection == null) {
                throw new IllegalStateException("QueueConsumer requires a channel or a broker connection");
            }
            ExceptionTranslator resolvedTranslator = translator != null
                ? translator
                : new ExceptionTranslator(exceptionHandler != null ? exceptionHandler : new LoggingExceptionHandler());
            QueueDefinition resolvedQueue = queue.withArguments(deadLetterArguments);
            Channel resolvedChannel = channel != null ? channel : connection.createChannel();
            return new QueueConsumer(this, resolvedChannel, resolvedQueue, resolvedTranslator);
        }
    }
}
