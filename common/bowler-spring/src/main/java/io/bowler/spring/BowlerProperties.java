package io.bowler.spring;

import io.bowler.core.consumer.FailurePolicy;
import io.bowler.core.producer.DeliveryMode;
import io.bowler.core.topology.ExchangeDefinition;
import io.bowler.core.topology.ExchangeType;
import io.bowler.core.topology.QueueDefinition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties bound from {@code bowler.*}.
 */
@Validated
@ConfigurationProperties(prefix = "bowler")
public class BowlerProperties {

    private boolean enabled = true;
    @Valid
    private final ExchangeProperties exchange = new ExchangeProperties();
    @Valid
    private final QueueProperties queue = new QueueProperties();
    private final DeadLetterProperties deadLetter = new DeadLetterProperties();
    @Valid
    private final ConsumerProperties consumer = new ConsumerProperties();
    @Valid
    private final ProducerProperties producer = new ProducerProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public ExchangeProperties getExchange() {
        return exchange;
    }

    public QueueProperties getQueue() {
        return queue;
    }

    public DeadLetterProperties getDeadLetter() {
        return deadLetter;
    }

    public ConsumerProperties getConsumer() {
        return consumer;
    }

    public ProducerProperties getProducer() {
        return producer;
    }

    public static final class ExchangeProperties {
        @NotBlank
        private String name;
        @NotNull
        private ExchangeType type = ExchangeType.DIRECT;
        private boolean passive = false;
        private boolean durable = true;
        private boolean autoDelete = false;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name == null ? null : name.trim();
        }

        public ExchangeType getType() {
            return type;
        }

        public void setType(ExchangeType type) {
            this.type = type;
        }

        public boolean isPassive() {
            return passive;
        }

        public void setPassive(boolean passive) {
            this.passive = passive;
        }

        public boolean isDurable() {
            return durable;
        }

        public void setDurable(boolean durable) {
            this.durable = durable;
        }

        public boolean isAutoDelete() {
            return autoDelete;
        }

        public void setAutoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
        }

        ExchangeDefinition toDefinition() {
            return new ExchangeDefinition(name, type, passive, durable, autoDelete);
        }
    }

    public static final class QueueProperties {
        /**
         * Queue name; empty asks the broker for a generated name.
         */
        @NotNull
        private String name = "";
        private boolean passive = false;
        private boolean durable = true;
        private boolean exclusive = false;
        private boolean autoDelete = false;
        private List<String> bindings = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name == null ? "" : name.trim();
        }

        public boolean isPassive() {
            return passive;
        }

        public void setPassive(boolean passive) {
            this.passive = passive;
        }

        public boolean isDurable() {
            return durable;
        }

        public void setDurable(boolean durable) {
            this.durable = durable;
        }

        public boolean isExclusive() {
            return exclusive;
        }

        public void setExclusive(boolean exclusive) {
            this.exclusive = exclusive;
        }

        public boolean isAutoDelete() {
            return autoDelete;
        }

        public void setAutoDelete(boolean autoDelete) {
            this.autoDelete = autoDelete;
        }

        public List<String> getBindings() {
            return bindings;
        }

        public void setBindings(List<String> bindings) {
            this.bindings = bindings == null ? new ArrayList<>() : new ArrayList<>(bindings);
        }

        QueueDefinition toDefinition() {
            return new QueueDefinition(name, passive, durable, exclusive, autoDelete, null);
        }
    }

    public static final class DeadLetterProperties {
        private String exchange;
        private String routingKey;
        private String queue;
        private boolean declare = false;

        public String getExchange() {
            return exchange;
        }

        public void setExchange(String exchange) {
            this.exchange = normalise(exchange);
        }

        public String getRoutingKey() {
            return routingKey;
        }

        public void setRoutingKey(String routingKey) {
            this.routingKey = normalise(routingKey);
        }

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = normalise(queue);
        }

        public boolean isDeclare() {
            return declare;
        }

        public void setDeclare(boolean declare) {
            this.declare = declare;
        }

        public boolean isConfigured() {
            return exchange != null;
        }

        /**
         * Queue receiving dead-lettered messages when {@link #isDeclare()} is set; defaults to the exchange
         * name.
         */
        String resolvedQueue() {
            return queue != null ? queue : exchange;
        }
    }

    public static final class ConsumerProperties {
        private String tag = "";
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(1);
        @NotNull
        private FailurePolicy failurePolicy = FailurePolicy.LEAVE_UNACKNOWLEDGED;
        private boolean autoStartup = true;
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(10);

        public String getTag() {
            return tag;
        }

        public void setTag(String tag) {
            this.tag = tag == null ? "" : tag.trim();
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public FailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
        }

        public boolean isAutoStartup() {
            return autoStartup;
        }

        public void setAutoStartup(boolean autoStartup) {
            this.autoStartup = autoStartup;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static final class ProducerProperties {
        private boolean enabled = true;
        @NotNull
        private DeliveryMode deliveryMode = DeliveryMode.PERSISTENT;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public DeliveryMode getDeliveryMode() {
            return deliveryMode;
        }

        public void setDeliveryMode(DeliveryMode deliveryMode) {
            this.deliveryMode = deliveryMode;
        }
    }

    private static String normalise(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
