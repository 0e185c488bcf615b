package io.bowler.core.producer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.bowler.core.error.BowlerException;
import io.bowler.core.error.ExceptionTranslator;
import io.bowler.core.topology.ExchangeDefinition;
import io.bowler.core.topology.TopologyDeclarator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes messages to a single exchange.
 * <p>
 * The exchange is declared before the first publish; declaration conflicts surface as
 * {@link io.bowler.core.error.DeclarationMismatchException} like they do for consumers. Messages carry the
 * configured {@link DeliveryMode} and a content type matching the publish variant used.
 */
public final class Producer {

    static final String TEXT_CONTENT_TYPE = "text/plain";
    static final String JSON_CONTENT_TYPE = "application/json";

    private static final Logger log = LoggerFactory.getLogger(Producer.class);

    private final Channel channel;
    private final ExchangeDefinition exchange;
    private final DeliveryMode deliveryMode;
    private final ExceptionTranslator translator;
    private final ObjectMapper mapper;
    private volatile boolean declared;

    public Producer(Channel channel,
                    ExchangeDefinition exchange,
                    DeliveryMode deliveryMode,
                    ExceptionTranslator translator,
                    ObjectMapper mapper) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.deliveryMode = Objects.requireNonNull(deliveryMode, "deliveryMode");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Producer(Channel channel, ExchangeDefinition exchange, ExceptionTranslator translator) {
        this(channel, exchange, DeliveryMode.PERSISTENT, translator, new ObjectMapper());
    }

    /**
     * Publishes a UTF-8 text message.
     *
     * @throws BowlerException when the exchange cannot be declared or the publish fails
     */
    public void send(String data, String routingKey) {
        Objects.requireNonNull(data, "data");
        publish(data.getBytes(StandardCharsets.UTF_8), TEXT_CONTENT_TYPE, routingKey);
    }

    /**
     * Publishes {@code payload} serialised as JSON.
     *
     * @throws BowlerException when serialisation, declaration or publishing fails
     */
    public void sendJson(Object payload, String routingKey) {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw translator.translate(ex, publishParameters(routingKey), Map.of());
        }
        publish(body, JSON_CONTENT_TYPE, routingKey);
    }

    /**
     * Publishes raw bytes with the given content type.
     *
     * @throws BowlerException when the exchange cannot be declared or the publish fails
     */
    public void publish(byte[] body, String contentType, String routingKey) {
        Objects.requireNonNull(body, "body");
        String key = routingKey == null ? "" : routingKey;
        ensureDeclared();
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
            .contentType(contentType)
            .deliveryMode(deliveryMode.code())
            .build();
        try {
            channel.basicPublish(exchange.name(), key, properties, body);
        } catch (IOException | RuntimeException ex) {
            throw translator.translate(ex, publishParameters(key), Map.of());
        }
        if (log.isDebugEnabled()) {
            log.debug("Published {} bytes to exchange {} (routingKey={}, contentType={})",
                body.length, exchange.name(), key, contentType);
        }
    }

    public ExchangeDefinition exchange() {
        return exchange;
    }

    public DeliveryMode deliveryMode() {
        return deliveryMode;
    }

    private void ensureDeclared() {
        if (declared) {
            return;
        }
        synchronized (this) {
            if (!declared) {
                new TopologyDeclarator(channel, translator).declareExchange(exchange, Map.of());
                declared = true;
            }
        }
    }

    private Map<String, Object> publishParameters(String routingKey) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("exchangeName", exchange.name());
        parameters.put("exchangeType", exchange.type().wireName());
        parameters.put("routingKey", routingKey);
        parameters.put("deliveryMode", deliveryMode.code());
        return parameters;
    }
}
