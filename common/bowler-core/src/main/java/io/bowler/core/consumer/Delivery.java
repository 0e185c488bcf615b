package io.bowler.core.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Inbound message handed to a {@link MessageHandler}.
 * <p>
 * A delivery remembers the channel that delivered it; {@link #ack()}, {@link #nack(boolean, boolean)} and
 * {@link #reject(boolean)} settle it on that channel using its delivery tag. Settling twice is not prevented
 * here: the broker closes the channel on an unknown or already settled tag. {@link #settlement()} reports
 * the last settlement issued so callers can tell whether the delivery is still pending.
 */
public final class Delivery {

    private final Channel channel;
    private final String consumerTag;
    private final long deliveryTag;
    private final String exchange;
    private final String routingKey;
    private final boolean redelivered;
    private final AMQP.BasicProperties properties;
    private final byte[] body;
    private volatile Settlement settlement = Settlement.PENDING;

    public Delivery(Channel channel,
                    String consumerTag,
                    Envelope envelope,
                    AMQP.BasicProperties properties,
                    byte[] body) {
        this.channel = Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(envelope, "envelope");
        this.consumerTag = consumerTag;
        this.deliveryTag = envelope.getDeliveryTag();
        this.exchange = envelope.getExchange();
        this.routingKey = envelope.getRoutingKey();
        this.redelivered = envelope.isRedeliver();
        this.properties = properties;
        this.body = body == null ? new byte[0] : body.clone();
    }

    public Channel channel() {
        return channel;
    }

    public String consumerTag() {
        return consumerTag;
    }

    public long deliveryTag() {
        return deliveryTag;
    }

    public String exchange() {
        return exchange;
    }

    public String routingKey() {
        return routingKey;
    }

    public boolean redelivered() {
        return redelivered;
    }

    /**
     * Message properties, {@code null} when the publisher sent none.
     */
    public AMQP.BasicProperties properties() {
        return properties;
    }

    public Map<String, Object> headers() {
        if (properties == null || properties.getHeaders() == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(properties.getHeaders());
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public Settlement settlement() {
        return settlement;
    }

    public boolean isSettled() {
        return settlement != Settlement.PENDING;
    }

    /**
     * Acknowledges this delivery only.
     */
    public void ack() throws IOException {
        channel.basicAck(deliveryTag, false);
        settlement = Settlement.ACKED;
    }

    /**
     * Negatively acknowledges this delivery.
     *
     * @param multiple also nack every unsettled delivery with a lower tag on the channel
     * @param requeue  put the message(s) back on the queue instead of discarding or dead-lettering them
     */
    public void nack(boolean multiple, boolean requeue) throws IOException {
        channel.basicNack(deliveryTag, multiple, requeue);
        settlement = Settlement.NACKED;
    }

    /**
     * Rejects this delivery. Without requeue the broker dead-letters the message when the queue has a
     * dead-letter exchange, and drops it otherwise.
     */
    public void reject(boolean requeue) throws IOException {
        channel.basicReject(deliveryTag, requeue);
        settlement = Settlement.REJECTED;
    }

    @Override
    public String toString() {
        return "Delivery[tag=" + deliveryTag + ", exchange=" + exchange + ", routingKey=" + routingKey
            + ", redelivered=" + redelivered + ", settlement=" + settlement + "]";
    }
}
