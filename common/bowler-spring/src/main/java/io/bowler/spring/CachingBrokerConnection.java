package io.bowler.spring;

import com.rabbitmq.client.Channel;
import io.bowler.core.connection.BrokerConnection;
import io.bowler.core.error.ExceptionTranslator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

/**
 * {@link BrokerConnection} that borrows channels from a Spring AMQP {@link ConnectionFactory}.
 * <p>
 * The factory, and the physical connection behind it, belong to the Spring context; {@link #close()} only
 * returns the channels handed out here.
 */
public final class CachingBrokerConnection implements BrokerConnection {

    private static final Logger log = LoggerFactory.getLogger(CachingBrokerConnection.class);

    private final ConnectionFactory connectionFactory;
    private final ExceptionTranslator translator;
    private final List<Channel> channels = new ArrayList<>();
    private Channel primary;

    public CachingBrokerConnection(ConnectionFactory connectionFactory, ExceptionTranslator translator) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.translator = Objects.requireNonNull(translator, "translator");
    }

    @Override
    public synchronized Channel getChannel() {
        if (primary == null || !primary.isOpen()) {
            primary = createChannel();
        }
        return primary;
    }

    @Override
    public synchronized Channel createChannel() {
        channels.removeIf(existing -> !existing.isOpen());
        try {
            Channel channel = connectionFactory.createConnection().createChannel(false);
            channels.add(channel);
            return channel;
        } catch (RuntimeException ex) {
            throw translator.translate(ex, describe(), Map.of());
        }
    }

    @Override
    public synchronized void close() {
        for (Channel channel : channels) {
            try {
                if (channel.isOpen()) {
                    channel.close();
                }
            } catch (IOException | TimeoutException | RuntimeException ex) {
                log.debug("Ignoring failure while releasing channel", ex);
            }
        }
        channels.clear();
        primary = null;
    }

    private Map<String, Object> describe() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("host", connectionFactory.getHost());
        parameters.put("port", connectionFactory.getPort());
        parameters.put("virtualHost", connectionFactory.getVirtualHost());
        parameters.put("username", connectionFactory.getUsername());
        return parameters;
    }
}
