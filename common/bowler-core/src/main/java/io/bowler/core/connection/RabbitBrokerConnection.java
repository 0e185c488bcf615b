package io.bowler.core.connection;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
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

/**
 * {@link BrokerConnection} backed by the RabbitMQ client's {@link ConnectionFactory}.
 * <p>
 * The connection is opened eagerly by {@link #open}. Failures while opening the connection or a channel are
 * classified by the {@link ExceptionTranslator}, so a refused login surfaces as an
 * {@link io.bowler.core.error.InvalidSetupException} carrying the host, port, virtual host and username (the
 * password is never included).
 */
public final class RabbitBrokerConnection implements BrokerConnection {

    private static final Logger log = LoggerFactory.getLogger(RabbitBrokerConnection.class);

    private final Connection connection;
    private final ExceptionTranslator translator;
    private final Map<String, Object> parameters;
    private final List<Channel> channels = new ArrayList<>();
    private Channel primary;

    RabbitBrokerConnection(Connection connection, ExceptionTranslator translator, Map<String, Object> parameters) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.parameters = Map.copyOf(parameters);
    }

    /**
     * Opens a connection using {@code settings}.
     *
     * @throws io.bowler.core.error.BowlerException when the broker cannot be reached or refuses the login
     */
    public static RabbitBrokerConnection open(Settings settings, ExceptionTranslator translator) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(translator, "translator");
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(settings.host());
        factory.setPort(settings.port());
        factory.setVirtualHost(settings.virtualHost());
        factory.setUsername(settings.username());
        factory.setPassword(settings.password());
        return open(factory, settings.describe(), translator);
    }

    /**
     * Opens a connection from a pre-configured factory. {@code parameters} must not hold null keys or values;
     * they are copied before connecting.
     */
    public static RabbitBrokerConnection open(ConnectionFactory factory,
                                              Map<String, Object> parameters,
                                              ExceptionTranslator translator) {
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(translator, "translator");
        Map<String, Object> safeParameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        try {
            Connection connection = factory.newConnection();
            log.info("Connected to broker {}:{}{}", factory.getHost(), factory.getPort(), factory.getVirtualHost());
            return new RabbitBrokerConnection(connection, translator, safeParameters);
        } catch (IOException | TimeoutException | RuntimeException ex) {
            throw translator.translate(ex, safeParameters, Map.of());
        }
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
        try {
            channels.removeIf(existing -> !existing.isOpen());
            Channel channel = connection.createChannel();
            if (channel == null) {
                throw new IOException("No channel available on connection " + connection);
            }
            channels.add(channel);
            return channel;
        } catch (IOException | RuntimeException ex) {
            throw translator.translate(ex, parameters, Map.of());
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
                log.debug("Ignoring failure while closing channel {}", channel.getChannelNumber(), ex);
            }
        }
        channels.clear();
        primary = null;
        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (IOException | RuntimeException ex) {
            log.warn("Failed to close broker connection", ex);
        }
    }

    /**
     * Connection coordinates.
     *
     * @param host        broker host
     * @param port        AMQP port
     * @param virtualHost virtual host, {@code /} by default
     * @param username    login user
     * @param password    login password
     */
    public record Settings(String host, int port, String virtualHost, String username, String password) {

        public Settings {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host must not be null or blank");
            }
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535");
            }
            virtualHost = virtualHost == null || virtualHost.isBlank() ? "/" : virtualHost;
            Objects.requireNonNull(username, "username");
            Objects.requireNonNull(password, "password");
        }

        public static Settings localhost() {
            return new Settings("localhost", 5672, "/", "guest", "guest");
        }

        Map<String, Object> describe() {
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("host", host);
            parameters.put("port", port);
            parameters.put("virtualHost", virtualHost);
            parameters.put("username", username);
            return parameters;
        }

        @Override
        public String toString() {
            return "Settings[host=" + host + ", port=" + port + ", virtualHost=" + virtualHost
                + ", username=" + username + "]";
        }
    }
}
