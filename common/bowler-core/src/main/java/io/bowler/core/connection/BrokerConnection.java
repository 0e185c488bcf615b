package io.bowler.core.connection;

import com.rabbitmq.client.Channel;

/**
 * Live connection to the broker together with the channel Bowler components share by default.
 * <p>
 * A channel must not be shared between consumers: each {@link io.bowler.core.consumer.QueueConsumer} needs
 * its own, obtained through {@link #createChannel()}.
 */
public interface BrokerConnection extends AutoCloseable {

    /**
     * Returns the connection's primary channel, opening it on first use.
     *
     * @throws io.bowler.core.error.BowlerException when the channel cannot be opened
     */
    Channel getChannel();

    /**
     * Opens an additional channel on the same connection.
     *
     * @throws io.bowler.core.error.BowlerException when the channel cannot be opened
     */
    Channel createChannel();

    /**
     * Closes every channel opened through this connection and then the connection itself.
     */
    @Override
    void close();
}
