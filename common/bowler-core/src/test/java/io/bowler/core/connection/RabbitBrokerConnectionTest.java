package io.bowler.core.connection;

import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.bowler.core.error.BowlerException;
import io.bowler.core.error.BowlerExceptionHandler;
import io.bowler.core.error.BowlerGeneralException;
import io.bowler.core.error.ExceptionTranslator;
import io.bowler.core.error.InvalidSetupException;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RabbitBrokerConnectionTest {

    @Mock
    private ConnectionFactory factory;

    @Mock
    private Connection connection;

    @Mock
    private Channel channel;

    @Mock
    private BowlerExceptionHandler exceptionHandler;

    private ExceptionTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new ExceptionTranslator(exceptionHandler);
    }

    @Test
    void refusedLoginBecomesInvalidSetupWithoutPassword() throws Exception {
        AuthenticationFailureException refused = new AuthenticationFailureException("ACCESS_REFUSED - Login was refused");
        when(factory.newConnection()).thenThrow(refused);
        RabbitBrokerConnection.Settings settings = new RabbitBrokerConnection.Settings("rabbit", 5672, "orders",
            "billing", "s3cret");

        InvalidSetupException thrown = catchThrowableOfType(
            () -> RabbitBrokerConnection.open(factory, settings.describe(), translator), InvalidSetupException.class);

        assertThat(thrown.parameters())
            .containsEntry("host", "rabbit")
            .containsEntry("virtualHost", "orders")
            .containsEntry("username", "billing")
            .doesNotContainKey("password");
        assertThat(thrown.parameters().values()).doesNotContain("s3cret");
        verify(exceptionHandler).reportError(thrown, null);
    }

    @Test
    void primaryChannelIsReusedWhileOpen() throws Exception {
        when(factory.newConnection()).thenReturn(connection);
        when(connection.createChannel()).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);
        RabbitBrokerConnection broker = RabbitBrokerConnection.open(factory, Map.of(), translator);

        Channel first = broker.getChannel();
        Channel second = broker.getChannel();

        assertThat(first).isSameAs(second).isSameAs(channel);
        verify(connection, times(1)).createChannel();
    }

    @Test
    void exhaustedConnectionRaisesGeneralFailure() throws Exception {
        when(factory.newConnection()).thenReturn(connection);
        when(connection.createChannel()).thenReturn(null);
        RabbitBrokerConnection broker = RabbitBrokerConnection.open(factory, Map.of("host", "rabbit"), translator);

        BowlerException thrown = catchThrowableOfType(broker::createChannel, BowlerException.class);

        assertThat(thrown).isInstanceOf(BowlerGeneralException.class);
        assertThat(thrown.parameters()).containsEntry("host", "rabbit");
    }

    @Test
    void closeClosesChannelsThenConnectionAndToleratesFailures() throws Exception {
        when(factory.newConnection()).thenReturn(connection);
        when(connection.createChannel()).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);
        when(connection.isOpen()).thenReturn(true);
        doThrow(new IOException("already closing")).when(channel).close();
        RabbitBrokerConnection broker = RabbitBrokerConnection.open(factory, Map.of(), translator);
        broker.createChannel();

        broker.close();

        verify(channel).close();
        verify(connection).close();
    }

    @Test
    void closedChannelsAreForgottenWhenAnotherIsCreated() throws Exception {
        Channel replacement = mock(Channel.class);
        when(factory.newConnection()).thenReturn(connection);
        when(connection.createChannel()).thenReturn(channel, replacement);
        when(channel.isOpen()).thenReturn(false);
        when(replacement.isOpen()).thenReturn(true);
        RabbitBrokerConnection broker = RabbitBrokerConnection.open(factory, Map.of(), translator);
        broker.createChannel();
        broker.createChannel();

        broker.close();

        verify(channel, times(1)).isOpen();
        verify(channel, never()).close();
        verify(replacement).close();
    }

    @Test
    void nullParameterIsRejectedBeforeConnecting() throws Exception {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("host", "rabbit");
        parameters.put("username", null);

        assertThatThrownBy(() -> RabbitBrokerConnection.open(factory, parameters, translator))
            .isInstanceOf(NullPointerException.class);

        verify(factory, never()).newConnection();
    }

    @Test
    void settingsValidateAndHidePassword() {
        RabbitBrokerConnection.Settings settings = new RabbitBrokerConnection.Settings("rabbit", 5672, " ",
            "billing", "s3cret");

        assertThat(settings.virtualHost()).isEqualTo("/");
        assertThat(settings.toString()).doesNotContain("s3cret");
        assertThat(RabbitBrokerConnection.Settings.localhost().port()).isEqualTo(5672);
        assertThatThrownBy(() -> new RabbitBrokerConnection.Settings("", 5672, "/", "guest", "guest"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RabbitBrokerConnection.Settings("rabbit", 0, "/", "guest", "guest"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
