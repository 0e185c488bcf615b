package io.bowler.core.topology;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import io.bowler.core.error.BowlerException;
import io.bowler.core.error.BowlerExceptionHandler;
import io.bowler.core.error.DeclarationMismatchException;
import io.bowler.core.error.ExceptionTranslator;
import io.bowler.core.error.InvalidSetupException;
import io.bowler.core.support.BrokerFailures;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TopologyDeclaratorTest {

    @Mock
    private Channel channel;

    @Mock
    private BowlerExceptionHandler exceptionHandler;

    @Mock
    private AMQP.Queue.DeclareOk declareOk;

    private TopologyDeclarator declarator;

    @BeforeEach
    void setUp() {
        declarator = new TopologyDeclarator(channel, new ExceptionTranslator(exceptionHandler));
    }

    @Test
    void declaresExchangeQueueAndBindingsInOrder() throws Exception {
        when(declareOk.getQueue()).thenReturn("orders.created");
        when(channel.queueDeclare("orders.created", true, false, false, null)).thenReturn(declareOk);

        DeclaredTopology topology = declarator.declare(
            ExchangeDefinition.durable("orders", ExchangeType.TOPIC),
            QueueDefinition.durable("orders.created"),
            List.of(Binding.routingKey("order.created.*"), Binding.routingKey("order.updated.*")));

        InOrder order = inOrder(channel);
        order.verify(channel).exchangeDeclare("orders", "topic", true, false, null);
        order.verify(channel).queueDeclare("orders.created", true, false, false, null);
        order.verify(channel).queueBind("orders.created", "orders", "order.created.*");
        order.verify(channel).queueBind("orders.created", "orders", "order.updated.*");
        assertThat(topology.queueName()).isEqualTo("orders.created");
        assertThat(topology.bindings())
            .extracting(Binding::routingKey)
            .containsExactly("order.created.*", "order.updated.*");
    }

    @Test
    void createsSingleDefaultBindingWhenNoneGiven() throws Exception {
        DeclaredTopology topology = declarator.declare(
            ExchangeDefinition.of("notifications", ExchangeType.FANOUT),
            QueueDefinition.named("notifications.mail"),
            List.of());

        verify(channel).exchangeDeclare("notifications", "fanout", false, false, null);
        verify(channel).queueBind("notifications.mail", "notifications", "");
        assertThat(topology.bindings()).containsExactly(new Binding("notifications.mail", "notifications", ""));
    }

    @Test
    void bindsBrokerGeneratedQueueName() throws Exception {
        when(declareOk.getQueue()).thenReturn("amq.gen-JzTY20BRgKO");
        when(channel.queueDeclare("", false, true, true, null)).thenReturn(declareOk);

        DeclaredTopology topology = declarator.declare(
            ExchangeDefinition.of("notifications", ExchangeType.FANOUT), QueueDefinition.serverNamed(), null);

        verify(channel).queueBind("amq.gen-JzTY20BRgKO", "notifications", "");
        assertThat(topology.queueName()).isEqualTo("amq.gen-JzTY20BRgKO");
    }

    @Test
    void passesQueueArgumentsThrough() throws Exception {
        QueueDefinition queue = QueueDefinition.durable("orders.created")
            .withArguments(DeadLetter.withDeadLetter("orders.dlx", "orders.dead"));

        declarator.declare(ExchangeDefinition.durable("orders", ExchangeType.TOPIC), queue,
            List.of(Binding.routingKey("order.created.*")));

        verify(channel).queueDeclare("orders.created", true, false, false,
            Map.of("x-dead-letter-exchange", "orders.dlx", "x-dead-letter-routing-key", "orders.dead"));
    }

    @Test
    void passiveDeclarationsOnlyCheckExistence() throws Exception {
        declarator.declare(
            new ExchangeDefinition("orders", ExchangeType.TOPIC, true, true, false),
            new QueueDefinition("orders.created", true, true, false, false, Map.of()),
            List.of(Binding.routingKey("order.created.*")));

        verify(channel).exchangeDeclarePassive("orders");
        verify(channel).queueDeclarePassive("orders.created");
        verify(channel, never()).exchangeDeclare(anyString(), anyString(), eq(true), eq(false), isNull());
        verify(channel, never()).queueDeclare(anyString(), eq(true), eq(false), eq(false), any());
    }

    @Test
    void defaultExchangeIsNeitherDeclaredNorBound() throws Exception {
        declarator.declare(ExchangeDefinition.of("", ExchangeType.DIRECT), QueueDefinition.named("jobs"), List.of());

        verify(channel).queueDeclare("jobs", false, false, false, null);
        verify(channel, never()).exchangeDeclare(anyString(), anyString(), eq(false), eq(false), isNull());
        verify(channel, never()).queueBind(anyString(), anyString(), anyString());
    }

    @Test
    void redeclaringIdenticalTopologySucceeds() throws Exception {
        ExchangeDefinition exchange = ExchangeDefinition.durable("orders", ExchangeType.TOPIC);
        QueueDefinition queue = QueueDefinition.durable("orders.created");
        List<Binding> bindings = List.of(Binding.routingKey("order.created.*"));

        declarator.declare(exchange, queue, bindings);
        assertThatCode(() -> declarator.declare(exchange, queue, bindings)).doesNotThrowAnyException();

        verify(channel, times(2)).exchangeDeclare("orders", "topic", true, false, null);
        verify(channel, times(2)).queueBind("orders.created", "orders", "order.created.*");
    }

    @Test
    void conflictingExchangeRaisesDeclarationMismatchWithDeclarationContext() throws Exception {
        IOException conflict = BrokerFailures.preconditionFailed(
            "inequivalent arg 'type' for exchange 'orders' in vhost '/': received 'topic' but current is 'direct'");
        when(channel.exchangeDeclare("orders", "topic", true, false, null)).thenThrow(conflict);
        QueueDefinition queue = QueueDefinition.durable("orders.created")
            .withArguments(DeadLetter.withDeadLetter("orders.dlx"));

        DeclarationMismatchException thrown = catchThrowableOfType(
            () -> declarator.declare(ExchangeDefinition.durable("orders", ExchangeType.TOPIC), queue,
                List.of(Binding.routingKey("order.created.*"))),
            DeclarationMismatchException.class);

        assertThat(thrown).isNotNull();
        assertThat(thrown.code()).isEqualTo(406);
        assertThat(thrown.parameters())
            .containsEntry("exchangeName", "orders")
            .containsEntry("exchangeType", "topic")
            .containsEntry("durable", true)
            .containsEntry("queueName", "orders.created")
            .containsEntry("routingKeys", List.of("order.created.*"));
        assertThat(thrown.arguments()).isEqualTo(Map.of("x-dead-letter-exchange", "orders.dlx"));
        verify(exceptionHandler).reportError(thrown, null);
        verify(exceptionHandler).renderError(thrown, null);
        verify(channel, never()).queueDeclare(anyString(), eq(true), eq(false), eq(false), any());
    }

    @Test
    void mismatchWithoutQueueArgumentsCarriesEmptyArguments() throws Exception {
        IOException conflict = BrokerFailures.preconditionFailed("inequivalent arg 'durable' for queue 'jobs'");
        when(channel.queueDeclare("jobs", false, false, false, null)).thenThrow(conflict);

        BowlerException thrown = catchThrowableOfType(
            () -> declarator.declare(ExchangeDefinition.of("work", ExchangeType.DIRECT), QueueDefinition.named("jobs"),
                List.of()),
            BowlerException.class);

        assertThat(thrown).isInstanceOf(DeclarationMismatchException.class);
        assertThat(thrown.arguments()).isNotNull().isEmpty();
        assertThat(thrown.parameters()).containsEntry("routingKeys", List.of(""));
    }

    @Test
    void connectionFailureDuringDeclareRaisesInvalidSetup() throws Exception {
        RuntimeException refused = BrokerFailures.connectionClosed(403, "ACCESS_REFUSED - access to exchange 'orders' refused");
        when(channel.exchangeDeclare("orders", "topic", true, false, null)).thenThrow(refused);

        BowlerException thrown = catchThrowableOfType(
            () -> declarator.declare(ExchangeDefinition.durable("orders", ExchangeType.TOPIC),
                QueueDefinition.durable("orders.created"), List.of()),
            BowlerException.class);

        assertThat(thrown).isInstanceOf(InvalidSetupException.class);
        assertThat(thrown.code()).isEqualTo(403);
    }
}
