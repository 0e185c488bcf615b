package io.bowler.core.error;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.bowler.core.consumer.Delivery;
import io.bowler.core.support.BrokerFailures;
import java.io.IOException;
import java.net.SocketException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ExceptionTranslatorTest {

    @Mock
    private BowlerExceptionHandler exceptionHandler;

    @Mock
    private Channel channel;

    @Test
    void channelProtocolFailureBecomesDeclarationMismatch() {
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);
        IOException failure = BrokerFailures.preconditionFailed("inequivalent arg 'type' for exchange 'orders'");
        Map<String, Object> parameters = Map.of("exchangeName", "orders", "exchangeType", "direct");
        Map<String, Object> arguments = Map.of("x-dead-letter-exchange", "orders.dlx");

        BowlerException classified = translator.translate(failure, parameters, arguments);

        assertThat(classified).isInstanceOf(DeclarationMismatchException.class);
        assertThat(classified.kind()).isEqualTo(ErrorKind.DECLARATION_MISMATCH);
        assertThat(classified.code()).isEqualTo(406);
        assertThat(classified.parameters()).isEqualTo(parameters);
        assertThat(classified.arguments()).isEqualTo(arguments);
        assertThat(classified.getCause()).isSameAs(failure);
        assertThat(classified.originalCause()).isInstanceOf(ShutdownSignalException.class);
        assertThat(classified.getStackTrace()).containsExactly(failure.getStackTrace());
        assertThat(classified.sourceFile()).isEqualTo("BrokerFailures.java");
        assertThat(classified.sourceLine()).isPositive();
        assertThat(classified.originalTrace()).contains("java.io.IOException");
    }

    @Test
    void connectionProtocolFailureBecomesInvalidSetup() {
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);
        ShutdownSignalException failure = BrokerFailures.connectionClosed(403, "ACCESS_REFUSED");

        BowlerException classified = translator.translate(failure, Map.of("host", "localhost"), null);

        assertThat(classified).isInstanceOf(InvalidSetupException.class);
        assertThat(classified.kind()).isEqualTo(ErrorKind.INVALID_SETUP);
        assertThat(classified.code()).isEqualTo(403);
        assertThat(classified.parameters()).containsEntry("host", "localhost");
        assertThat(classified.arguments()).isEmpty();
    }

    @Test
    void authenticationFailureBecomesInvalidSetup() {
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);
        AuthenticationFailureException failure = new AuthenticationFailureException("ACCESS_REFUSED - Login was refused");

        BowlerException classified = translator.translate(failure, Map.of(), Map.of());

        assertThat(classified).isInstanceOf(InvalidSetupException.class);
        assertThat(classified.getMessage()).contains("Login was refused");
        assertThat(classified.code()).isZero();
    }

    @Test
    void channelClosedByApplicationBecomesBowlerGeneral() {
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);
        AlreadyClosedException failure = new AlreadyClosedException(
            new ShutdownSignalException(false, true, null, channel));

        BowlerException classified = translator.translate(failure, Map.of("operation", "basic.ack"), null);

        assertThat(classified).isInstanceOf(BowlerGeneralException.class);
        assertThat(classified.code()).isZero();
    }

    @Test
    void lostConnectionWithoutProtocolCloseBecomesBowlerGeneral() {
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);
        ShutdownSignalException signal = new ShutdownSignalException(true, false, null, null, "",
            new SocketException("Connection reset"));
        IOException failure = new IOException(signal);

        BowlerException classified = translator.translate(failure, Map.of("host", "rabbit"), null);

        assertThat(classified).isInstanceOf(BowlerGeneralException.class);
        assertThat(classified.kind()).isEqualTo(ErrorKind.BOWLER_GENERAL);
    }

    @Test
    void anythingElseBecomesBowlerGeneral() {
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);
        IllegalStateException root = new IllegalStateException("socket reset");
        IOException failure = new IOException("publish failed", root);

        BowlerException classified = translator.translate(failure, null, null);

        assertThat(classified).isInstanceOf(BowlerGeneralException.class);
        assertThat(classified.kind()).isEqualTo(ErrorKind.BOWLER_GENERAL);
        assertThat(classified.getMessage()).isEqualTo("publish failed");
        assertThat(classified.originalCause()).isSameAs(root);
        assertThat(classified.parameters()).isNotNull().isEmpty();
        assertThat(classified.arguments()).isNotNull().isEmpty();
    }

    @Test
    void reportsBeforeRenderingWithoutDelivery() {
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);

        BowlerException classified = translator.translate(BrokerFailures.preconditionFailed("durable"), Map.of(), Map.of());

        InOrder order = inOrder(exceptionHandler);
        order.verify(exceptionHandler).reportError(classified, null);
        order.verify(exceptionHandler).renderError(classified, null);
        verify(exceptionHandler, never()).reportQueue(any(), any());
    }

    @Test
    void usesQueueHooksWhenADeliveryIsInvolved() {
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);
        Delivery delivery = new Delivery(channel, "ctag", new Envelope(7L, false, "orders", "order.created.eu"), null,
            new byte[0]);

        BowlerException classified = translator.translate(BrokerFailures.channelClosed(406, "PRECONDITION_FAILED - unknown delivery tag 7"),
            Map.of("deliveryTag", 7L), Map.of(), delivery);

        InOrder order = inOrder(exceptionHandler);
        order.verify(exceptionHandler).reportQueue(classified, delivery);
        order.verify(exceptionHandler).renderQueue(classified, delivery);
        verify(exceptionHandler, never()).reportError(any(), isNull());
    }

    @Test
    void rendersEvenWhenReportingFails() {
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);
        doThrow(new IllegalStateException("alerting down")).when(exceptionHandler).reportError(any(), isNull());

        BowlerException classified = translator.translate(new IOException("boom"), Map.of(), Map.of());

        verify(exceptionHandler).renderError(classified, null);
    }

    @Test
    void alreadyClassifiedErrorsAreReturnedWithoutReportingAgain() {
        BowlerException classified = ExceptionTranslator.classify(new IOException("boom"), Map.of(), Map.of());
        ExceptionTranslator translator = new ExceptionTranslator(exceptionHandler);

        assertThat(translator.translate(classified, Map.of("other", 1), Map.of())).isSameAs(classified);
        verifyNoInteractions(exceptionHandler);
    }
}
