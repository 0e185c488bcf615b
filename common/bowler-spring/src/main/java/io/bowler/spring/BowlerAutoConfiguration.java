package io.bowler.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.bowler.core.connection.BrokerConnection;
import io.bowler.core.consumer.ConsumerMetrics;
import io.bowler.core.consumer.MessageHandler;
import io.bowler.core.consumer.QueueConsumer;
import io.bowler.core.error.BowlerExceptionHandler;
import io.bowler.core.error.ExceptionTranslator;
import io.bowler.core.error.LoggingExceptionHandler;
import io.bowler.core.producer.Producer;
import io.bowler.core.topology.DeadLetter;
import io.bowler.core.topology.TopologyDeclarator;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnSingleCandidate;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires Bowler's exception handling, producer and consumer on top of Spring AMQP's connection factory.
 * <p>
 * A {@link QueueConsumer} and its {@link BowlerConsumerLifecycle} are only created when the application
 * defines a {@link MessageHandler} bean.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter(value = RabbitAutoConfiguration.class,
    name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({ConnectionFactory.class, QueueConsumer.class})
@ConditionalOnProperty(prefix = "bowler", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(BowlerProperties.class)
public class BowlerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(BowlerExceptionHandler.class)
    LoggingExceptionHandler bowlerExceptionHandler(ObjectProvider<ObjectMapper> objectMapper) {
        return new LoggingExceptionHandler(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    ExceptionTranslator bowlerExceptionTranslator(BowlerExceptionHandler exceptionHandler) {
        return new ExceptionTranslator(exceptionHandler);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(ConnectionFactory.class)
    @ConditionalOnMissingBean(BrokerConnection.class)
    CachingBrokerConnection bowlerBrokerConnection(ConnectionFactory connectionFactory,
                                                   ExceptionTranslator translator) {
        return new CachingBrokerConnection(connectionFactory, translator);
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean
    ConsumerMetrics bowlerConsumerMetrics(MeterRegistry meterRegistry) {
        return new ConsumerMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnBean(BrokerConnection.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "bowler.producer", name = "enabled", havingValue = "true", matchIfMissing = true)
    Producer bowlerProducer(BrokerConnection connection,
                            ExceptionTranslator translator,
                            BowlerProperties properties,
                            ObjectProvider<ObjectMapper> objectMapper) {
        return new Producer(connection.getChannel(), properties.getExchange().toDefinition(),
            properties.getProducer().getDeliveryMode(), translator, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnBean(BrokerConnection.class)
    @ConditionalOnSingleCandidate(MessageHandler.class)
    @ConditionalOnMissingBean
    QueueConsumer bowlerQueueConsumer(BrokerConnection connection,
                                      ExceptionTranslator translator,
                                      BowlerProperties properties,
                                      ObjectProvider<ConsumerMetrics> metrics) {
        BowlerProperties.DeadLetterProperties deadLetter = properties.getDeadLetter();
        if (deadLetter.isConfigured() && deadLetter.isDeclare()) {
            DeadLetter.declareTarget(new TopologyDeclarator(connection.getChannel(), translator),
                deadLetter.getExchange(), deadLetter.resolvedQueue(), deadLetter.getRoutingKey());
        }
        QueueConsumer.Builder builder = QueueConsumer.builder()
            .connection(connection)
            .exchange(properties.getExchange().toDefinition())
            .queue(properties.getQueue().toDefinition())
            .routingKeys(properties.getQueue().getBindings().toArray(new String[0]))
            .translator(translator)
            .consumerTag(properties.getConsumer().getTag())
            .pollInterval(properties.getConsumer().getPollInterval())
            .failurePolicy(properties.getConsumer().getFailurePolicy())
            .metrics(metrics.getIfAvailable(ConsumerMetrics::noop));
        if (deadLetter.isConfigured()) {
            builder.deadLetter(deadLetter.getExchange(), deadLetter.getRoutingKey());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnBean(QueueConsumer.class)
    @ConditionalOnMissingBean
    BowlerConsumerLifecycle bowlerConsumerLifecycle(QueueConsumer consumer,
                                                    MessageHandler handler,
                                                    BowlerProperties properties) {
        return new BowlerConsumerLifecycle(consumer, handler, properties.getConsumer().isAutoStartup(),
            properties.getConsumer().getShutdownTimeout());
    }
}
