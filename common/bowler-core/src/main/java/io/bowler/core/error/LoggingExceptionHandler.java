package io.bowler.core.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bowler.core.consumer.Delivery;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link BowlerExceptionHandler} that reports through SLF4J.
 * <p>
 * {@code report} logs the failure with its stack trace. {@code render} logs a single-line JSON summary
 * (kind, code, message, delivery coordinates and declaration context) that log shippers can index.
 */
public class LoggingExceptionHandler implements BowlerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingExceptionHandler.class);

    private final ObjectMapper mapper;

    public LoggingExceptionHandler() {
        this(new ObjectMapper());
    }

    public LoggingExceptionHandler(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public void reportError(Throwable error, Delivery delivery) {
        if (delivery == null) {
            log.error("Bowler failure: {}", error.getMessage(), error);
        } else {
            log.warn("Failed to process delivery {} from {} (routingKey={})",
                delivery.deliveryTag(), delivery.exchange(), delivery.routingKey(), error);
        }
    }

    @Override
    public void renderError(Throwable error, Delivery delivery) {
        if (!log.isInfoEnabled()) {
            return;
        }
        log.info("{}", render(error, delivery));
    }

    /**
     * Produces the JSON summary logged by {@link #renderError(Throwable, Delivery)}.
     */
    public String render(Throwable error, Delivery delivery) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error.getClass().getSimpleName());
        payload.put("message", error.getMessage());
        if (error instanceof BowlerException classified) {
            payload.put("kind", classified.kind().name());
            payload.put("code", classified.code());
            payload.put("source", classified.sourceFile() + ":" + classified.sourceLine());
            payload.put("parameters", stringify(classified.parameters()));
            payload.put("arguments", stringify(classified.arguments()));
        }
        if (delivery != null) {
            payload.put("deliveryTag", delivery.deliveryTag());
            payload.put("exchange", delivery.exchange());
            payload.put("routingKey", delivery.routingKey());
            payload.put("redelivered", delivery.redelivered());
        }
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            log.debug("Unable to serialise error summary", ex);
            return payload.toString();
        }
    }

    private static Map<String, String> stringify(Map<String, Object> values) {
        Map<String, String> converted = new LinkedHashMap<>();
        values.forEach((key, value) -> converted.put(key, String.valueOf(value)));
        return converted;
    }
}
