package io.bowler.core.consumer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.util.Locale;
import java.util.Objects;

/**
 * Records handler latency and settlements using Micrometer.
 */
public final class ConsumerMetrics {

    static final String HANDLE_DURATION = "bowler.consumer.handle.duration";
    static final String SETTLEMENT = "bowler.consumer.settlement";

    private final MeterRegistry meterRegistry;

    public ConsumerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    /**
     * Metrics backed by a registry with no meter implementations, so nothing is recorded.
     */
    public static ConsumerMetrics noop() {
        return new ConsumerMetrics(new CompositeMeterRegistry());
    }

    Timer.Sample startHandling() {
        return Timer.start(meterRegistry);
    }

    void stopHandling(Timer.Sample sample, String queue, boolean success) {
        sample.stop(Timer.builder(HANDLE_DURATION)
            .description("Latency of Bowler message handler invocations")
            .tag("queue", nullToUnknown(queue))
            .tag("outcome", success ? "ack" : "failure")
            .register(meterRegistry));
    }

    void settled(String queue, Settlement settlement) {
        Counter.builder(SETTLEMENT)
            .description("Deliveries settled by Bowler consumers")
            .tag("queue", nullToUnknown(queue))
            .tag("type", settlement.name().toLowerCase(Locale.ROOT))
            .register(meterRegistry)
            .increment();
    }

    private String nullToUnknown(String value) {
        return value == null || value.isEmpty() ? "unknown" : value;
    }
}
