package io.bowler.spring;

import io.bowler.core.consumer.MessageHandler;
import io.bowler.core.consumer.QueueConsumer;
import io.bowler.core.error.BowlerException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs a {@link QueueConsumer} on a dedicated daemon thread for the lifetime of the application context.
 * <p>
 * A consumer cannot be restarted once its loop has ended, so this lifecycle starts it at most once.
 */
public final class BowlerConsumerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BowlerConsumerLifecycle.class);

    private final QueueConsumer consumer;
    private final MessageHandler handler;
    private final boolean autoStartup;
    private final Duration shutdownTimeout;
    private volatile Thread worker;
    private volatile boolean running;

    public BowlerConsumerLifecycle(QueueConsumer consumer,
                                   MessageHandler handler,
                                   boolean autoStartup,
                                   Duration shutdownTimeout) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.autoStartup = autoStartup;
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    @Override
    public synchronized void start() {
        if (running || worker != null) {
            return;
        }
        Thread thread = new Thread(this::runConsumer, "bowler-consumer");
        thread.setDaemon(true);
        worker = thread;
        running = true;
        thread.start();
        log.info("Bowler consumer lifecycle started");
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (this) {
            if (!running) {
                return;
            }
            thread = worker;
        }
        consumer.stop();
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(shutdownTimeout.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Bowler consumer did not stop within {}; interrupting", shutdownTimeout);
                thread.interrupt();
            }
        }
        running = false;
        log.info("Bowler consumer lifecycle stopped");
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    @Override
    public int getPhase() {
        return 0;
    }

    private void runConsumer() {
        try {
            consumer.listenToQueue(handler);
        } catch (BowlerException ex) {
            log.error("Bowler consumer could not start ({}): {}", ex.kind(), ex.getMessage());
        } catch (VirtualMachineError ex) {
            log.error("Bowler consumer thread aborted", ex);
            throw ex;
        } catch (RuntimeException | Error ex) {
            log.error("Bowler consumer terminated unexpectedly", ex);
        } finally {
            running = false;
        }
    }
}
