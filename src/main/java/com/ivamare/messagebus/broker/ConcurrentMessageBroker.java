package com.ivamare.messagebus.broker;

import com.ivamare.messagebus.policy.ErrorPolicy;
import com.ivamare.messagebus.policy.FailureHandler;
import com.ivamare.messagebus.support.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Broker that delivers each message on a bounded pool of worker threads.
 *
 * <p>{@code sendMessage} returns once deliveries are scheduled. Deliveries to
 * subscribers of the same class wait in a shared mailbox and run one after
 * another, in publish order. Different subscriber classes run concurrently,
 * and a busy subscriber never holds more than one worker. Failures inside a
 * delivery are logged and swallowed.
 *
 * <p>Call {@link #close()} to drain in-flight deliveries and stop the pool.
 */
@Singleton
public class ConcurrentMessageBroker extends DefaultMessageBroker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentMessageBroker.class);

    public static final int DEFAULT_CONCURRENCY = 4;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final int concurrency;
    private final Duration shutdownTimeout;
    private final ExecutorService executor;
    private final Map<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Map<String, Future<?>> lastDeliveries = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicInteger inFlight = new AtomicInteger();

    public ConcurrentMessageBroker() {
        this(DEFAULT_CONCURRENCY, DEFAULT_SHUTDOWN_TIMEOUT, new FailureHandler());
    }

    /**
     * Creates a new ConcurrentMessageBroker.
     *
     * @param concurrency Number of delivery threads
     * @param shutdownTimeout How long {@link #close()} waits for in-flight deliveries
     * @param failureHandler Logs subscriber failures
     */
    public ConcurrentMessageBroker(int concurrency, Duration shutdownTimeout, FailureHandler failureHandler) {
        super(failureHandler);
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        this.concurrency = concurrency;
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout is required");
        this.executor = Executors.newFixedThreadPool(concurrency, threadFactory());
        log.info("Started concurrent broker with concurrency={}", concurrency);
    }

    @Override
    protected void deliver(String channel, Subscriber subscriber, BrokerMessage message) {
        if (!running.get()) {
            getFailureHandler().handle(channel,
                new RejectedExecutionException("Broker is closed"), ErrorPolicy.IGNORE);
            return;
        }

        String key = keyOf(subscriber);
        Mailbox mailbox = mailboxes.computeIfAbsent(key, Mailbox::new);
        Delivery delivery = new Delivery(channel, subscriber, message, new CompletableFuture<>());
        inFlight.incrementAndGet();
        mailbox.pending.add(delivery);
        lastDeliveries.put(key, delivery.done());
        schedule(mailbox);
    }

    /**
     * Submits a drain task for the mailbox unless one is already scheduled.
     * A worker only ever runs deliveries that are ready, so a slow subscriber
     * holds at most one thread.
     */
    private void schedule(Mailbox mailbox) {
        if (!mailbox.scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(() -> drain(mailbox));
        } catch (RejectedExecutionException e) {
            mailbox.scheduled.set(false);
            Delivery dropped;
            while ((dropped = mailbox.pending.poll()) != null) {
                inFlight.decrementAndGet();
                dropped.done().completeExceptionally(e);
                getFailureHandler().handle(dropped.channel(), e, ErrorPolicy.IGNORE);
            }
        }
    }

    private void drain(Mailbox mailbox) {
        while (true) {
            Delivery delivery;
            while ((delivery = mailbox.pending.poll()) != null) {
                run(delivery);
            }
            mailbox.scheduled.set(false);
            // a delivery enqueued after the last poll lost the race to schedule
            if (mailbox.pending.isEmpty() || !mailbox.scheduled.compareAndSet(false, true)) {
                return;
            }
        }
    }

    private void run(Delivery delivery) {
        try {
            delivery.subscriber().receive(delivery.message());
        } catch (Exception e) {
            getFailureHandler().handle(delivery.channel(), e, ErrorPolicy.IGNORE);
        } finally {
            inFlight.decrementAndGet();
            delivery.done().complete(null);
        }
    }

    /**
     * Stop accepting deliveries, wait up to the shutdown timeout for in-flight
     * ones, then interrupt whatever is left. Idempotent.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        log.info("Stopping concurrent broker, waiting for {} in-flight deliveries", inFlight.get());
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timeout waiting for {} in-flight deliveries", inFlight.get());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Concurrent broker stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public int inFlightCount() {
        return inFlight.get();
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * @return Completion of the most recent delivery per subscriber class
     */
    public Map<String, Future<?>> lastDeliveries() {
        return Map.copyOf(lastDeliveries);
    }

    private static String keyOf(Subscriber subscriber) {
        return subscriber.getClass().getName();
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "messagebus-broker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Delivery(String channel, Subscriber subscriber, BrokerMessage message,
                            CompletableFuture<Void> done) {
    }

    /** Deliveries waiting for one subscriber class, drained by at most one worker at a time. */
    private static final class Mailbox {

        private final String key;
        private final Queue<Delivery> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean();

        private Mailbox(String key) {
            this.key = key;
        }

        @Override
        public String toString() {
            return "Mailbox[" + key + ", pending=" + pending.size() + "]";
        }
    }
}
