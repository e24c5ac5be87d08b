package fr.lapetina.gamelb.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.gamelb.dispatch.RequestDispatcher;
import fr.lapetina.gamelb.disruptor.handlers.DispatchWorkHandler;
import fr.lapetina.gamelb.domain.event.PlayerRequestEvent;
import fr.lapetina.gamelb.domain.event.PlayerRequestEventFactory;
import fr.lapetina.gamelb.domain.model.PlayerRequest;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gamelb.simulation.SimulationRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of dispatch workers fed through a Disruptor ring buffer.
 *
 * The driver publishes player requests from a single thread; a worker pool of
 * {@code workers} handlers consumes them, each event going to exactly one worker.
 * Publishing blocks while the ring buffer is full.
 *
 * WAIT STRATEGY CHOICE: Configurable (default BlockingWaitStrategy)
 *
 * - BlockingWaitStrategy: workers spend most of their time in simulated delays,
 *   so parking idle workers costs nothing noticeable and keeps CPU free.
 * - YieldingWaitStrategy: lower hand-off latency, burns CPU in a yield loop.
 */
public final class DispatchWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchWorkerPool.class);

    private final Disruptor<PlayerRequestEvent> disruptor;
    private final RingBuffer<PlayerRequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private DispatchWorkerPool(Builder builder) {

        this.disruptor = new Disruptor<>(
                new PlayerRequestEventFactory(),
                builder.ringBufferSize,
                new DispatchThreadFactory("dispatch-worker"),
                ProducerType.SINGLE, // Only the simulation driver publishes
                createWaitStrategy(builder.waitStrategy)
        );

        DispatchWorkHandler[] handlers = new DispatchWorkHandler[builder.workers];
        for (int i = 0; i < handlers.length; i++) {
            handlers[i] = new DispatchWorkHandler(builder.dispatcher, builder.run, builder.metricsRegistry);
        }
        disruptor.handleEventsWithWorkerPool(handlers);
        disruptor.setDefaultExceptionHandler(new DispatchExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DispatchWorkerPool created: workers={}, ringBufferSize={}, waitStrategy={}",
                builder.workers, builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the worker threads.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.debug("DispatchWorkerPool started");
        }
    }

    /**
     * Publishes one request, blocking while the ring buffer is full.
     */
    public void publish(PlayerRequest request) {
        if (!running.get()) {
            throw new IllegalStateException("Worker pool not running");
        }

        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).initialize(request);
        } finally {
            ringBuffer.publish(sequence);
        }

        log.trace("Request published: playerId={}, sequence={}", request.playerId(), sequence);
    }

    /**
     * Shuts down once every published event has been processed.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.debug("DispatchWorkerPool shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("DispatchWorkerPool shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for dispatch worker threads.
     */
    private static class DispatchThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DispatchThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Exception handler for the Disruptor. Workers resolve their own failures,
     * so only errors that escape them end up here.
     */
    private static class DispatchExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<PlayerRequestEvent> {

        private static final Logger log = LoggerFactory.getLogger(DispatchExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, PlayerRequestEvent event) {
            log.error("Exception in dispatch worker: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during worker pool start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during worker pool shutdown", ex);
        }
    }

    /**
     * Builder for DispatchWorkerPool.
     */
    public static final class Builder {
        private int workers = 1;
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private RequestDispatcher dispatcher;
        private MetricsRegistry metricsRegistry;
        private SimulationRun run;

        public Builder workers(int workers) {
            if (workers < 1) {
                throw new IllegalArgumentException("At least one worker is required");
            }
            this.workers = workers;
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (size < 1 || Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder dispatcher(RequestDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder run(SimulationRun run) {
            this.run = run;
            return this;
        }

        public DispatchWorkerPool build() {
            if (dispatcher == null) {
                throw new IllegalStateException("RequestDispatcher is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (run == null) {
                throw new IllegalStateException("SimulationRun is required");
            }
            if (waitStrategy == null) {
                waitStrategy = "blocking";
            }
            return new DispatchWorkerPool(this);
        }
    }
}
