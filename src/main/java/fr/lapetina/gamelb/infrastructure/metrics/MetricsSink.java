package fr.lapetina.gamelb.infrastructure.metrics;

import fr.lapetina.gamelb.domain.exception.SinkWriteException;
import fr.lapetina.gamelb.domain.model.MetricsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only log of metrics records, shared by all dispatch workers.
 *
 * Appends are serialized by a lock that is only ever held for the list insertion,
 * and callers wait at most {@code appendTimeout} for it. The order of records is the
 * order in which dispatches completed. A record is either fully appended or not at all.
 *
 * Lifecycle: created open, {@link #flush()} exports to the registered exporters,
 * {@link #close()} rejects further appends. Records stay readable after close.
 */
public final class MetricsSink implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsSink.class);

    public static final Duration DEFAULT_APPEND_TIMEOUT = Duration.ofSeconds(1);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<MetricsRecord> records = new ArrayList<>();
    private final List<MetricsExporter> exporters = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Duration appendTimeout;

    public MetricsSink(Duration appendTimeout) {
        this.appendTimeout = Objects.requireNonNull(appendTimeout, "Append timeout is required");
        if (appendTimeout.isNegative() || appendTimeout.isZero()) {
            throw new IllegalArgumentException("Append timeout must be positive: " + appendTimeout);
        }
    }

    public MetricsSink() {
        this(DEFAULT_APPEND_TIMEOUT);
    }

    /**
     * Adds an exporter invoked on {@link #flush()}.
     */
    public MetricsSink addExporter(MetricsExporter exporter) {
        exporters.add(Objects.requireNonNull(exporter, "Exporter is required"));
        return this;
    }

    /**
     * Appends one record.
     *
     * @throws SinkWriteException if the sink is closed, the exclusive region could not be
     *                            entered within the append timeout, or the caller was interrupted
     */
    public void append(MetricsRecord record) {
        Objects.requireNonNull(record, "Record is required");
        if (closed.get()) {
            throw new SinkWriteException("Metrics sink is closed, rejecting record for player " + record.playerId());
        }

        boolean acquired;
        try {
            acquired = lock.tryLock(appendTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkWriteException("Interrupted while appending record for player " + record.playerId(), e);
        }
        if (!acquired) {
            throw new SinkWriteException("Timed out after " + appendTimeout.toMillis()
                    + "ms appending record for player " + record.playerId());
        }

        try {
            // Re-check under the lock so no append lands after close() returned
            if (closed.get()) {
                throw new SinkWriteException("Metrics sink is closed, rejecting record for player " + record.playerId());
            }
            records.add(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns all records in append order. Does not remove them, so calling it twice
     * without new appends returns equal lists.
     */
    public List<MetricsRecord> drain() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Exports the current records to every registered exporter.
     *
     * @throws SinkWriteException if an exporter fails; the remaining exporters are skipped
     */
    public void flush() {
        List<MetricsRecord> snapshot = drain();
        for (MetricsExporter exporter : exporters) {
            try {
                exporter.export(snapshot);
                log.info("Exported {} metrics records via {}", snapshot.size(), exporter.getName());
            } catch (IOException e) {
                throw new SinkWriteException("Exporter " + exporter.getName() + " failed", e);
            }
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Rejects any further append. Does not export.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            // Wait for an append that is already inside the exclusive region
            lock.lock();
            try {
                log.info("Metrics sink closed with {} records", records.size());
            } finally {
                lock.unlock();
            }
        }
    }
}
