package fr.lapetina.gamelb.simulation;

import fr.lapetina.gamelb.domain.model.DispatchFailure;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Outcome bookkeeping for one run, shared by the driver and all dispatch workers.
 *
 * Every requested player ends up in exactly one bucket: dispatched, failed or not
 * issued. The run is resolved once all of them are accounted for.
 */
public final class SimulationRun {

    private final int requested;
    private final long deadlineNanos;
    private final boolean hasDeadline;
    private final CountDownLatch unresolved;

    private final AtomicInteger dispatched = new AtomicInteger(0);
    private final AtomicInteger notIssued = new AtomicInteger(0);
    private final Queue<DispatchFailure> failures = new ConcurrentLinkedQueue<>();
    private final AtomicReference<String> abortReason = new AtomicReference<>();
    private final AtomicBoolean timedOut = new AtomicBoolean(false);

    /**
     * @param timeout overall issuance timeout, or null / zero for none
     */
    public SimulationRun(int requested, Duration timeout) {
        this.requested = requested;
        this.unresolved = new CountDownLatch(requested);
        this.hasDeadline = timeout != null && !timeout.isZero() && !timeout.isNegative();
        this.deadlineNanos = hasDeadline ? System.nanoTime() + timeout.toNanos() : 0L;
    }

    /**
     * Whether a new request may still be issued. Flags the run as timed out the
     * first time the deadline is found to have passed.
     */
    public boolean mayIssue() {
        if (abortReason.get() != null || timedOut.get()) {
            return false;
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos >= 0) {
            timedOut.set(true);
            return false;
        }
        return true;
    }

    public void recordDispatched() {
        dispatched.incrementAndGet();
        unresolved.countDown();
    }

    public void recordFailure(DispatchFailure failure) {
        failures.add(failure);
        unresolved.countDown();
    }

    public void recordNotIssued(int count) {
        notIssued.addAndGet(count);
        for (int i = 0; i < count; i++) {
            unresolved.countDown();
        }
    }

    /**
     * Stops further issuance. Only the first reason is kept.
     */
    public void abort(String reason) {
        abortReason.compareAndSet(null, reason);
    }

    public boolean isAborted() {
        return abortReason.get() != null;
    }

    public boolean isTimedOut() {
        return timedOut.get();
    }

    /**
     * Blocks until every requested player has been accounted for.
     */
    public void awaitResolution() throws InterruptedException {
        unresolved.await();
    }

    public long getUnresolved() {
        return unresolved.getCount();
    }

    public SimulationSummary toSummary(Duration wallTime) {
        SimulationSummary.Outcome outcome;
        if (abortReason.get() != null) {
            outcome = SimulationSummary.Outcome.ABORTED;
        } else if (timedOut.get()) {
            outcome = SimulationSummary.Outcome.TIMED_OUT;
        } else {
            outcome = SimulationSummary.Outcome.COMPLETED;
        }
        ArrayList<DispatchFailure> failed = new ArrayList<>(failures);
        return new SimulationSummary(
                requested,
                dispatched.get(),
                failed.size(),
                notIssued.get(),
                wallTime,
                outcome,
                failed,
                abortReason.get()
        );
    }
}
