package fr.lapetina.gamelb.disruptor.handlers;

import com.lmax.disruptor.WorkHandler;
import fr.lapetina.gamelb.dispatch.RequestDispatcher;
import fr.lapetina.gamelb.domain.event.EventState;
import fr.lapetina.gamelb.domain.event.PlayerRequestEvent;
import fr.lapetina.gamelb.domain.exception.DispatchException;
import fr.lapetina.gamelb.domain.exception.SinkWriteException;
import fr.lapetina.gamelb.domain.model.DispatchFailure;
import fr.lapetina.gamelb.domain.model.ErrorType;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gamelb.simulation.SimulationRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker of the dispatch pool: each ring buffer event is handled by exactly one
 * worker, so the number of workers bounds the dispatches in flight.
 *
 * Every event is resolved into the run exactly once: dispatched, failed, or not
 * issued when the run has timed out or been aborted before the worker took it.
 */
public final class DispatchWorkHandler implements WorkHandler<PlayerRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchWorkHandler.class);

    private final RequestDispatcher dispatcher;
    private final SimulationRun run;
    private final MetricsRegistry metricsRegistry;

    public DispatchWorkHandler(RequestDispatcher dispatcher, SimulationRun run, MetricsRegistry metricsRegistry) {
        this.dispatcher = dispatcher;
        this.run = run;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(PlayerRequestEvent event) {
        String playerId = event.getRequest().playerId();
        try {
            if (!run.mayIssue()) {
                event.setState(EventState.NOT_ISSUED);
                run.recordNotIssued(1);
                metricsRegistry.recordNotIssued(1);
                log.debug("Request not issued: playerId={}, aborted={}, timedOut={}",
                        playerId, run.isAborted(), run.isTimedOut());
                return;
            }

            event.setState(EventState.ISSUED);
            log.debug("Request issued: playerId={}, sequence={}, queuedFor={}ms",
                    playerId, event.getRequest().sequence(), event.queueWait().toMillis());
            dispatcher.dispatch(playerId);
            event.setState(EventState.COMPLETED);
            run.recordDispatched();

        } catch (DispatchException e) {
            fail(event, e.getErrorType(), e.getMessage());
            log.warn("Dispatch failed: playerId={}, errorType={}, message={}",
                    playerId, e.getErrorType(), e.getMessage());

        } catch (SinkWriteException e) {
            run.abort("Metrics sink write failed for player " + playerId + ": " + e.getMessage());
            fail(event, ErrorType.SINK_WRITE_ERROR, e.getMessage());
            log.error("Metrics write failed, aborting run: playerId={}", playerId, e);

        } catch (RuntimeException e) {
            fail(event, ErrorType.INTERNAL_ERROR, String.valueOf(e));
            log.error("Unexpected dispatch error: playerId={}", playerId, e);

        } finally {
            // An Error escaping the dispatch still has to resolve the request,
            // otherwise the driver waits for it forever
            if (!event.getState().isTerminal()) {
                fail(event, ErrorType.INTERNAL_ERROR, "dispatch terminated abnormally");
            }
        }
    }

    private void fail(PlayerRequestEvent event, ErrorType errorType, String message) {
        event.fail(errorType);
        metricsRegistry.recordFailure(errorType);
        run.recordFailure(new DispatchFailure(event.getRequest().playerId(), errorType, message));
    }
}
