package fr.lapetina.gamelb.simulation;

import fr.lapetina.gamelb.dispatch.RequestDispatcher;
import fr.lapetina.gamelb.dispatch.Sleeper;
import fr.lapetina.gamelb.domain.delay.FixedDelayDistribution;
import fr.lapetina.gamelb.domain.exception.ConfigurationException;
import fr.lapetina.gamelb.domain.model.DispatchFailure;
import fr.lapetina.gamelb.domain.model.ErrorType;
import fr.lapetina.gamelb.domain.model.MetricsRecord;
import fr.lapetina.gamelb.domain.model.ServerPool;
import fr.lapetina.gamelb.domain.model.ServerStats;
import fr.lapetina.gamelb.domain.strategy.RoundRobinSelector;
import fr.lapetina.gamelb.domain.strategy.ServerSelector;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.gamelb.infrastructure.metrics.MetricsSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SimulationDriverTest {

    private ServerPool pool;
    private MetricsSink sink;
    private MetricsRegistry registry;

    @AfterEach
    void tearDown() {
        if (sink != null) {
            sink.close();
        }
        if (registry != null) {
            registry.close();
        }
    }

    private RequestDispatcher.Builder dispatcher(int servers) {
        pool = ServerPool.of(servers);
        sink = new MetricsSink();
        registry = new MetricsRegistry("test");
        return RequestDispatcher.builder()
                .serverPool(pool)
                .selector(new RoundRobinSelector(servers))
                .delayDistribution(new FixedDelayDistribution(1.0))
                .metricsSink(sink)
                .metricsRegistry(registry)
                .sleeper(Sleeper.NONE);
    }

    private SimulationDriver driver(RequestDispatcher dispatcher) {
        return SimulationDriver.builder()
                .dispatcher(dispatcher)
                .ringBufferSize(64)
                .build();
    }

    private void assertAccountedFor(SimulationSummary summary) {
        assertThat(summary.dispatched() + summary.failed() + summary.notIssued())
                .isEqualTo(summary.requested());
        assertThat(pool.totalRequestsServed()).isEqualTo(summary.dispatched());
        assertThat(sink.size()).isEqualTo(summary.dispatched());
    }

    @Nested
    @DisplayName("Balanced runs")
    class BalancedRunTests {

        @Test
        @DisplayName("should give each of 3 servers exactly 3 of 9 players")
        void shouldBalanceNinePlayersOverThreeServers() {
            SimulationDriver driver = driver(dispatcher(3).build());

            SimulationSummary summary = driver.run(9, 3);

            assertThat(summary.outcome()).isEqualTo(SimulationSummary.Outcome.COMPLETED);
            assertThat(summary.isClean()).isTrue();
            assertThat(summary.dispatched()).isEqualTo(9);
            for (ServerStats stats : pool.snapshot()) {
                assertThat(stats.requestsServed()).isEqualTo(3);
                assertThat(stats.totalResponseTime()).isCloseTo(3.0, within(1e-9));
            }
            assertAccountedFor(summary);
        }

        @Test
        @DisplayName("should spread uneven player counts within one request")
        void shouldSpreadUnevenCounts() {
            SimulationDriver driver = driver(dispatcher(4).build());

            SimulationSummary summary = driver.run(10, 5);

            assertThat(pool.snapshot())
                    .extracting(ServerStats::requestsServed)
                    .containsExactly(3L, 3L, 2L, 2L);
            assertAccountedFor(summary);
        }

        @Test
        @DisplayName("should route every player to the only server")
        void shouldUseSingleServer() {
            SimulationDriver driver = driver(dispatcher(1).build());

            SimulationSummary summary = driver.run(5, 2);

            assertThat(pool.snapshot().get(0).requestsServed()).isEqualTo(5);
            assertThat(sink.drain()).extracting(MetricsRecord::serverIndex).containsOnly(0);
            assertAccountedFor(summary);
        }

        @Test
        @DisplayName("should issue player ids 1 to N exactly once")
        void shouldIssueEveryPlayerOnce() {
            SimulationDriver driver = driver(dispatcher(3).build());

            driver.run(12, 4);

            assertThat(sink.drain())
                    .extracting(MetricsRecord::playerId)
                    .containsExactlyInAnyOrder("1", "2", "3", "4", "5", "6", "7", "8", "9", "10", "11", "12");
        }

        @Test
        @DisplayName("should complete immediately with no players")
        void shouldCompleteWithNoPlayers() {
            SimulationDriver driver = driver(dispatcher(3).build());

            SimulationSummary summary = driver.run(0, 1);

            assertThat(summary.outcome()).isEqualTo(SimulationSummary.Outcome.COMPLETED);
            assertThat(summary.requested()).isZero();
            assertThat(sink.drain()).isEmpty();
            assertThat(driver.getState()).isEqualTo(SimulationState.COMPLETED);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should never exceed the concurrency limit")
        void shouldRespectConcurrencyLimit() {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            Sleeper tracking = duration -> {
                int current = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(current, Math::max);
                try {
                    Thread.sleep(10);
                } finally {
                    inFlight.decrementAndGet();
                }
            };
            SimulationDriver driver = driver(dispatcher(3).sleeper(tracking).build());

            SimulationSummary summary = driver.run(20, 2);

            assertThat(summary.dispatched()).isEqualTo(20);
            assertThat(maxInFlight.get()).isBetween(1, 2);
        }

        @Test
        @DisplayName("should overlap dispatches up to the limit")
        void shouldOverlapDispatches() {
            CountDownLatch allWaiting = new CountDownLatch(4);
            AtomicInteger overlapped = new AtomicInteger();
            Sleeper barrier = duration -> {
                allWaiting.countDown();
                if (allWaiting.await(5, TimeUnit.SECONDS)) {
                    overlapped.incrementAndGet();
                }
            };
            SimulationDriver driver = driver(dispatcher(2).sleeper(barrier).build());

            SimulationSummary summary = driver.run(4, 4);

            assertThat(overlapped.get()).isEqualTo(4);
            assertThat(summary.dispatched()).isEqualTo(4);
            assertThat(pool.snapshot())
                    .extracting(ServerStats::requestsServed)
                    .containsExactly(2L, 2L);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should record failed dispatches and keep going")
        void shouldContinueAfterFailures() {
            AtomicInteger calls = new AtomicInteger();
            ServerSelector flaky = new ServerSelector() {
                @Override
                public String getName() {
                    return "flaky";
                }

                @Override
                public int selectNext() {
                    int call = calls.incrementAndGet();
                    if (call % 3 == 0) {
                        throw new IllegalStateException("selection failed on call " + call);
                    }
                    return call % 2;
                }
            };
            SimulationDriver driver = driver(dispatcher(2).selector(flaky).build());

            SimulationSummary summary = driver.run(9, 3);

            assertThat(summary.dispatched()).isEqualTo(6);
            assertThat(summary.failed()).isEqualTo(3);
            assertThat(summary.outcome()).isEqualTo(SimulationSummary.Outcome.COMPLETED);
            assertThat(summary.isClean()).isFalse();
            assertThat(summary.failures())
                    .extracting(DispatchFailure::errorType)
                    .containsOnly(ErrorType.SELECTION_ERROR);
            assertAccountedFor(summary);
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("should resolve a request whose dispatch throws an Error")
        void shouldResolveRequestOnError() {
            AtomicInteger calls = new AtomicInteger();
            ServerSelector crashing = new ServerSelector() {
                @Override
                public String getName() {
                    return "crashing";
                }

                @Override
                public int selectNext() {
                    if (calls.incrementAndGet() == 2) {
                        throw new AssertionError("selector crashed");
                    }
                    return 0;
                }
            };
            SimulationDriver driver = driver(dispatcher(3).selector(crashing).build());

            SimulationSummary summary = driver.run(3, 1);

            assertThat(summary.dispatched()).isEqualTo(2);
            assertThat(summary.failed()).isEqualTo(1);
            assertThat(summary.failures().get(0).errorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
            assertThat(driver.getState()).isEqualTo(SimulationState.COMPLETED);
            assertAccountedFor(summary);
        }

        @Test
        @DisplayName("should abort when the metrics sink rejects a record")
        void shouldAbortOnSinkFailure() {
            SimulationDriver driver = driver(dispatcher(3).build());
            sink.close();

            SimulationSummary summary = driver.run(5, 1);

            assertThat(summary.outcome()).isEqualTo(SimulationSummary.Outcome.ABORTED);
            assertThat(summary.abortReason()).contains("player 1");
            assertThat(summary.dispatched()).isZero();
            assertThat(summary.failed()).isEqualTo(1);
            assertThat(summary.notIssued()).isEqualTo(4);
            assertThat(summary.failures().get(0).errorType()).isEqualTo(ErrorType.SINK_WRITE_ERROR);
            assertAccountedFor(summary);
        }

        @Test
        @DisplayName("should stop issuing requests after the timeout")
        void shouldStopAfterTimeout() {
            Sleeper slow = duration -> Thread.sleep(30);
            SimulationDriver driver = SimulationDriver.builder()
                    .dispatcher(dispatcher(3).sleeper(slow).build())
                    .timeout(Duration.ofMillis(100))
                    .ringBufferSize(64)
                    .build();

            SimulationSummary summary = driver.run(20, 1);

            assertThat(summary.outcome()).isEqualTo(SimulationSummary.Outcome.TIMED_OUT);
            assertThat(summary.notIssued()).isPositive();
            assertThat(summary.dispatched()).isLessThan(20);
            assertAccountedFor(summary);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should move from IDLE to COMPLETED")
        void shouldTransitionStates() {
            SimulationDriver driver = driver(dispatcher(3).build());
            assertThat(driver.getState()).isEqualTo(SimulationState.IDLE);

            driver.run(3, 3);

            assertThat(driver.getState()).isEqualTo(SimulationState.COMPLETED);
        }

        @Test
        @DisplayName("should refuse a second run")
        void shouldRunOnlyOnce() {
            SimulationDriver driver = driver(dispatcher(3).build());
            driver.run(3, 1);

            assertThatThrownBy(() -> driver.run(3, 1))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should reject invalid arguments before issuing anything")
        void shouldRejectInvalidArguments() {
            SimulationDriver driver = driver(dispatcher(3).build());

            assertThatThrownBy(() -> driver.run(-1, 1)).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> driver.run(5, 0)).isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> driver.run(3, 4))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("exceeds");

            assertThat(driver.getState()).isEqualTo(SimulationState.IDLE);
            assertThat(sink.size()).isZero();
        }

        @Test
        @DisplayName("should use the configured defaults")
        void shouldRunWithDefaults() {
            SimulationDriver driver = SimulationDriver.builder()
                    .dispatcher(dispatcher(3).build())
                    .numPlayers(6)
                    .ringBufferSize(16)
                    .build();

            SimulationSummary summary = driver.run();

            assertThat(summary.requested()).isEqualTo(6);
            assertThat(summary.dispatched()).isEqualTo(6);
        }

        @Test
        @DisplayName("should wait between player arrivals")
        void shouldWaitBetweenArrivals() {
            List<Duration> arrivals = new CopyOnWriteArrayList<>();
            SimulationDriver driver = SimulationDriver.builder()
                    .dispatcher(dispatcher(3).build())
                    .arrivalInterval(Duration.ofMillis(5))
                    .arrivalSleeper(arrivals::add)
                    .ringBufferSize(16)
                    .build();

            driver.run(4, 2);

            assertThat(arrivals).hasSize(3).containsOnly(Duration.ofMillis(5));
        }
    }
}
