package fr.lapetina.gamelb.infrastructure.metrics;

import fr.lapetina.gamelb.domain.exception.SinkWriteException;
import fr.lapetina.gamelb.domain.model.MetricsRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricsSinkTest {

    private MetricsSink sink;

    @BeforeEach
    void setUp() {
        sink = new MetricsSink(Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        sink.close();
    }

    private static MetricsRecord record(String playerId) {
        Instant now = Instant.now();
        return new MetricsRecord(playerId, "Game_Server_1", 0, now, now, 1.0);
    }

    @Nested
    @DisplayName("Append and drain")
    class AppendTests {

        @Test
        @DisplayName("should keep records in append order")
        void shouldKeepAppendOrder() {
            sink.append(record("1"));
            sink.append(record("2"));
            sink.append(record("3"));

            assertThat(sink.drain())
                    .extracting(MetricsRecord::playerId)
                    .containsExactly("1", "2", "3");
            assertThat(sink.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("should return equal lists when drained twice")
        void shouldDrainIdempotently() {
            sink.append(record("1"));
            sink.append(record("2"));

            List<MetricsRecord> first = sink.drain();
            List<MetricsRecord> second = sink.drain();

            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("should return an immutable copy")
        void shouldReturnImmutableCopy() {
            sink.append(record("1"));
            List<MetricsRecord> drained = sink.drain();

            sink.append(record("2"));

            assertThat(drained).hasSize(1);
            assertThatThrownBy(() -> drained.add(record("3")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("should be empty when nothing was appended")
        void shouldStartEmpty() {
            assertThat(sink.drain()).isEmpty();
            assertThat(sink.size()).isZero();
        }

        @Test
        @DisplayName("should not lose records under concurrent appends")
        void shouldNotLoseConcurrentAppends() throws InterruptedException {
            int threads = 10;
            int perThread = 200;
            CountDownLatch latch = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);

            for (int t = 0; t < threads; t++) {
                int thread = t;
                executor.submit(() -> {
                    try {
                        for (int i = 0; i < perThread; i++) {
                            sink.append(record(thread + "-" + i));
                        }
                    } finally {
                        latch.countDown();
                    }
                });
            }

            // Drain concurrently with the writers
            while (latch.getCount() > 0) {
                assertThat(sink.drain().size()).isLessThanOrEqualTo(threads * perThread);
            }
            latch.await();
            executor.shutdown();

            List<MetricsRecord> records = sink.drain();
            assertThat(records).hasSize(threads * perThread);
            assertThat(records).extracting(MetricsRecord::playerId).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("Write failures")
    class FailureTests {

        @Test
        @DisplayName("should reject appends after close")
        void shouldRejectAfterClose() {
            sink.append(record("1"));
            sink.close();

            assertThatThrownBy(() -> sink.append(record("2")))
                    .isInstanceOf(SinkWriteException.class)
                    .hasMessageContaining("closed");
            assertThat(sink.isClosed()).isTrue();
            assertThat(sink.drain()).hasSize(1);
        }

        @Test
        @DisplayName("should fail the append when the caller is interrupted")
        void shouldFailWhenInterrupted() {
            Thread.currentThread().interrupt();
            try {
                assertThatThrownBy(() -> sink.append(record("1")))
                        .isInstanceOf(SinkWriteException.class)
                        .hasCauseInstanceOf(InterruptedException.class);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
            assertThat(sink.size()).isZero();
        }

        @Test
        @DisplayName("should reject a non-positive append timeout")
        void shouldRejectInvalidTimeout() {
            assertThatThrownBy(() -> new MetricsSink(Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Flush")
    class FlushTests {

        @Test
        @DisplayName("should hand every record to every exporter")
        void shouldExportToAllExporters() {
            List<MetricsRecord> first = new ArrayList<>();
            List<MetricsRecord> second = new ArrayList<>();
            sink.addExporter(new CollectingExporter(first));
            sink.addExporter(new CollectingExporter(second));
            sink.append(record("1"));
            sink.append(record("2"));

            sink.flush();

            assertThat(first).extracting(MetricsRecord::playerId).containsExactly("1", "2");
            assertThat(second).isEqualTo(first);
            assertThat(sink.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should wrap exporter I/O failures")
        void shouldWrapExporterFailure() {
            sink.addExporter(new MetricsExporter() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public void export(List<MetricsRecord> records) throws IOException {
                    throw new IOException("disk full");
                }
            });
            sink.append(record("1"));

            assertThatThrownBy(() -> sink.flush())
                    .isInstanceOf(SinkWriteException.class)
                    .hasMessageContaining("broken")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("should let appends proceed while a slow exporter runs")
        void shouldNotBlockAppendsDuringExport() throws Exception {
            CountDownLatch exporting = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            sink.addExporter(new MetricsExporter() {
                @Override
                public String getName() {
                    return "slow";
                }

                @Override
                public void export(List<MetricsRecord> records) {
                    exporting.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            });
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                executor.submit(() -> sink.flush());
                assertThat(exporting.await(5, TimeUnit.SECONDS)).isTrue();

                sink.append(record("late"));

                assertThat(sink.size()).isEqualTo(1);
            } finally {
                release.countDown();
                executor.shutdown();
            }
        }
    }

    private record CollectingExporter(List<MetricsRecord> target) implements MetricsExporter {

        @Override
        public String getName() {
            return "collecting";
        }

        @Override
        public void export(List<MetricsRecord> records) {
            target.addAll(records);
        }
    }
}
