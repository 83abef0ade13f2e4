package com.instruments.core.registry;

import com.instruments.api.Work;
import com.instruments.api.exceptions.MetricReleasedException;
import com.instruments.api.model.EventMetric;
import com.instruments.api.model.GaugeMetric;
import com.instruments.api.model.MetricsSnapshot;
import com.instruments.api.model.WorkMetric;
import com.instruments.core.config.InstrumentsConfig;
import com.instruments.core.metrics.ManualClock;
import com.instruments.core.work.DisabledWork;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MetricsRegistryTest {

    private ManualClock clock;
    private MetricsRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        registry = MetricsRegistry.builder()
                .config(InstrumentsConfig.inMemory())
                .clock(clock)
                .build();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    // ========================================================================
    // WORK
    // ========================================================================

    @Nested
    @DisplayName("Work metrics")
    class WorkMetrics {

        @Test
        @DisplayName("Unknown label yields a zero snapshot without creating an entry")
        void unknownLabel() {
            WorkMetric metric = registry.getWorkMetric("never.seen");

            assertThat(metric).isEqualTo(WorkMetric.empty("never.seen"));
            assertThat(registry.hasWorkMetric("never.seen")).isFalse();
        }

        @Test
        @DisplayName("newWork materializes the entry before any start")
        void newWorkCreatesEntry() {
            registry.newWork("db.query");

            assertThat(registry.hasWorkMetric("db.query")).isTrue();
            assertThat(registry.getWorkMetric("db.query").opsCount()).isZero();
        }

        @Test
        @DisplayName("Start and stop record the elapsed milliseconds")
        void startStopRecordsElapsed() {
            Work work = registry.newWork("db.query");

            work.start();
            clock.advance(Duration.ofMillis(25));
            long elapsed = work.stop();

            WorkMetric metric = registry.getWorkMetric("db.query");
            assertThat(elapsed).isEqualTo(25);
            assertThat(metric.opsCount()).isEqualTo(1);
            assertThat(metric.min()).isEqualTo(25);
            assertThat(metric.max()).isEqualTo(25);
            assertThat(metric.meanTime()).isEqualTo(25.0);
            assertThat(metric.active()).isZero();
            assertThat(work.startTime()).isPresent();
            assertThat(work.stopTime().getAsLong() - work.startTime().getAsLong()).isEqualTo(25);
        }

        @Test
        @DisplayName("Active count follows starts and stops")
        void activeCounter() {
            List<Work> works = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                Work work = registry.newWork("jobs");
                work.start();
                works.add(work);
            }
            assertThat(registry.getWorkMetric("jobs").active()).isEqualTo(10);

            for (int i = 0; i < 4; i++) {
                works.get(i).stop();
            }
            assertThat(registry.getWorkMetric("jobs").active()).isEqualTo(6);

            for (int i = 4; i < 10; i++) {
                works.get(i).stop();
            }
            assertThat(registry.getWorkMetric("jobs").active()).isZero();
            assertThat(registry.getWorkMetric("jobs").opsCount()).isEqualTo(10);
        }

        @Test
        @DisplayName("Errors are counted and still timed")
        void errorsCounted() {
            Work ok = registry.newWork("rpc");
            ok.start();
            ok.stop(false);

            for (int i = 0; i < 3; i++) {
                Work failed = registry.newWork("rpc");
                failed.start();
                failed.stop(true);
            }

            WorkMetric metric = registry.getWorkMetric("rpc");
            assertThat(metric.errors()).isEqualTo(3);
            assertThat(metric.opsCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("Stop before start fails and records nothing")
        void stopBeforeStart() {
            Work work = registry.newWork("early");

            assertThatThrownBy(work::stop).isInstanceOf(IllegalStateException.class);
            assertThat(registry.getWorkMetric("early").opsCount()).isZero();
        }

        @Test
        @DisplayName("measureWork records without touching the active count")
        void measureWork() {
            registry.measureWork("batch", 10);
            registry.measureWork("batch", 30);

            WorkMetric metric = registry.getWorkMetric("batch");
            assertThat(metric.opsCount()).isEqualTo(2);
            assertThat(metric.meanTime()).isEqualTo(20.0);
            assertThat(metric.min()).isEqualTo(10);
            assertThat(metric.max()).isEqualTo(30);
            assertThat(metric.pct50()).isEqualTo(10.0);
            assertThat(metric.pct99()).isEqualTo(30.0);
            assertThat(metric.active()).isZero();
        }

        @Test
        @DisplayName("Identical durations give zero spread")
        void identicalDurations() {
            for (int i = 0; i < 20; i++) {
                registry.measureWork("steady", 15);
            }

            WorkMetric metric = registry.getWorkMetric("steady");
            assertThat(metric.opsCount()).isEqualTo(20);
            assertThat(metric.min()).isEqualTo(15);
            assertThat(metric.max()).isEqualTo(15);
            assertThat(metric.meanTime()).isEqualTo(15.0);
            assertThat(metric.stdDev()).isZero();
        }

        @Test
        @DisplayName("measureWork rejects negative durations")
        void measureWorkNegative() {
            assertThatThrownBy(() -> registry.measureWork("batch", -5))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Standard deviation uses the sample formula")
        void sampleStdDev() {
            registry.measureWork("dist", 2);
            registry.measureWork("dist", 4);
            registry.measureWork("dist", 6);

            assertThat(registry.getWorkMetric("dist").stdDev()).isCloseTo(2.0, within(1e-9));
        }
    }

    // ========================================================================
    // EVENTS & GAUGES
    // ========================================================================

    @Nested
    @DisplayName("Event metrics")
    class EventMetrics {

        @Test
        @DisplayName("Counts every recorded event")
        void countsEvents() {
            for (int i = 0; i < 10; i++) {
                registry.recordEvent("test.event");
            }

            EventMetric metric = registry.getEventMetric("test.event");
            assertThat(metric.count()).isEqualTo(10);
            assertThat(metric.label()).isEqualTo("test.event");
        }

        @Test
        @DisplayName("Explicit counts add up; zero counts as one")
        void explicitCounts() {
            registry.recordEvent("hits", 5);
            registry.recordEvent("hits", 0);

            assertThat(registry.getEventMetric("hits").count()).isEqualTo(6);
        }

        @Test
        @DisplayName("Negative counts are rejected")
        void negativeCount() {
            assertThatThrownBy(() -> registry.recordEvent("hits", -1))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(registry.hasEventMetric("hits")).isFalse();
        }

        @Test
        @DisplayName("Mean rate is count over elapsed time")
        void meanRate() {
            registry.recordEvent("ticks", 1);
            clock.advance(Duration.ofSeconds(4));
            registry.recordEvent("ticks", 7);

            assertThat(registry.getEventMetric("ticks").rateMean()).isCloseTo(2.0, within(1e-9));
        }

        @Test
        @DisplayName("Unknown label yields zeros")
        void unknownLabel() {
            assertThat(registry.getEventMetric("none")).isEqualTo(EventMetric.empty("none"));
        }
    }

    @Nested
    @DisplayName("Gauges")
    class Gauges {

        @Test
        @DisplayName("Last write wins")
        void lastWriteWins() {
            registry.setGauge("pool.size", 4);
            registry.setGauge("pool.size", 8.5);

            assertThat(registry.getGaugeMetric("pool.size")).isEqualTo(new GaugeMetric("pool.size", 8.5));
        }

        @Test
        @DisplayName("Release drops the gauge")
        void release() {
            registry.setGauge("pool.size", 4);

            registry.releaseGauge("pool.size");

            assertThat(registry.hasGaugeMetric("pool.size")).isFalse();
            assertThat(registry.getGaugeMetric("pool.size").value()).isZero();
        }
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Nested
    @DisplayName("Listing and finding")
    class Queries {

        @BeforeEach
        void populate() {
            registry.recordEvent("test.event");
            registry.recordEvent("test.event.1");
            registry.recordEvent("test.event.2");
            registry.recordEvent("other.event");
            registry.measureWork("foo.bar.tex", 1);
            registry.measureWork("foo.bike.tex", 1);
            registry.measureWork("foo.bar.baz", 1);
            registry.setGauge("pool.size", 1);
        }

        @Test
        @DisplayName("Wildcard suffix matches the prefix itself and its children")
        void findEvents() {
            assertThat(registry.findEventMetrics("test.event.*"))
                    .containsExactlyInAnyOrder("test.event", "test.event.1", "test.event.2");
            assertThat(registry.findEventMetrics("test.event"))
                    .containsExactly("test.event");
        }

        @Test
        @DisplayName("Inner wildcard matches one segment")
        void findWork() {
            assertThat(registry.findWorkMetrics("foo.*.tex"))
                    .containsExactlyInAnyOrder("foo.bar.tex", "foo.bike.tex");
            assertThat(registry.findWorkMetrics("foo.*"))
                    .containsExactlyInAnyOrder("foo.bar.tex", "foo.bike.tex", "foo.bar.baz");
        }

        @Test
        @DisplayName("Gauge wildcards match per segment")
        void findGauges() {
            registry.setGauge("foo.bar.tex", 1);
            registry.setGauge("foo.bike.tex", 2);

            assertThat(registry.findGaugeMetrics("foo.*.tex"))
                    .containsExactlyInAnyOrder("foo.bar.tex", "foo.bike.tex");
            assertThat(registry.findGaugeMetrics("foo.bar.*")).containsExactly("foo.bar.tex");
        }

        @Test
        @DisplayName("Find searches only its own category")
        void categoriesAreSeparate() {
            assertThat(registry.findGaugeMetrics("*")).containsExactly("pool.size");
            assertThat(registry.findWorkMetrics("test.*")).isEmpty();
        }

        @Test
        @DisplayName("getMetrics returns every category")
        void snapshot() {
            MetricsSnapshot snapshot = registry.getMetrics();

            assertThat(snapshot.work()).extracting(WorkMetric::label)
                    .containsExactlyInAnyOrder("foo.bar.tex", "foo.bike.tex", "foo.bar.baz");
            assertThat(snapshot.events()).hasSize(4);
            assertThat(snapshot.gauges()).containsExactly(new GaugeMetric("pool.size", 1));
        }
    }

    // ========================================================================
    // RELEASE & SHUTDOWN
    // ========================================================================

    @Nested
    @DisplayName("Release and shutdown")
    class ReleaseAndShutdown {

        @Test
        @DisplayName("Releasing work cancels both tick schedules")
        void releaseWorkCancelsTicks() {
            registry.newWork("db.query");
            WorkEntry entry = registry.workEntry("db.query");

            registry.releaseWork("db.query");

            assertThat(entry.timerTick().isCancelled()).isTrue();
            assertThat(entry.errorTick().isCancelled()).isTrue();
            assertThat(registry.hasWorkMetric("db.query")).isFalse();
        }

        @Test
        @DisplayName("Releasing an event cancels its tick schedule")
        void releaseEventCancelsTick() {
            registry.recordEvent("cache.miss");
            EventEntry entry = registry.eventEntry("cache.miss");

            registry.releaseEvent("cache.miss");

            assertThat(entry.tick().isCancelled()).isTrue();
            assertThat(registry.getEventMetric("cache.miss").count()).isZero();
        }

        @Test
        @DisplayName("Releasing unknown labels is a no-op")
        void releaseUnknown() {
            registry.releaseWork("nope");
            registry.releaseEvent("nope");
            registry.releaseGauge("nope");

            assertThat(registry.getMetrics()).isEqualTo(MetricsSnapshot.empty());
        }

        @Test
        @DisplayName("In-flight work fails fast once its label is released")
        void inFlightAfterRelease() {
            Work work = registry.newWork("db.query");
            work.start();

            registry.releaseWork("db.query");

            assertThatThrownBy(work::stop)
                    .isInstanceOf(MetricReleasedException.class)
                    .hasMessageContaining("db.query");
        }

        @Test
        @DisplayName("A recreated label starts from zero")
        void recreatedLabel() {
            registry.measureWork("db.query", 5);
            registry.releaseWork("db.query");

            registry.measureWork("db.query", 7);

            assertThat(registry.getWorkMetric("db.query").opsCount()).isEqualTo(1);
            assertThat(registry.getWorkMetric("db.query").max()).isEqualTo(7);
        }

        @Test
        @DisplayName("Shutdown empties every category and runs the callback each time")
        void shutdownTwice() {
            registry.measureWork("w", 1);
            registry.recordEvent("e");
            registry.setGauge("g", 1);
            WorkEntry work = registry.workEntry("w");
            EventEntry event = registry.eventEntry("e");
            AtomicInteger callbacks = new AtomicInteger();

            registry.shutdown(callbacks::incrementAndGet);
            registry.shutdown(callbacks::incrementAndGet);
            registry.shutdown();

            assertThat(callbacks).hasValue(2);
            assertThat(registry.getMetrics()).isEqualTo(MetricsSnapshot.empty());
            assertThat(work.timerTick().isCancelled()).isTrue();
            assertThat(event.tick().isCancelled()).isTrue();
        }

        @Test
        @DisplayName("Recording after close stays in memory and never throws")
        void recordingAfterClose() {
            registry.close();

            registry.recordEvent("after.close");
            registry.measureWork("after.close", 3);
            Work work = registry.newWork("after.close.work");
            work.start();
            clock.advance(Duration.ofMillis(4));
            work.stop();

            assertThat(registry.getEventMetric("after.close").count()).isEqualTo(1);
            assertThat(registry.getWorkMetric("after.close").max()).isEqualTo(3);
            assertThat(registry.getWorkMetric("after.close.work").max()).isEqualTo(4);
            assertThat(registry.eventEntry("after.close").tick().isCancelled()).isTrue();
        }

        @Test
        @DisplayName("Registry stays usable after shutdown")
        void usableAfterShutdown() {
            registry.shutdown();

            registry.recordEvent("again");

            assertThat(registry.getEventMetric("again").count()).isEqualTo(1);
        }
    }

    // ========================================================================
    // DISABLED INSTRUMENTATION
    // ========================================================================

    @Test
    @DisplayName("Disabled instrumentation hands out DisabledWork and records nothing")
    void disabledInstrumentation() {
        try (MetricsRegistry disabled = MetricsRegistry.builder()
                .config(InstrumentsConfig.disabled())
                .clock(clock)
                .build()) {

            Work work = disabled.newWork("quiet");
            work.start();
            clock.advance(Duration.ofMillis(50));

            assertThat(work).isInstanceOf(DisabledWork.class);
            assertThat(work.stop()).isZero();
            assertThat(work.startTime()).isEmpty();
            assertThat(disabled.hasWorkMetric("quiet")).isFalse();
            assertThat(disabled.getWorkMetric("quiet")).isEqualTo(WorkMetric.empty("quiet"));
        }
    }

    @Test
    @DisplayName("Independent registries do not share state")
    void independentRegistries() {
        try (MetricsRegistry other = MetricsRegistry.builder()
                .config(InstrumentsConfig.inMemory())
                .clock(clock)
                .build()) {

            registry.recordEvent("shared.name");

            assertThat(other.hasEventMetric("shared.name")).isFalse();
        }
    }
}
