package com.instruments.core.registry;

import com.instruments.api.Sink;
import com.instruments.api.Work;
import com.instruments.core.config.InstrumentsConfig;
import com.instruments.core.metrics.ManualClock;
import com.instruments.core.sink.NullSink;
import com.instruments.core.sink.StatsdSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SinkForwardingTest {

    @Mock
    private Sink sink;

    private ManualClock clock;
    private MetricsRegistry registry;

    @BeforeEach
    void setUp() {
        CompletableFuture<Void> done = CompletableFuture.completedFuture(null);
        lenient().when(sink.incrementCounter(anyString(), anyLong())).thenReturn(done);
        lenient().when(sink.incrementTimer(anyString(), anyLong())).thenReturn(done);
        lenient().when(sink.setGauge(anyString(), anyDouble())).thenReturn(done);

        clock = new ManualClock();
        registry = MetricsRegistry.builder()
                .config(InstrumentsConfig.inMemory())
                .clock(clock)
                .build();
        registry.configureSink(sink);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    @DisplayName("Successful work forwards its duration as a timer")
    void workForwardsTimer() {
        Work work = registry.newWork("db.query");
        work.start();
        clock.advance(Duration.ofMillis(12));
        work.stop();

        verify(sink).incrementTimer("db.query", 12);
        verify(sink, never()).incrementCounter(anyString(), anyLong());
    }

    @Test
    @DisplayName("Failed work forwards a counter on the error label")
    void errorForwardsCounter() {
        Work work = registry.newWork("db.query");
        work.start();
        work.stop(true);

        verify(sink).incrementCounter("db.query__error", 1);
        verify(sink, never()).incrementTimer(anyString(), anyLong());
    }

    @Test
    @DisplayName("Events, gauges and measured work are forwarded")
    void recordsForwarded() {
        registry.recordEvent("cache.miss", 3);
        registry.setGauge("pool.size", 8);
        registry.measureWork("batch", 40);

        verify(sink).incrementCounter("cache.miss", 3);
        verify(sink).setGauge("pool.size", 8.0);
        verify(sink).incrementTimer("batch", 40);
    }

    @Test
    @DisplayName("Record calls return the sink's future")
    void returnsSinkFuture() {
        assertThat(registry.recordEvent("cache.miss")).isCompleted();
    }

    @Test
    @DisplayName("Queries never reach the sink")
    void queriesStayLocal() {
        registry.getMetrics();
        registry.getWorkMetric("x");
        registry.findEventMetrics("*");

        verifyNoInteractions(sink);
    }

    @Test
    @DisplayName("Reconfiguring closes the previous sink")
    void reconfigureClosesPrevious() {
        registry.configureSink();

        verify(sink).close();
        assertThat(registry.activeSink()).isSameAs(NullSink.INSTANCE);
    }

    @Test
    @DisplayName("Shutdown closes the sink and falls back to the no-op sink")
    void shutdownClosesSink() {
        registry.shutdown();

        verify(sink).close();
        assertThat(registry.activeSink()).isSameAs(NullSink.INSTANCE);
    }

    @Test
    @DisplayName("Port and host configure a StatsD sink, localhost by default")
    void configureStatsd() {
        Sink active = registry.configureSink(8125, null);

        assertThat(active).isInstanceOf(StatsdSink.class);
        assertThat(((StatsdSink) active).target().getHostString()).isEqualTo("localhost");
        assertThat(((StatsdSink) active).target().getPort()).isEqualTo(8125);
        verify(sink).close();
    }
}
