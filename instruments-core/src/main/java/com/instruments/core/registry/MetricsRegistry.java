package com.instruments.core.registry;

import com.codahale.metrics.Clock;
import com.instruments.api.LabelMatcher;
import com.instruments.api.Sink;
import com.instruments.api.SinkErrorListener;
import com.instruments.api.Work;
import com.instruments.api.exceptions.MetricReleasedException;
import com.instruments.api.model.EventMetric;
import com.instruments.api.model.GaugeMetric;
import com.instruments.api.model.MetricsSnapshot;
import com.instruments.api.model.WorkMetric;
import com.instruments.core.config.InstrumentsConfig;
import com.instruments.core.match.GlobLabelMatcher;
import com.instruments.core.metrics.Counter;
import com.instruments.core.metrics.Meter;
import com.instruments.core.metrics.Timer;
import com.instruments.core.sink.LoggingSinkErrorListener;
import com.instruments.core.sink.StatsdSink;
import com.instruments.core.work.DisabledWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Label-keyed store of work, event and gauge metrics.
 *
 * <p>The registry is the only owner of {@link Counter}, {@link Meter} and
 * {@link Timer} instances. Entries are created lazily on the first record
 * call for a label and live until released. Every meter's tick schedule is
 * created here and cancelled here, in {@link #releaseWork(String)},
 * {@link #releaseEvent(String)} and {@link #shutdown()}.
 *
 * <p>Each record call updates memory synchronously and then hands the update
 * to the active {@link Sink}; the returned future reports the hand-off and
 * may be ignored. Queries never touch the sink, never block on it, and never
 * fail: an unknown label yields a zero-valued snapshot.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * try (MetricsRegistry registry = MetricsRegistry.create(InstrumentsConfig.loadDefault())) {
 *     Work work = registry.newWork("db.query");
 *     work.start();
 *     runQuery();
 *     work.stop();
 *
 *     registry.recordEvent("cache.miss");
 *     registry.setGauge("pool.size", 8);
 *
 *     WorkMetric metric = registry.getWorkMetric("db.query");
 * }
 * }</pre>
 *
 * <p>Thread-safe. Multiple independent registries may coexist.
 *
 * @since 2.0.0
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MetricsRegistry.class);

    static final double[] PERCENTILES = {0.01, 0.25, 0.5, 0.75, 0.99, 0.999};
    static final String ERROR_SUFFIX = "__error";

    private final Map<String, WorkEntry> workMetrics = new ConcurrentHashMap<>();
    private final Map<String, EventEntry> eventMetrics = new ConcurrentHashMap<>();
    private final Map<String, Double> gauges = new ConcurrentHashMap<>();

    private final InstrumentsConfig config;
    private final Clock clock;
    private final LabelMatcher labelMatcher;
    private final SinkErrorListener sinkErrorListener;
    private final ScheduledExecutorService tickExecutor;
    private final boolean ownsTickExecutor;
    private final TickScheduler ticks;
    private final SinkSlot sinkSlot = new SinkSlot();

    private MetricsRegistry(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.labelMatcher = builder.labelMatcher;
        this.sinkErrorListener = builder.sinkErrorListener;
        if (builder.tickExecutor != null) {
            this.tickExecutor = builder.tickExecutor;
            this.ownsTickExecutor = false;
        } else {
            this.tickExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "Metrics-Tick");
                t.setDaemon(true);
                return t;
            });
            this.ownsTickExecutor = true;
        }
        this.ticks = new TickScheduler(tickExecutor);

        config.getStatsdPort().ifPresent(port -> configureSink(port, config.getStatsdHost()));
        logger.info("Metrics registry created: {}", config);
    }

    /**
     * Creates a registry from defaults and {@code INSTRUMENTS_*} environment variables.
     */
    public static MetricsRegistry create() {
        return create(InstrumentsConfig.fromEnvironment());
    }

    public static MetricsRegistry create(InstrumentsConfig config) {
        return builder().config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // RECORDING
    // ========================================================================

    /**
     * Creates a work tracker for {@code label}. With instrumentation enabled
     * the label's entry is materialized now; with it disabled a
     * {@link DisabledWork} is returned and nothing is recorded.
     */
    public Work newWork(String label) {
        if (!config.isInstrumentationEnabled()) {
            return new DisabledWork(label);
        }
        ensureWorkEntry(label);
        return new TrackedWork(this, label);
    }

    /**
     * Records a pre-measured duration, bypassing the active counter.
     *
     * @param label          work label
     * @param durationMillis elapsed milliseconds, not negative
     * @return completion of the hand-off to the sink
     */
    public CompletableFuture<Void> measureWork(String label, long durationMillis) {
        ensureWorkEntry(label).timer.update(durationMillis);
        return sink().incrementTimer(label, durationMillis);
    }

    public CompletableFuture<Void> recordEvent(String label) {
        return recordEvent(label, 1);
    }

    /**
     * Records {@code count} occurrences of an event. A count of 0 counts as 1.
     *
     * @throws IllegalArgumentException if count is negative
     */
    public CompletableFuture<Void> recordEvent(String label, long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Event count cannot be negative: " + count);
        }
        long occurrences = count == 0 ? 1 : count;
        ensureEventEntry(label).meter.mark(occurrences);
        return sink().incrementCounter(label, occurrences);
    }

    public CompletableFuture<Void> setGauge(String label, double value) {
        gauges.put(label, value);
        return sink().setGauge(label, value);
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public WorkMetric getWorkMetric(String label) {
        WorkEntry entry = workMetrics.get(label);
        if (entry == null) {
            return WorkMetric.empty(label);
        }

        Timer timer = entry.timer;
        Meter errors = entry.errorMeter;
        double[] pct = timer.percentiles(PERCENTILES);
        return new WorkMetric(
                label,
                timer.count(),
                timer.oneMinuteRate(),
                timer.fiveMinuteRate(),
                timer.fifteenMinuteRate(),
                timer.meanRate(),
                timer.min(),
                timer.max(),
                timer.mean(),
                timer.stdDev(),
                pct[0], pct[1], pct[2], pct[3], pct[4], pct[5],
                entry.active.count(),
                errors.count(),
                errors.oneMinuteRate(),
                errors.fiveMinuteRate(),
                errors.fifteenMinuteRate(),
                errors.meanRate());
    }

    public EventMetric getEventMetric(String label) {
        EventEntry entry = eventMetrics.get(label);
        if (entry == null) {
            return EventMetric.empty(label);
        }
        Meter meter = entry.meter;
        return new EventMetric(
                label,
                meter.count(),
                meter.oneMinuteRate(),
                meter.fiveMinuteRate(),
                meter.fifteenMinuteRate(),
                meter.meanRate());
    }

    public GaugeMetric getGaugeMetric(String label) {
        Double value = gauges.get(label);
        return value == null ? GaugeMetric.empty(label) : new GaugeMetric(label, value);
    }

    public List<WorkMetric> getWorkMetrics() {
        List<WorkMetric> metrics = new ArrayList<>();
        for (String label : workMetrics.keySet()) {
            metrics.add(getWorkMetric(label));
        }
        return metrics;
    }

    public List<EventMetric> getEventMetrics() {
        List<EventMetric> metrics = new ArrayList<>();
        for (String label : eventMetrics.keySet()) {
            metrics.add(getEventMetric(label));
        }
        return metrics;
    }

    public List<GaugeMetric> getGaugeMetrics() {
        List<GaugeMetric> metrics = new ArrayList<>();
        for (String label : gauges.keySet()) {
            metrics.add(getGaugeMetric(label));
        }
        return metrics;
    }

    /**
     * All metrics of all categories. Walks every entry; prefer the specific
     * getters when the label is known.
     */
    public MetricsSnapshot getMetrics() {
        return new MetricsSnapshot(getWorkMetrics(), getEventMetrics(), getGaugeMetrics());
    }

    public List<String> findWorkMetrics(String pattern) {
        return labelMatcher.match(pattern, List.copyOf(workMetrics.keySet()));
    }

    public List<String> findEventMetrics(String pattern) {
        return labelMatcher.match(pattern, List.copyOf(eventMetrics.keySet()));
    }

    public List<String> findGaugeMetrics(String pattern) {
        return labelMatcher.match(pattern, List.copyOf(gauges.keySet()));
    }

    public boolean hasWorkMetric(String label) {
        return workMetrics.containsKey(label);
    }

    public boolean hasEventMetric(String label) {
        return eventMetrics.containsKey(label);
    }

    public boolean hasGaugeMetric(String label) {
        return gauges.containsKey(label);
    }

    // ========================================================================
    // RELEASE & SHUTDOWN
    // ========================================================================

    /**
     * Cancels the tick schedules of the label's timer and error meter, then
     * drops the entry. Unknown labels are ignored.
     */
    public void releaseWork(String label) {
        WorkEntry entry = workMetrics.get(label);
        if (entry == null) {
            return;
        }
        entry.cancelTicks();
        workMetrics.remove(label, entry);
        logger.debug("Released work metric '{}'", label);
    }

    /**
     * Cancels the label's meter tick schedule, then drops the entry.
     * Unknown labels are ignored.
     */
    public void releaseEvent(String label) {
        EventEntry entry = eventMetrics.get(label);
        if (entry == null) {
            return;
        }
        entry.cancelTicks();
        eventMetrics.remove(label, entry);
        logger.debug("Released event metric '{}'", label);
    }

    public void releaseGauge(String label) {
        gauges.remove(label);
    }

    public void shutdown() {
        shutdown(null);
    }

    /**
     * Releases every entry, replaces the sink with the no-op sink (closing
     * the current one) and then runs {@code callback}. Safe to call any number
     * of times.
     *
     * @param callback run after shutdown; may be null
     */
    public void shutdown(Runnable callback) {
        int work = workMetrics.size();
        int events = eventMetrics.size();
        int gaugeCount = gauges.size();

        for (String label : List.copyOf(workMetrics.keySet())) {
            releaseWork(label);
        }
        for (String label : List.copyOf(eventMetrics.keySet())) {
            releaseEvent(label);
        }
        for (String label : List.copyOf(gauges.keySet())) {
            releaseGauge(label);
        }

        configureSink();

        logger.info("Metrics registry shut down ({} work, {} event, {} gauge metrics released)",
                work, events, gaugeCount);

        Runnable done = callback != null ? callback : () -> { };
        done.run();
    }

    /**
     * Shuts down and stops the tick executor if this registry created it.
     */
    @Override
    public void close() {
        shutdown();
        if (ownsTickExecutor) {
            tickExecutor.shutdownNow();
        }
    }

    // ========================================================================
    // SINK CONFIGURATION
    // ========================================================================

    /**
     * Disables forwarding.
     */
    public Sink configureSink() {
        return configureSink(null, null);
    }

    /**
     * Forwards updates to a StatsD collector, or disables forwarding when
     * {@code port} is null. The current sink is closed first.
     *
     * @param port UDP port, or null to install the no-op sink
     * @param host target host, {@code localhost} when null
     * @return the newly active sink
     */
    public Sink configureSink(Integer port, String host) {
        if (port == null) {
            return sinkSlot.swap(null);
        }
        String target = host != null ? host : InstrumentsConfig.DEFAULT_STATSD_HOST;
        return sinkSlot.swap(new StatsdSink(target, port, sinkErrorListener));
    }

    /**
     * Installs a caller-supplied sink. The current sink is closed first.
     */
    public Sink configureSink(Sink sink) {
        return sinkSlot.swap(sink);
    }

    public Sink activeSink() {
        return sinkSlot.get();
    }

    public InstrumentsConfig config() {
        return config;
    }

    // ========================================================================
    // INTERNAL
    // ========================================================================

    Sink sink() {
        return sinkSlot.get();
    }

    Clock clock() {
        return clock;
    }

    WorkEntry workEntry(String label) {
        return workMetrics.get(label);
    }

    EventEntry eventEntry(String label) {
        return eventMetrics.get(label);
    }

    WorkEntry requireWorkEntry(String label) {
        WorkEntry entry = workMetrics.get(label);
        if (entry == null) {
            throw new MetricReleasedException(label);
        }
        return entry;
    }

    static String errorLabel(String label) {
        return label + ERROR_SUFFIX;
    }

    private WorkEntry ensureWorkEntry(String label) {
        return workMetrics.computeIfAbsent(label, key -> new WorkEntry(
                new Counter(),
                new Timer(clock, config.getTickInterval(), config.getReservoirSize(), config.getReservoirAlpha()),
                new Meter(clock, config.getTickInterval()),
                ticks));
    }

    private EventEntry ensureEventEntry(String label) {
        return eventMetrics.computeIfAbsent(label, key -> new EventEntry(
                new Meter(clock, config.getTickInterval()),
                ticks));
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {

        private InstrumentsConfig config;
        private Clock clock = Clock.defaultClock();
        private LabelMatcher labelMatcher = new GlobLabelMatcher();
        private SinkErrorListener sinkErrorListener = LoggingSinkErrorListener.INSTANCE;
        private ScheduledExecutorService tickExecutor;

        private Builder() {
        }

        public Builder config(InstrumentsConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder labelMatcher(LabelMatcher labelMatcher) {
            this.labelMatcher = labelMatcher;
            return this;
        }

        public Builder sinkErrorListener(SinkErrorListener listener) {
            this.sinkErrorListener = listener;
            return this;
        }

        /**
         * Runs meter ticks on a caller-owned executor. The registry will not
         * shut it down.
         */
        public Builder tickExecutor(ScheduledExecutorService executor) {
            this.tickExecutor = executor;
            return this;
        }

        public MetricsRegistry build() {
            if (config == null) {
                config = InstrumentsConfig.fromEnvironment();
            }
            if (clock == null) {
                throw new IllegalArgumentException("Clock cannot be null");
            }
            if (labelMatcher == null) {
                throw new IllegalArgumentException("Label matcher cannot be null");
            }
            if (sinkErrorListener == null) {
                sinkErrorListener = LoggingSinkErrorListener.INSTANCE;
            }
            return new MetricsRegistry(this);
        }
    }
}
