package com.instruments.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration for a {@link com.instruments.core.registry.MetricsRegistry}.
 *
 * <p><b>Resolution order</b> (later wins):
 * <ol>
 *   <li>Built-in defaults</li>
 *   <li>Properties file ({@link #loadFromProperties(String)})</li>
 *   <li>Environment variables {@code INSTRUMENTS_<PROPERTY_NAME>}</li>
 *   <li>Explicit builder calls</li>
 * </ol>
 *
 * <p>Example environment variables:
 * <pre>
 * INSTRUMENTS_ENABLED=true
 * INSTRUMENTS_STATSD_HOST=statsd.internal
 * INSTRUMENTS_STATSD_PORT=8125
 * INSTRUMENTS_TICK_INTERVAL_SECONDS=5
 * INSTRUMENTS_RESERVOIR_SIZE=1028
 * INSTRUMENTS_RESERVOIR_ALPHA=0.015
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // In-memory only, no forwarding
 * InstrumentsConfig config = InstrumentsConfig.inMemory();
 *
 * // Forward to a local StatsD daemon
 * InstrumentsConfig config = InstrumentsConfig.builder()
 *     .statsdHost("localhost")
 *     .statsdPort(8125)
 *     .build();
 *
 * MetricsRegistry registry = MetricsRegistry.create(config);
 * }</pre>
 *
 * @since 2.0.0
 */
public final class InstrumentsConfig {

    private static final Logger logger = LoggerFactory.getLogger(InstrumentsConfig.class);

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    private static final String ENV_ENABLED = "INSTRUMENTS_ENABLED";
    private static final String ENV_STATSD_HOST = "INSTRUMENTS_STATSD_HOST";
    private static final String ENV_STATSD_PORT = "INSTRUMENTS_STATSD_PORT";
    private static final String ENV_TICK_INTERVAL_SECONDS = "INSTRUMENTS_TICK_INTERVAL_SECONDS";
    private static final String ENV_RESERVOIR_SIZE = "INSTRUMENTS_RESERVOIR_SIZE";
    private static final String ENV_RESERVOIR_ALPHA = "INSTRUMENTS_RESERVOIR_ALPHA";

    // ========================================================================
    // PROPERTY KEYS
    // ========================================================================

    static final String PROP_ENABLED = "instruments.enabled";
    static final String PROP_STATSD_HOST = "instruments.statsd.host";
    static final String PROP_STATSD_PORT = "instruments.statsd.port";
    static final String PROP_TICK_INTERVAL_SECONDS = "instruments.tick.interval.seconds";
    static final String PROP_RESERVOIR_SIZE = "instruments.reservoir.size";
    static final String PROP_RESERVOIR_ALPHA = "instruments.reservoir.alpha";

    public static final String DEFAULT_STATSD_HOST = "localhost";
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_RESERVOIR_SIZE = 1028;
    public static final double DEFAULT_RESERVOIR_ALPHA = 0.015;

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final boolean instrumentationEnabled;
    private final String statsdHost;
    private final Integer statsdPort;
    private final Duration tickInterval;
    private final int reservoirSize;
    private final double reservoirAlpha;

    private InstrumentsConfig(Builder builder) {
        this.instrumentationEnabled = builder.instrumentationEnabled;
        this.statsdHost = builder.statsdHost;
        this.statsdPort = builder.statsdPort;
        this.tickInterval = builder.tickInterval;
        this.reservoirSize = builder.reservoirSize;
        this.reservoirAlpha = builder.reservoirAlpha;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * In-memory recording only, no forwarding, ignoring the environment.
     */
    public static InstrumentsConfig inMemory() {
        return new Builder(false).build();
    }

    /**
     * Instrumentation compiled out: every {@code Work} is a no-op.
     */
    public static InstrumentsConfig disabled() {
        return new Builder(false)
                .instrumentationEnabled(false)
                .build();
    }

    /**
     * Defaults overridden by environment variables.
     */
    public static InstrumentsConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Loads {@code instruments.properties} from the classpath root.
     *
     * <p><b>Example instruments.properties:</b>
     * <pre>
     * instruments.enabled=true
     * instruments.statsd.host=localhost
     * instruments.statsd.port=8125
     * instruments.tick.interval.seconds=5
     * instruments.reservoir.size=1028
     * instruments.reservoir.alpha=0.015
     * </pre>
     */
    public static InstrumentsConfig loadDefault() {
        return loadFromProperties("instruments.properties");
    }

    /**
     * Loads configuration from a properties file, looked up on the classpath
     * first and then on the file system. A missing file yields defaults.
     * Environment variables override file values.
     *
     * @param propertiesPath classpath resource or file path
     */
    public static InstrumentsConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading instruments configuration from: {}", propertiesPath);

        Properties props = new Properties();

        try (InputStream is = InstrumentsConfig.class.getClassLoader()
                .getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} properties from classpath: {}", props.size(), propertiesPath);
            }
        } catch (IOException e) {
            logger.debug("Could not load from classpath: {}", propertiesPath, e);
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded {} properties from file: {}", props.size(), propertiesPath);
            } catch (IOException e) {
                logger.warn("Could not load properties file: {}. Using defaults.", propertiesPath);
            }
        }

        return fromProperties(props);
    }

    /**
     * Builds a configuration from already-loaded properties, then applies
     * environment overrides.
     */
    public static InstrumentsConfig fromProperties(Properties props) {
        Builder builder = new Builder(false);
        builder.applyProperties(props);
        builder.applyEnvironmentVariables();
        return builder.build();
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder(true);
    }

    /**
     * Creates a builder holding this configuration's values. The environment
     * is not re-read.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(false);
        builder.instrumentationEnabled = this.instrumentationEnabled;
        builder.statsdHost = this.statsdHost;
        builder.statsdPort = this.statsdPort;
        builder.tickInterval = this.tickInterval;
        builder.reservoirSize = this.reservoirSize;
        builder.reservoirAlpha = this.reservoirAlpha;
        return builder;
    }

    public static final class Builder {

        private boolean instrumentationEnabled = true;
        private String statsdHost = DEFAULT_STATSD_HOST;
        private Integer statsdPort = null;
        private Duration tickInterval = DEFAULT_TICK_INTERVAL;
        private int reservoirSize = DEFAULT_RESERVOIR_SIZE;
        private double reservoirAlpha = DEFAULT_RESERVOIR_ALPHA;

        private Builder(boolean loadEnvironment) {
            if (loadEnvironment) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnvBoolean(ENV_ENABLED).ifPresent(val -> this.instrumentationEnabled = val);
            getEnv(ENV_STATSD_HOST).ifPresent(val -> this.statsdHost = val);
            getEnvInt(ENV_STATSD_PORT).ifPresent(val -> this.statsdPort = val);
            getEnvLong(ENV_TICK_INTERVAL_SECONDS).ifPresent(val -> this.tickInterval = Duration.ofSeconds(val));
            getEnvInt(ENV_RESERVOIR_SIZE).ifPresent(val -> this.reservoirSize = val);
            getEnvDouble(ENV_RESERVOIR_ALPHA).ifPresent(val -> this.reservoirAlpha = val);
        }

        private void applyProperties(Properties props) {
            String enabled = props.getProperty(PROP_ENABLED);
            if (enabled != null) {
                this.instrumentationEnabled = parseBoolean(enabled);
            }

            String host = props.getProperty(PROP_STATSD_HOST);
            if (host != null && !host.isBlank()) {
                this.statsdHost = host.trim();
            }

            String port = props.getProperty(PROP_STATSD_PORT);
            if (port != null && !port.isBlank()) {
                this.statsdPort = Integer.parseInt(port.trim());
            }

            String tick = props.getProperty(PROP_TICK_INTERVAL_SECONDS);
            if (tick != null) {
                this.tickInterval = Duration.ofSeconds(Long.parseLong(tick.trim()));
            }

            String size = props.getProperty(PROP_RESERVOIR_SIZE);
            if (size != null) {
                this.reservoirSize = Integer.parseInt(size.trim());
            }

            String alpha = props.getProperty(PROP_RESERVOIR_ALPHA);
            if (alpha != null) {
                this.reservoirAlpha = Double.parseDouble(alpha.trim());
            }
        }

        // ====================================================================
        // BUILDER METHODS
        // ====================================================================

        public Builder instrumentationEnabled(boolean enabled) {
            this.instrumentationEnabled = enabled;
            return this;
        }

        public Builder statsdHost(String host) {
            this.statsdHost = host;
            return this;
        }

        /**
         * @param port UDP port of the collector, or {@code null} to disable forwarding
         */
        public Builder statsdPort(Integer port) {
            this.statsdPort = port;
            return this;
        }

        public Builder tickInterval(Duration interval) {
            this.tickInterval = interval;
            return this;
        }

        public Builder reservoirSize(int size) {
            this.reservoirSize = size;
            return this;
        }

        public Builder reservoirAlpha(double alpha) {
            this.reservoirAlpha = alpha;
            return this;
        }

        public InstrumentsConfig build() {
            return new InstrumentsConfig(this);
        }

        // ====================================================================
        // ENVIRONMENT VARIABLE HELPERS
        // ====================================================================

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.debug("Loaded env var: {}={}", key, value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warn("Invalid long value for {}: {}", key, val);
                    return null;
                }
            });
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warn("Invalid int value for {}: {}", key, val);
                    return null;
                }
            });
        }

        private static Optional<Double> getEnvDouble(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Double.parseDouble(val);
                } catch (NumberFormatException e) {
                    logger.warn("Invalid double value for {}: {}", key, val);
                    return null;
                }
            });
        }

        private static Optional<Boolean> getEnvBoolean(String key) {
            return getEnv(key).map(Builder::parseBoolean);
        }

        private static boolean parseBoolean(String val) {
            String normalized = val.trim().toLowerCase();
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (statsdHost == null || statsdHost.isBlank()) {
            throw new IllegalArgumentException("statsdHost must not be blank");
        }
        if (statsdPort != null && (statsdPort <= 0 || statsdPort > 65535)) {
            throw new IllegalArgumentException("statsdPort must be between 1 and 65535: " + statsdPort);
        }
        if (tickInterval == null || tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive: " + tickInterval);
        }
        if (reservoirSize <= 0) {
            throw new IllegalArgumentException("reservoirSize must be positive: " + reservoirSize);
        }
        if (!(reservoirAlpha > 0) || Double.isInfinite(reservoirAlpha)) {
            throw new IllegalArgumentException("reservoirAlpha must be positive: " + reservoirAlpha);
        }

        logger.debug("Instruments configuration validated: {}", this);
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public boolean isInstrumentationEnabled() { return instrumentationEnabled; }
    public String getStatsdHost() { return statsdHost; }
    public Optional<Integer> getStatsdPort() { return Optional.ofNullable(statsdPort); }
    public Duration getTickInterval() { return tickInterval; }
    public int getReservoirSize() { return reservoirSize; }
    public double getReservoirAlpha() { return reservoirAlpha; }

    @Override
    public String toString() {
        return "InstrumentsConfig{" +
                "enabled=" + instrumentationEnabled +
                ", statsd=" + (statsdPort == null ? "disabled" : statsdHost + ":" + statsdPort) +
                ", tickInterval=" + tickInterval +
                ", reservoirSize=" + reservoirSize +
                ", reservoirAlpha=" + reservoirAlpha +
                '}';
    }
}
