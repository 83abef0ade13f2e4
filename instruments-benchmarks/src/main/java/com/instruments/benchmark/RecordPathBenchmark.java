package com.instruments.benchmark;

import com.instruments.api.Work;
import com.instruments.core.config.InstrumentsConfig;
import com.instruments.core.registry.MetricsRegistry;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Cost of the instrumented call path: what a caller pays per record call
 * with forwarding disabled.
 * <p>
 * USAGE:
 * # Build and run
 * mvn clean package -pl instruments-benchmarks -am -DskipTests
 * java -cp instruments-benchmarks/target/classes:... com.instruments.benchmark.RecordPathBenchmark
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : shorter warmup and measurement
 */
@BenchmarkMode({Mode.Throughput, Mode.SampleTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class RecordPathBenchmark {

    // ========================================================================
    // CONFIGURATION
    // ========================================================================

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");

    @Param({"1", "100"})
    private int labelCount;

    // ========================================================================
    // STATE
    // ========================================================================

    private MetricsRegistry registry;
    private MetricsRegistry disabledRegistry;
    private String[] labels;

    @Setup(Level.Trial)
    public void setupTrial() {
        registry = MetricsRegistry.create(InstrumentsConfig.inMemory());
        disabledRegistry = MetricsRegistry.create(InstrumentsConfig.disabled());
        labels = new String[labelCount];
        for (int i = 0; i < labelCount; i++) {
            labels[i] = "bench.work." + i;
        }
    }

    @TearDown(Level.Trial)
    public void tearDownTrial() {
        registry.close();
        disabledRegistry.close();
    }

    private String nextLabel() {
        return labels[ThreadLocalRandom.current().nextInt(labels.length)];
    }

    // ========================================================================
    // BENCHMARKS
    // ========================================================================

    @Benchmark
    public void measureWork(Blackhole bh) {
        bh.consume(registry.measureWork(nextLabel(), ThreadLocalRandom.current().nextLong(1, 500)));
    }

    @Benchmark
    public void recordEvent(Blackhole bh) {
        bh.consume(registry.recordEvent(nextLabel()));
    }

    @Benchmark
    public long workStartStop() {
        Work work = registry.newWork(nextLabel());
        work.start();
        return work.stop();
    }

    @Benchmark
    public long disabledWorkStartStop() {
        Work work = disabledRegistry.newWork(nextLabel());
        work.start();
        return work.stop();
    }

    @Benchmark
    @Threads(4)
    public void measureWorkContended(Blackhole bh) {
        bh.consume(registry.measureWork(nextLabel(), ThreadLocalRandom.current().nextLong(1, 500)));
    }

    @Benchmark
    public void getWorkMetric(Blackhole bh) {
        bh.consume(registry.getWorkMetric(nextLabel()));
    }

    // ========================================================================
    // MAIN
    // ========================================================================

    public static void main(String[] args) throws RunnerException {
        OptionsBuilder builder = new OptionsBuilder();
        builder.include(RecordPathBenchmark.class.getSimpleName());
        if (QUICK_MODE) {
            builder.warmupIterations(2).measurementIterations(3);
        }
        Options options = builder.build();
        new Runner(options).run();
    }
}
