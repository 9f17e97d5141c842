package com.dpstore.util;

import com.dpstore.error.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics for store, lock and server operations.
 *
 * Meters:
 * dps.ops{operation}, dps.latency{operation}, dps.errors{code},
 * dps.lock.retries, dps.lock.reclaimed, dps.connections.
 */
public class MetricsCollector {

    private final MeterRegistry registry;

    private final Counter lockRetries;
    private final Counter lockReclaimed;
    private final LongAdder activeConnections;

    /**
     * Create a metrics collector with a simple registry.
     */
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create a metrics collector with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public MetricsCollector(MeterRegistry registry) {
        this.registry = registry;

        this.lockRetries = Counter.builder("dps.lock.retries")
            .description("Lock acquisition attempts that found the lock held")
            .register(registry);

        this.lockReclaimed = Counter.builder("dps.lock.reclaimed")
            .description("Expired lock leases taken over from a previous owner")
            .register(registry);

        this.activeConnections = new LongAdder();
        Gauge.builder("dps.connections", activeConnections, LongAdder::sum)
            .description("Active server connections")
            .register(registry);
    }

    /**
     * Record one completed operation.
     *
     * @param operation     operation name, used as the tag value
     * @param durationNanos elapsed time in nanoseconds
     */
    public void recordOperation(String operation, long durationNanos) {
        Counter.builder("dps.ops")
            .tag("operation", operation)
            .register(registry)
            .increment();
        Timer.builder("dps.latency")
            .tag("operation", operation)
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)
            .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordError(ErrorCode code) {
        recordError(code.name());
    }

    public void recordError(String code) {
        Counter.builder("dps.errors")
            .tag("code", code)
            .register(registry)
            .increment();
    }

    public void recordLockRetry() {
        lockRetries.increment();
    }

    public void recordLockReclaimed() {
        lockReclaimed.increment();
    }

    public void connectionOpened() {
        activeConnections.increment();
    }

    public void connectionClosed() {
        activeConnections.decrement();
    }

    public long getOperationCount(String operation) {
        Counter counter = registry.find("dps.ops").tag("operation", operation).counter();
        return counter != null ? (long) counter.count() : 0;
    }

    public long getErrorCount(String code) {
        Counter counter = registry.find("dps.errors").tag("code", code).counter();
        return counter != null ? (long) counter.count() : 0;
    }

    public double getMeanLatencyMs(String operation) {
        Timer timer = registry.find("dps.latency").tag("operation", operation).timer();
        return timer != null ? timer.mean(TimeUnit.MILLISECONDS) : 0.0;
    }

    public long getLockRetries() {
        return (long) lockRetries.count();
    }

    public long getLockReclaimed() {
        return (long) lockReclaimed.count();
    }

    public long getActiveConnections() {
        return activeConnections.sum();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Total of one counter across all its tag values.
     */
    private long total(String meterName) {
        double sum = 0;
        for (Counter counter : registry.find(meterName).counters()) {
            sum += counter.count();
        }
        return (long) sum;
    }

    public long getTotalOperations() {
        return total("dps.ops");
    }

    public long getTotalErrors() {
        return total("dps.errors");
    }

    /**
     * Format a short summary of the main counters.
     */
    public String summary() {
        return String.format(
            "operations=%d, errors=%d, lockRetries=%d, lockReclaimed=%d, connections=%d",
            getTotalOperations(), getTotalErrors(),
            getLockRetries(), getLockReclaimed(),
            getActiveConnections()
        );
    }
}
