package com.eainde.compliance.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records wall-clock latency of named pipeline stages.
 *
 * <pre>
 * try (LatencyTracker.Measurement m = tracker.measure("planner_agent")) {
 *     plan = planner.plan(catalog);
 * }
 * </pre>
 *
 * <p>Safe for concurrent use as long as stage names are unique per requirement
 * (e.g. {@code "reasoner_REQ-001"}).</p>
 */
public class LatencyTracker {

    private static final Logger log = LoggerFactory.getLogger(LatencyTracker.class);

    private final Map<String, Double> measurements = new ConcurrentHashMap<>();

    public Measurement measure(String operationName) {
        return new Measurement(operationName, System.nanoTime());
    }

    public Optional<Double> get(String operationName) {
        return Optional.ofNullable(measurements.get(operationName));
    }

    /** Copy of all measurements, sorted by stage name. */
    public Map<String, Double> all() {
        return new TreeMap<>(measurements);
    }

    public double total() {
        return measurements.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public void reset() {
        measurements.clear();
    }

    void record(String operationName, double durationMs) {
        measurements.put(operationName, durationMs);
        log.info("{} completed in {}ms", operationName, String.format("%.2f", durationMs));
    }

    /**
     * An open measurement; closing it records the elapsed time.
     */
    public final class Measurement implements AutoCloseable {

        private final String operationName;
        private final long startNanos;
        private boolean closed;

        private Measurement(String operationName, long startNanos) {
            this.operationName = operationName;
            this.startNanos = startNanos;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            record(operationName, (System.nanoTime() - startNanos) / 1_000_000.0);
        }
    }
}
