package io.github.flameyossnowy.geofilter.api.backend;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

public final class BackendMetrics {
    private final String backendName;
    private final LongAdder executions = new LongAdder();
    private final LongAdder optimizedExecutions = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder totalNanos = new LongAdder();

    public BackendMetrics(String backendName) {
        this.backendName = backendName;
    }

    public void recordExecution(long elapsedNanos, boolean optimized) {
        executions.increment();
        totalNanos.add(elapsedNanos);
        if (optimized) {
            optimizedExecutions.increment();
        }
    }

    public void recordError() {
        errors.increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public Snapshot snapshot() {
        long count = executions.sum();
        long totalMillis = TimeUnit.NANOSECONDS.toMillis(totalNanos.sum());
        return new Snapshot(
            backendName,
            count,
            optimizedExecutions.sum(),
            errors.sum(),
            cacheHits.sum(),
            cacheMisses.sum(),
            totalMillis,
            count == 0 ? 0.0 : (double) totalMillis / count
        );
    }

    public void reset() {
        executions.reset();
        optimizedExecutions.reset();
        errors.reset();
        cacheHits.reset();
        cacheMisses.reset();
        totalNanos.reset();
    }

    public record Snapshot(
        String backendName,
        long executions,
        long optimizedExecutions,
        long errors,
        long cacheHits,
        long cacheMisses,
        long totalTimeMillis,
        double averageTimeMillis
    ) {
        public long directExecutions() {
            return executions - optimizedExecutions;
        }
    }
}
