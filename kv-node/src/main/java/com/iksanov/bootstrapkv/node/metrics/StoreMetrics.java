package com.iksanov.bootstrapkv.node.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collector for the node's store and modification log using Micrometer.
 * Exposes store statistics to Prometheus.
 */
public class StoreMetrics {

    private final PrometheusMeterRegistry registry;
    private final Counter appends;
    private final Counter modificationsApplied;
    private final Counter fetches;
    private final Counter lockTimeouts;
    private final Timer appendLatency;
    private final Timer fetchLatency;
    private final AtomicLong storeSize = new AtomicLong(0);
    private final AtomicLong head = new AtomicLong(0);
    private final AtomicLong logSize = new AtomicLong(0);

    public StoreMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.appends = Counter.builder("store.appends")
                .description("Number of appended batches")
                .register(registry);

        this.modificationsApplied = Counter.builder("store.modifications.applied")
                .description("Number of modifications applied to the store")
                .register(registry);

        this.fetches = Counter.builder("store.fetches")
                .description("Number of served fetch calls")
                .register(registry);

        this.lockTimeouts = Counter.builder("store.lock.timeouts")
                .description("Operations that failed to acquire the node lock")
                .register(registry);

        this.appendLatency = Timer.builder("store.append.duration")
                .description("Append critical section duration")
                .serviceLevelObjectives(
                    Duration.ofMillis(1),
                    Duration.ofMillis(5),
                    Duration.ofMillis(10),
                    Duration.ofMillis(50)
                )
                .register(registry);

        this.fetchLatency = Timer.builder("store.fetch.duration")
                .description("Fetch critical section duration")
                .serviceLevelObjectives(
                    Duration.ofMillis(1),
                    Duration.ofMillis(5),
                    Duration.ofMillis(10),
                    Duration.ofMillis(50)
                )
                .register(registry);

        Gauge.builder("store.size", storeSize, AtomicLong::get)
                .description("Current number of live keys")
                .register(registry);

        Gauge.builder("store.head", head, AtomicLong::get)
                .description("Head of the most recent batch")
                .register(registry);

        Gauge.builder("store.log.size", logSize, AtomicLong::get)
                .description("Batches retained in the modification log")
                .register(registry);
    }

    public void recordAppend(int modifications, long newHead, int size, int retainedBatches) {
        appends.increment();
        modificationsApplied.increment(modifications);
        head.set(newHead);
        storeSize.set(size);
        logSize.set(retainedBatches);
    }

    public void recordFetch() {
        fetches.increment();
    }

    public void recordLockTimeout() {
        lockTimeouts.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopAppendTimer(Timer.Sample sample) {
        sample.stop(appendLatency);
    }

    public void stopFetchTimer(Timer.Sample sample) {
        sample.stop(fetchLatency);
    }

    public double getAppends() {
        return appends.count();
    }

    public double getLockTimeouts() {
        return lockTimeouts.count();
    }

    public String scrape() {
        return registry.scrape();
    }
}
