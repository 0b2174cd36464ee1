package com.iksanov.bootstrapkv.node.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collector for the bootstrap driver.
 * Exposes snapshot transfer progress and remote call failures to Prometheus.
 */
public class BootstrapMetrics {

    private static final Logger log = LoggerFactory.getLogger(BootstrapMetrics.class);
    private final PrometheusMeterRegistry registry;

    private final Counter fetchRounds;
    private final Counter entriesReceived;
    private final Counter diffReceived;
    private final Counter remoteFailures;
    private final Counter retries;
    private final Counter shortPages;
    private final Timer roundDuration;
    private final AtomicLong index = new AtomicLong(0);
    private final AtomicLong target = new AtomicLong(0);

    public BootstrapMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.fetchRounds = Counter.builder("bootstrap.fetch.rounds")
                .description("Completed fetch rounds against the remote node")
                .register(registry);

        this.entriesReceived = Counter.builder("bootstrap.entries.received")
                .description("Snapshot entries received from the remote node")
                .register(registry);

        this.diffReceived = Counter.builder("bootstrap.diff.received")
                .description("Catch-up modifications received from the remote node")
                .register(registry);

        this.remoteFailures = Counter.builder("bootstrap.remote.failures")
                .description("Failed remote calls")
                .register(registry);

        this.retries = Counter.builder("bootstrap.remote.retries")
                .description("Retried remote calls")
                .register(registry);

        this.shortPages = Counter.builder("bootstrap.short.pages")
                .description("Pages that came back with fewer entries than requested")
                .register(registry);

        this.roundDuration = Timer.builder("bootstrap.round.duration")
                .description("Duration of a fetch round, remote call and local append")
                .register(registry);

        Gauge.builder("bootstrap.index", index, AtomicLong::get)
                .description("Current snapshot cursor")
                .register(registry);

        Gauge.builder("bootstrap.target", target, AtomicLong::get)
                .description("Remote size captured at start")
                .register(registry);

        log.debug("BootstrapMetrics initialized and Prometheus registry created");
    }

    public void recordRound(int entries, int diff, long millis) {
        fetchRounds.increment();
        entriesReceived.increment(entries);
        diffReceived.increment(diff);
        roundDuration.record(millis, TimeUnit.MILLISECONDS);
    }

    public void updateProgress(long currentIndex, long currentTarget) {
        index.set(currentIndex);
        target.set(currentTarget);
    }

    public void incrementRemoteFailures() { remoteFailures.increment(); }
    public void incrementRetries() { retries.increment(); }
    public void incrementShortPages() { shortPages.increment(); }

    public double getFetchRounds() { return fetchRounds.count(); }
    public double getRemoteFailures() { return remoteFailures.count(); }
    public double getShortPages() { return shortPages.count(); }
    public String scrape() { return registry.scrape(); }
}
