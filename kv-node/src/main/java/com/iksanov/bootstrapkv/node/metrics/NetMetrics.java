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
 * Metrics collector for the Netty HTTP layer.
 * Exposes connection and request statistics to Prometheus.
 */
public class NetMetrics {

    private static final Logger log = LoggerFactory.getLogger(NetMetrics.class);
    private final PrometheusMeterRegistry registry;

    private final Counter totalConnections;
    private final Counter closedConnections;
    private final Counter totalRequests;
    private final Counter clientErrors;
    private final Counter serverErrors;
    private final Counter notFound;
    private final Counter serverStartups;
    private final Counter serverShutdowns;
    private final Timer requestDuration;
    private final AtomicLong activeConnections = new AtomicLong(0);

    public NetMetrics() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.totalConnections = Counter.builder("net.connections.total")
                .description("Total TCP connections accepted")
                .register(registry);

        this.closedConnections = Counter.builder("net.connections.closed")
                .description("Total TCP connections closed")
                .register(registry);

        this.totalRequests = Counter.builder("net.requests.total")
                .description("Total number of received HTTP requests")
                .register(registry);

        this.clientErrors = Counter.builder("net.requests.client.errors")
                .description("Requests rejected as malformed or invalid")
                .register(registry);

        this.serverErrors = Counter.builder("net.requests.server.errors")
                .description("Requests that failed with an internal error")
                .register(registry);

        this.notFound = Counter.builder("net.requests.not.found")
                .description("Requests for an unknown route")
                .register(registry);

        this.serverStartups = Counter.builder("net.server.startups")
                .description("Total times the NetServer was started")
                .register(registry);

        this.serverShutdowns = Counter.builder("net.server.shutdowns")
                .description("Total times the NetServer was stopped")
                .register(registry);

        this.requestDuration = Timer.builder("net.request.duration")
                .description("Request processing duration in milliseconds")
                .register(registry);

        Gauge.builder("net.connections.active", activeConnections, AtomicLong::get)
                .description("Current number of active TCP connections")
                .register(registry);

        log.debug("NetMetrics initialized and Prometheus registry created");
    }

    public void incrementConnections() { totalConnections.increment(); activeConnections.incrementAndGet(); }
    public void incrementClosedConnections() { closedConnections.increment(); activeConnections.decrementAndGet(); }
    public void incrementRequests() { totalRequests.increment(); }
    public void incrementClientErrors() { clientErrors.increment(); }
    public void incrementServerErrors() { serverErrors.increment(); }
    public void incrementNotFound() { notFound.increment(); }
    public void recordRequestDuration(long millis) { requestDuration.record(millis, TimeUnit.MILLISECONDS); }
    public void serverStarted() { serverStartups.increment(); }
    public void serverStopped() { serverShutdowns.increment(); }

    public long getActiveConnections() { return activeConnections.get(); }
    public String scrape() { return registry.scrape(); }
}
