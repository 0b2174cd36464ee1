package com.iksanov.bootstrapkv.node.app;

import com.iksanov.bootstrapkv.common.codec.JsonCodec;
import com.iksanov.bootstrapkv.common.dto.Modification;
import com.iksanov.bootstrapkv.common.exception.ConfigurationException;
import com.iksanov.bootstrapkv.node.bootstrap.BootstrapDriver;
import com.iksanov.bootstrapkv.node.bootstrap.HttpNodeClient;
import com.iksanov.bootstrapkv.node.config.NodeConfig;
import com.iksanov.bootstrapkv.node.config.PeerAddress;
import com.iksanov.bootstrapkv.node.core.KvNode;
import com.iksanov.bootstrapkv.node.metrics.BootstrapMetrics;
import com.iksanov.bootstrapkv.node.metrics.MetricsServer;
import com.iksanov.bootstrapkv.node.metrics.NetMetrics;
import com.iksanov.bootstrapkv.node.metrics.StoreMetrics;
import com.iksanov.bootstrapkv.node.net.NetServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main application class for a key-value node.
 * Serves the node over HTTP and, when a bootstrap peer is given, copies that peer's contents in the background.
 * On shutdown the final contents are printed one {@code key - value} line per entry.
 */
public class KvNodeApplication {

    private static final Logger log = LoggerFactory.getLogger(KvNodeApplication.class);
    private final NodeConfig config;
    private final PrintStream dumpOut;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private KvNode node;
    private NetServer netServer;
    private MetricsServer metricsServer;
    private HttpNodeClient bootstrapClient;
    private volatile BootstrapDriver bootstrapDriver;
    private StoreMetrics storeMetrics;
    private NetMetrics netMetrics;
    private BootstrapMetrics bootstrapMetrics;
    private boolean stopped = false;

    public KvNodeApplication(NodeConfig config) {
        this(config, System.out);
    }

    public KvNodeApplication(NodeConfig config, PrintStream dumpOut) {
        this.config = config;
        this.dumpOut = dumpOut;
    }

    public static void main(String[] args) {
        NodeConfig config;
        try {
            config = NodeConfig.fromArgs(args);
        } catch (ConfigurationException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }

        log.info("========================================");
        log.info("Starting KvNode on {}:{}", config.host(), config.port());
        log.info("Bootstrap peer: {}", config.bootstrapPeerOptional().map(PeerAddress::toString).orElse("none"));
        log.info("========================================");

        KvNodeApplication app = new KvNodeApplication(config);
        try {
            app.start();
        } catch (Exception e) {
            log.error("Startup failed", e);
            app.shutdown();
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown-hook"));
        app.awaitShutdown();
    }

    public void start() {
        storeMetrics = new StoreMetrics();
        netMetrics = new NetMetrics();
        bootstrapMetrics = new BootstrapMetrics();
        log.info("[OK] Metrics initialized");

        node = new KvNode(config.maxChunkSize(), config.logCapacity(), config.lockTimeout(), storeMetrics);
        log.info("[OK] Node initialized (maxChunkSize={}, logCapacity={})", config.maxChunkSize(), config.logCapacity());

        if (config.metricsPort() > 0) {
            metricsServer = new MetricsServer(config.host(), config.metricsPort(), storeMetrics, netMetrics, bootstrapMetrics,
                    this::bootstrapStateName);
            metricsServer.start();
            log.info("[OK] Metrics server started on port {}", config.metricsPort());
        }

        netServer = new NetServer(config.toNetServerConfig(), node, netMetrics);
        netServer.start();
        log.info("[OK] Server listening on {}:{}", config.host(), netServer.localPort());

        config.bootstrapPeerOptional().ifPresent(this::startBootstrap);

        log.info("========================================");
        log.info("[SUCCESS] KvNode ready!");
        log.info("  Port: {}", netServer.localPort());
        log.info("  Metrics port: {}", config.metricsPort() > 0 ? config.metricsPort() : "disabled");
        log.info("  Example /insert body: {}", insertExample());
        log.info("========================================");
    }

    private void startBootstrap(PeerAddress peer) {
        bootstrapClient = new HttpNodeClient(peer, Duration.ofMillis(config.requestTimeoutMillis()));
        bootstrapDriver = new BootstrapDriver(peer.toString(), bootstrapClient, node, config.toBootstrapConfig(), bootstrapMetrics);
        bootstrapDriver.start();
        log.info("[OK] Bootstrap from {} started", peer);
    }

    /**
     * Cancels the bootstrap, stops the server, then prints the contents. Safe to call more than once.
     */
    public synchronized void shutdown() {
        if (stopped) return;
        stopped = true;
        log.info("========================================");
        log.info("Shutting down KvNode...");
        log.info("========================================");

        try {
            if (bootstrapDriver != null) {
                log.info("Cancelling bootstrap...");
                bootstrapDriver.stop();
                log.info("[OK] Bootstrap ended in state {}", bootstrapDriver.state());
            }

            if (bootstrapClient != null) {
                bootstrapClient.close();
            }

            if (netServer != null && netServer.isRunning()) {
                log.info("Stopping NetServer...");
                netServer.stop();
                log.info("[OK] NetServer stopped");
            }

            if (metricsServer != null) {
                metricsServer.shutdown();
            }

            if (node != null) {
                node.dump((key, value) -> dumpOut.println(key + " - " + value));
                dumpOut.flush();
            }

            log.info("========================================");
            log.info("[SUCCESS] Shutdown complete");
            log.info("========================================");
        } catch (Exception e) {
            log.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    /**
     * A one-entry {@code POST /insert} body, as printed in the startup banner.
     */
    public static String insertExample() {
        byte[] body = new JsonCodec().encodeModifications(List.of(Modification.update("key", "value")));
        return new String(body, StandardCharsets.UTF_8);
    }

    private String bootstrapStateName() {
        BootstrapDriver driver = bootstrapDriver;
        return driver == null ? "NONE" : driver.state().name();
    }

    public void awaitShutdown() {
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public KvNode node() {
        return node;
    }

    public NetServer netServer() {
        return netServer;
    }

    public BootstrapDriver bootstrapDriver() {
        return bootstrapDriver;
    }
}
