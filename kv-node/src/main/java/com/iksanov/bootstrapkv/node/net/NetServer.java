package com.iksanov.bootstrapkv.node.net;

import com.iksanov.bootstrapkv.common.codec.JsonCodec;
import com.iksanov.bootstrapkv.node.config.NetServerConfig;
import com.iksanov.bootstrapkv.node.core.KvNode;
import com.iksanov.bootstrapkv.node.metrics.NetMetrics;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NetServer - Netty HTTP server exposing a {@link KvNode}.
 * <p>
 * Responsibilities:
 *  - Initializes and manages Netty event loops (boss, worker and request executors)
 *  - Builds the pipeline: HTTP codec -> aggregator -> request handler
 *  - Handles lifecycle: start(), stop() with graceful shutdown of in-flight requests
 */
public final class NetServer {

    private static final Logger log = LoggerFactory.getLogger(NetServer.class);
    private static final int REQUEST_EXECUTOR_THREADS = 4;
    private final NetServerConfig config;
    private final RequestProcessor requestProcessor;
    private final NetMetrics metrics;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup requestExecutors;
    private Channel serverChannel;
    private volatile boolean running = false;

    public NetServer(NetServerConfig config, KvNode node, NetMetrics netMetrics) {
        this(config, new RequestProcessor(node, new JsonCodec(), netMetrics), netMetrics);
    }

    public NetServer(NetServerConfig config, RequestProcessor requestProcessor, NetMetrics netMetrics) {
        this.config = Objects.requireNonNull(config, "config");
        this.requestProcessor = Objects.requireNonNull(requestProcessor, "requestProcessor");
        this.metrics = Objects.requireNonNull(netMetrics, "netMetrics");
    }

    /**
     * Binds the listening socket and returns once the server accepts connections.
     *
     * @throws IllegalStateException if the address cannot be bound
     */
    public synchronized void start() {
        if (running) {
            log.warn("NetServer is already running on {}:{}", config.host(), localPort());
            return;
        }

        bossGroup = new NioEventLoopGroup(Math.max(1, config.bossThreads()));
        workerGroup = config.workerThreads() > 0 ? new NioEventLoopGroup(config.workerThreads()) : new NioEventLoopGroup();
        requestExecutors = new DefaultEventExecutorGroup(REQUEST_EXECUTOR_THREADS);

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, config.backlog())
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                    .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    .childHandler(new NetServerInitializer(requestProcessor, config.maxContentLength(), metrics, requestExecutors));

            InetSocketAddress address = new InetSocketAddress(config.host(), config.port());
            log.info("Starting NetServer on {}:{} with config: {}", config.host(), config.port(), config);
            ChannelFuture future = bootstrap.bind(address).awaitUninterruptibly();
            if (!future.isSuccess()) {
                metrics.incrementServerErrors();
                log.error("Failed to bind NetServer on {}:{}", config.host(), config.port(), future.cause());
                shutdownEventLoopGroupsQuietly();
                throw new IllegalStateException("NetServer failed to bind " + address, future.cause());
            }
            serverChannel = future.channel();
            running = true;
            metrics.serverStarted();
            log.info("NetServer started successfully on {}:{}", config.host(), localPort());
        } catch (IllegalStateException e) {
            throw e;
        } catch (Throwable t) {
            metrics.incrementServerErrors();
            log.error("Unexpected error while starting NetServer", t);
            shutdownEventLoopGroupsQuietly();
            throw new IllegalStateException("NetServer startup failed", t);
        }
    }

    /**
     * Stops accepting connections, then lets the event loops drain in-flight requests.
     */
    public synchronized void stop() {
        if (!running) {
            log.warn("NetServer is not running");
            return;
        }

        log.info("Stopping NetServer on {}:{}", config.host(), localPort());
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
            }
        } catch (Exception e) {
            metrics.incrementServerErrors();
            log.error("Error closing NetServer channel: {}", e.getMessage(), e);
        } finally {
            shutdownEventLoopGroups();
            running = false;
            metrics.serverStopped();
            log.info("NetServer stopped successfully");
        }
    }

    private void shutdownEventLoopGroups() {
        log.debug("Shutting down Netty event loops (boss={}, worker={}, request={})...",
                bossGroup != null, workerGroup != null, requestExecutors != null);
        List<Future<?>> terminations = new ArrayList<>(3);
        for (EventExecutorGroup group : new EventExecutorGroup[]{bossGroup, workerGroup, requestExecutors}) {
            if (group == null) continue;
            terminations.add(group.shutdownGracefully(
                    config.shutdownQuietPeriodSeconds(),
                    config.shutdownTimeoutSeconds(),
                    TimeUnit.SECONDS));
        }
        try {
            for (Future<?> termination : terminations) {
                if (!termination.await(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                    log.warn("Event executor group did not terminate within {}s", config.shutdownTimeoutSeconds());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during NetServer shutdown");
        }
    }

    private void shutdownEventLoopGroupsQuietly() {
        if (workerGroup != null) workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        if (bossGroup != null) bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        if (requestExecutors != null) requestExecutors.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    /**
     * @return the bound port, which differs from the configured one when port 0 was requested
     */
    public int localPort() {
        Channel ch = serverChannel;
        if (ch != null && ch.localAddress() instanceof InetSocketAddress bound) return bound.getPort();
        return config.port();
    }

    public boolean isRunning() {
        return running;
    }
}
