package com.iksanov.bootstrapkv.node.metrics;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Side HTTP endpoint for operators, separate from the key-value API.
 * <ul>
 *   <li>{@code GET /metrics}: Prometheus text of the store, network and bootstrap registries</li>
 *   <li>{@code GET /health}: {@code {"status":"UP","bootstrap":"<state>"}}</li>
 * </ul>
 * A failure to start is logged and leaves the node running without metrics.
 */
public class MetricsServer {

    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    private final String host;
    private final int port;
    private final StoreMetrics storeMetrics;
    private final NetMetrics netMetrics;
    private final BootstrapMetrics bootstrapMetrics;
    private final Supplier<String> bootstrapState;
    private EventLoopGroup group;
    private Channel serverChannel;

    public MetricsServer(String host, int port, StoreMetrics storeMetrics, NetMetrics netMetrics,
                         BootstrapMetrics bootstrapMetrics, Supplier<String> bootstrapState) {
        this.host = host;
        this.port = port;
        this.storeMetrics = storeMetrics;
        this.netMetrics = netMetrics;
        this.bootstrapMetrics = bootstrapMetrics;
        this.bootstrapState = bootstrapState;
    }

    public void start() {
        group = new NioEventLoopGroup(1);
        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(group)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_BACKLOG, 16)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline()
                                    .addLast(new HttpServerCodec())
                                    .addLast(new HttpObjectAggregator(64 * 1024))
                                    .addLast(new ScrapeHandler());
                        }
                    });
            serverChannel = bootstrap.bind(host, port).sync().channel();
            log.info("Metrics server started on {}:{}", host, localPort());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while starting metrics server");
            shutdown();
        } catch (Exception e) {
            log.error("Failed to start metrics server on {}:{}, continuing without it", host, port, e);
            shutdown();
        }
    }

    public void shutdown() {
        if (serverChannel != null) serverChannel.close().awaitUninterruptibly();
        if (group != null) group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
        serverChannel = null;
        group = null;
        log.info("Metrics server shut down");
    }

    public int localPort() {
        Channel ch = serverChannel;
        if (ch != null && ch.localAddress() instanceof InetSocketAddress bound) return bound.getPort();
        return port;
    }

    String renderMetrics() {
        return storeMetrics.scrape() + "\n" + netMetrics.scrape() + "\n" + bootstrapMetrics.scrape();
    }

    String renderHealth() {
        return "{\"status\":\"UP\",\"bootstrap\":\"" + bootstrapState.get() + "\"}";
    }

    private class ScrapeHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            String path = new QueryStringDecoder(request.uri()).path();
            if (!HttpMethod.GET.equals(request.method())) {
                respond(ctx, HttpResponseStatus.METHOD_NOT_ALLOWED, "text/plain", "Method Not Allowed");
            } else if ("/metrics".equals(path)) {
                respond(ctx, HttpResponseStatus.OK, PROMETHEUS_CONTENT_TYPE, renderMetrics());
            } else if ("/health".equals(path)) {
                respond(ctx, HttpResponseStatus.OK, "application/json", renderHealth());
            } else {
                respond(ctx, HttpResponseStatus.NOT_FOUND, "text/plain", "Not Found");
            }
        }

        private void respond(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
            FullHttpResponse response = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1, status, Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Error in metrics handler", cause);
            ctx.close();
        }
    }
}
