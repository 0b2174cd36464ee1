package com.iksanov.bootstrapkv.node.net;

import com.iksanov.bootstrapkv.node.metrics.NetMetrics;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.EventExecutorGroup;

/**
 * NetServerInitializer configures the Netty pipeline of each accepted connection:
 *  - connection tracking (ChannelLifecycleHandler)
 *  - HTTP/1.1 codec and body aggregation up to {@code maxContentLength}
 *  - request handling (HttpRequestHandler) on the request executor group
 */
public class NetServerInitializer extends ChannelInitializer<SocketChannel> {
    private final HttpRequestHandler requestHandler;
    private final ChannelLifecycleHandler lifecycleHandler;
    private final EventExecutorGroup requestExecutors;
    private final int maxContentLength;

    public NetServerInitializer(RequestProcessor requestProcessor, int maxContentLength, NetMetrics metrics, EventExecutorGroup requestExecutors) {
        this.requestHandler = new HttpRequestHandler(requestProcessor, metrics);
        this.lifecycleHandler = new ChannelLifecycleHandler(metrics);
        this.requestExecutors = requestExecutors;
        this.maxContentLength = maxContentLength;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ChannelPipeline p = ch.pipeline();
        p.addLast(lifecycleHandler);
        p.addLast(new LoggingHandler(LogLevel.TRACE));
        p.addLast(new HttpServerCodec());
        p.addLast(new HttpObjectAggregator(maxContentLength));
        p.addLast(requestExecutors, requestHandler);
    }
}
