package com.iksanov.bootstrapkv.node.net;

import com.iksanov.bootstrapkv.node.metrics.NetMetrics;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks client connections: logs connects and disconnects and keeps the active connection gauge current.
 */
@ChannelHandler.Sharable
public class ChannelLifecycleHandler extends ChannelInboundHandlerAdapter {

    private static final Logger log = LoggerFactory.getLogger(ChannelLifecycleHandler.class);
    private final NetMetrics metrics;

    public ChannelLifecycleHandler(NetMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        metrics.incrementConnections();
        log.debug("Connection established from {} (active: {})", ctx.channel().remoteAddress(), metrics.getActiveConnections());
        ctx.fireChannelActive();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        metrics.incrementClosedConnections();
        log.debug("Connection closed from {} (active: {})", ctx.channel().remoteAddress(), metrics.getActiveConnections());
        ctx.fireChannelInactive();
    }
}
