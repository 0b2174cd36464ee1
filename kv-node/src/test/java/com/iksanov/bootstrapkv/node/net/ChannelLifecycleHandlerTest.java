package com.iksanov.bootstrapkv.node.net;

import com.iksanov.bootstrapkv.node.metrics.NetMetrics;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ChannelLifecycleHandler}.
 */
@ExtendWith(MockitoExtension.class)
class ChannelLifecycleHandlerTest {

    @Mock
    private ChannelHandlerContext ctx;
    @Mock
    private Channel channel;
    @Mock
    private NetMetrics metrics;

    private ChannelLifecycleHandler handler;

    @BeforeEach
    void setUp() {
        handler = new ChannelLifecycleHandler(metrics);
        lenient().when(ctx.channel()).thenReturn(channel);
        lenient().when(channel.remoteAddress()).thenReturn(new InetSocketAddress("127.0.0.1", 9000));
    }

    @Test
    @DisplayName("channelActive should count the connection and propagate the event")
    void channelActiveShouldIncrementMetrics() {
        handler.channelActive(ctx);
        verify(metrics).incrementConnections();
        verify(ctx).fireChannelActive();
    }

    @Test
    @DisplayName("channelInactive should count the close and propagate the event")
    void channelInactiveShouldIncrementClosedMetrics() {
        handler.channelInactive(ctx);
        verify(metrics).incrementClosedConnections();
        verify(ctx).fireChannelInactive();
    }

    @Test
    @DisplayName("Active gauge follows opens and closes on a real metrics instance")
    void activeGaugeShouldTrackConnections() {
        NetMetrics real = new NetMetrics();
        ChannelLifecycleHandler tracking = new ChannelLifecycleHandler(real);

        tracking.channelActive(ctx);
        tracking.channelActive(ctx);
        tracking.channelInactive(ctx);

        assertEquals(1, real.getActiveConnections());
    }
}
