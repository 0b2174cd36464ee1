package com.iksanov.bootstrapkv.node.net;

import com.iksanov.bootstrapkv.node.metrics.NetMetrics;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HttpRequestHandler is the main Netty handler responsible for:
 *  - receiving aggregated {@link FullHttpRequest} objects from the pipeline,
 *  - delegating processing to {@link RequestProcessor},
 *  - writing the {@link NodeResponse} back as an HTTP response, honouring keep-alive,
 *  - handling channel exceptions.
 * <p>
 * Stateless and thread-safe, hence @Sharable. It runs on a dedicated executor group so that
 * waiting for the node lock never stalls an I/O event loop.
 */
@ChannelHandler.Sharable
public class HttpRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger log = LoggerFactory.getLogger(HttpRequestHandler.class);
    private final RequestProcessor processor;
    private final NetMetrics metrics;

    public HttpRequestHandler(RequestProcessor processor, NetMetrics metrics) {
        this.processor = processor;
        this.metrics = metrics;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        NodeResponse response;
        if (!request.decoderResult().isSuccess()) {
            metrics.incrementClientErrors();
            log.warn("Undecodable HTTP request from {}: {}", ctx.channel().remoteAddress(), request.decoderResult().cause());
            response = NodeResponse.badRequest("-", "Malformed HTTP request");
            keepAlive = false;
        } else {
            String path = new QueryStringDecoder(request.uri()).path();
            byte[] body = ByteBufUtil.getBytes(request.content());
            response = processor.process(NodeRequest.of(request.method().name(), path, body));
        }
        write(ctx, response, keepAlive);
    }

    private void write(ChannelHandlerContext ctx, NodeResponse response, boolean keepAlive) {
        FullHttpResponse http = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.valueOf(response.status().code()),
                Unpooled.wrappedBuffer(response.body()));
        http.headers().set(HttpHeaderNames.CONTENT_TYPE, response.contentType());
        http.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.body().length);
        if (keepAlive) {
            http.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        } else {
            http.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        }
        ChannelFuture future = ctx.writeAndFlush(http);
        if (!keepAlive) future.addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        metrics.incrementServerErrors();
        log.error("Unhandled exception in channel {}: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        ctx.close();
    }
}
