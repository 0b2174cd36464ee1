package com.iksanov.bootstrapkv.node.bootstrap;

import com.iksanov.bootstrapkv.common.codec.JsonCodec;
import com.iksanov.bootstrapkv.common.dto.FetchRequest;
import com.iksanov.bootstrapkv.common.dto.FetchResult;
import com.iksanov.bootstrapkv.common.dto.Modification;
import com.iksanov.bootstrapkv.common.dto.NodeStatus;
import com.iksanov.bootstrapkv.common.exception.BootstrapException;
import com.iksanov.bootstrapkv.common.exception.NodeConnectionException;
import com.iksanov.bootstrapkv.common.exception.SerializationException;
import com.iksanov.bootstrapkv.node.config.PeerAddress;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link NodeClient} speaking HTTP/1.1 to a remote node over Netty.
 *
 * <p>Key features:
 * <ul>
 *   <li>One short-lived connection per call, closed once the response is read</li>
 *   <li>Connect and request timeouts bounded by {@code requestTimeout}</li>
 *   <li>Non-200 replies, transport errors and malformed bodies all surface as {@link BootstrapException}</li>
 * </ul>
 */
public class HttpNodeClient implements NodeClient {

    private static final Logger log = LoggerFactory.getLogger(HttpNodeClient.class);
    private static final int MAX_CONTENT_LENGTH = 10 * 1024 * 1024;
    private final PeerAddress peer;
    private final JsonCodec codec;
    private final Duration requestTimeout;
    private final EventLoopGroup eventLoopGroup;
    private final boolean ownsEventLoopGroup;
    private final Bootstrap bootstrap;

    public HttpNodeClient(PeerAddress peer, Duration requestTimeout) {
        this(peer, requestTimeout, new JsonCodec(), null);
    }

    public HttpNodeClient(PeerAddress peer, Duration requestTimeout, JsonCodec codec, EventLoopGroup injectedGroup) {
        this.peer = Objects.requireNonNull(peer, "peer");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.ownsEventLoopGroup = (injectedGroup == null);
        this.eventLoopGroup = injectedGroup == null ? new NioEventLoopGroup(1) : injectedGroup;
        this.bootstrap = new Bootstrap()
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, requestTimeout.toMillis()));
    }

    @Override
    public void insert(List<Modification> modifications) {
        exchange(HttpMethod.POST, "/insert", codec.encodeModifications(modifications));
    }

    @Override
    public NodeStatus info() {
        byte[] body = exchange(HttpMethod.GET, "/info", null);
        try {
            return codec.decodeStatus(body);
        } catch (SerializationException e) {
            throw new BootstrapException("Malformed info reply from " + peer + ": " + e.getMessage(), e);
        }
    }

    @Override
    public FetchResult fetch(long begin, long end, long head) {
        byte[] body = exchange(HttpMethod.GET, "/fetch", codec.encodeFetchRequest(new FetchRequest(begin, end, head)));
        try {
            return codec.decodeFetchResult(body);
        } catch (SerializationException e) {
            throw new BootstrapException("Malformed fetch reply from " + peer + ": " + e.getMessage(), e);
        }
    }

    private byte[] exchange(HttpMethod method, String path, byte[] body) {
        CompletableFuture<Reply> replyFuture = new CompletableFuture<>();
        ChannelFuture connectFuture = bootstrap.clone()
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpClientCodec())
                                .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                                .addLast(new ReplyHandler(replyFuture));
                    }
                })
                .connect(peer.host(), peer.port());

        connectFuture.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                replyFuture.completeExceptionally(new NodeConnectionException("Failed to connect to " + peer, future.cause()));
                return;
            }
            FullHttpRequest request = buildRequest(method, path, body);
            future.channel().writeAndFlush(request).addListener((ChannelFutureListener) write -> {
                if (!write.isSuccess()) {
                    replyFuture.completeExceptionally(new NodeConnectionException("Failed to send " + method + " " + path + " to " + peer, write.cause()));
                    write.channel().close();
                }
            });
        });

        try {
            Reply reply = replyFuture.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (reply.status() != HttpResponseStatus.OK.code()) {
                throw new BootstrapException("Peer " + peer + " answered " + reply.status() + " to " + method + " " + path
                        + ": " + new String(reply.body(), StandardCharsets.UTF_8));
            }
            log.trace("{} {} on {} -> {} bytes", method, path, peer, reply.body().length);
            return reply.body();
        } catch (TimeoutException e) {
            throw new NodeConnectionException("Timed out after " + requestTimeout.toMillis() + " ms waiting for " + method + " " + path + " on " + peer, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeConnectionException("Interrupted while waiting for " + method + " " + path + " on " + peer, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BootstrapException be) throw be;
            throw new NodeConnectionException("Request " + method + " " + path + " to " + peer + " failed", cause);
        } finally {
            if (!replyFuture.isDone()) replyFuture.cancel(false);
            Channel ch = connectFuture.channel();
            if (ch != null && ch.isOpen()) ch.close();
        }
    }

    private FullHttpRequest buildRequest(HttpMethod method, String path, byte[] body) {
        FullHttpRequest request = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, method, path,
                body == null ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(body));
        request.headers().set(HttpHeaderNames.HOST, peer.host() + ":" + peer.port());
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        request.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, body == null ? 0 : body.length);
        if (body != null) request.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
        return request;
    }

    @Override
    public void close() {
        if (ownsEventLoopGroup) {
            eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly(3, TimeUnit.SECONDS);
            log.debug("HttpNodeClient for {} closed", peer);
        }
    }

    private record Reply(int status, byte[] body) {
    }

    private static class ReplyHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

        private final CompletableFuture<Reply> replyFuture;

        ReplyHandler(CompletableFuture<Reply> replyFuture) {
            this.replyFuture = replyFuture;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            replyFuture.complete(new Reply(response.status().code(), ByteBufUtil.getBytes(response.content())));
            ctx.close();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("Channel error: {}", cause.getMessage());
            replyFuture.completeExceptionally(new NodeConnectionException("Channel error: " + cause.getMessage(), cause));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!replyFuture.isDone()) {
                replyFuture.completeExceptionally(new NodeConnectionException("Connection closed before a response was received"));
            }
            ctx.fireChannelInactive();
        }
    }
}
