package com.iksanov.bootstrapkv.node.net;

import com.iksanov.bootstrapkv.common.codec.JsonCodec;
import com.iksanov.bootstrapkv.node.core.KvNode;
import com.iksanov.bootstrapkv.node.metrics.NetMetrics;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderResult;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * {@link HttpRequestHandler} on an {@link EmbeddedChannel} backed by a real {@link KvNode}.
 */
class HttpRequestHandlerTest {

    private final NetMetrics metrics = new NetMetrics();
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        RequestProcessor processor = new RequestProcessor(new KvNode(), new JsonCodec(), metrics);
        channel = new EmbeddedChannel(new HttpRequestHandler(processor, metrics));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static FullHttpRequest request(HttpMethod method, String uri, String body) {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri,
                body == null ? Unpooled.EMPTY_BUFFER : Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        request.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, request.content().readableBytes());
        return request;
    }

    private FullHttpResponse exchange(FullHttpRequest request) {
        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        assertThat(response).isNotNull();
        return response;
    }

    private static String body(FullHttpResponse response) {
        String text = response.content().toString(StandardCharsets.UTF_8);
        response.release();
        return text;
    }

    @Test
    @DisplayName("Insert then info over one keep-alive connection")
    void shouldServeInsertThenInfo() {
        FullHttpResponse inserted = exchange(request(HttpMethod.POST, "/insert", "[{\"Update\":[\"a\",\"1\"]}]"));
        assertThat(inserted.status()).isEqualTo(HttpResponseStatus.OK);
        assertThat(inserted.headers().get(HttpHeaderNames.CONNECTION)).isEqualTo(HttpHeaderValues.KEEP_ALIVE.toString());
        assertThat(body(inserted)).isEmpty();

        FullHttpResponse info = exchange(request(HttpMethod.GET, "/info", null));
        assertThat(info.status()).isEqualTo(HttpResponseStatus.OK);
        assertThat(info.headers().get(HttpHeaderNames.CONTENT_TYPE)).isEqualTo("application/json");
        assertThat(body(info)).isEqualTo("[1,1]");
        assertThat(channel.isOpen()).isTrue();
    }

    @Test
    @DisplayName("Query strings are ignored when routing")
    void shouldIgnoreQueryString() {
        FullHttpResponse info = exchange(request(HttpMethod.GET, "/info?verbose=true", null));

        assertThat(info.status()).isEqualTo(HttpResponseStatus.OK);
        assertThat(body(info)).isEqualTo("[0,0]");
    }

    @Test
    @DisplayName("Unknown route answers 404")
    void shouldAnswerNotFound() {
        FullHttpResponse response = exchange(request(HttpMethod.GET, "/missing", null));

        assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
        response.release();
    }

    @Test
    @DisplayName("Invalid fetch range answers 400")
    void shouldAnswerBadRequestForInvalidRange() {
        FullHttpResponse response = exchange(request(HttpMethod.GET, "/fetch", "[5,3,0]"));

        assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
        assertThat(body(response)).contains("Invalid range");
    }

    @Test
    @DisplayName("Connection: close is honoured")
    void shouldCloseWhenRequested() {
        FullHttpRequest request = request(HttpMethod.GET, "/info", null);
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);

        FullHttpResponse response = exchange(request);

        assertThat(response.headers().get(HttpHeaderNames.CONNECTION)).isEqualTo(HttpHeaderValues.CLOSE.toString());
        response.release();
        channel.runPendingTasks();
        assertThat(channel.isOpen()).isFalse();
    }

    @Test
    @DisplayName("Undecodable request answers 400 and closes")
    void shouldRejectUndecodableRequest() {
        FullHttpRequest request = request(HttpMethod.GET, "/info", null);
        request.setDecoderResult(DecoderResult.failure(new IllegalArgumentException("bad header")));

        FullHttpResponse response = exchange(request);

        assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
        response.release();
        channel.runPendingTasks();
        assertThat(channel.isOpen()).isFalse();
    }
}
