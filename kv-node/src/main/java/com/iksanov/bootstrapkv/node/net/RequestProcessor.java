package com.iksanov.bootstrapkv.node.net;

import com.iksanov.bootstrapkv.common.codec.JsonCodec;
import com.iksanov.bootstrapkv.common.dto.FetchRequest;
import com.iksanov.bootstrapkv.common.dto.FetchResult;
import com.iksanov.bootstrapkv.common.dto.Modification;
import com.iksanov.bootstrapkv.common.exception.InvalidRequestException;
import com.iksanov.bootstrapkv.common.exception.SerializationException;
import com.iksanov.bootstrapkv.common.exception.StorageAccessException;
import com.iksanov.bootstrapkv.node.core.KvNode;
import com.iksanov.bootstrapkv.node.metrics.NetMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * RequestProcessor routes {@link NodeRequest} objects to the {@link KvNode} and produces
 * the corresponding {@link NodeResponse}.
 * <p>
 * This class isolates the network layer (Netty) from the node logic:
 *  - resolves {@code POST /insert}, {@code GET /info} and {@code GET /fetch}; anything else is 404
 *  - decodes bodies with {@link JsonCodec}; malformed bodies and invalid ranges are 400
 *  - lock failures and unexpected errors are 500, never propagated to the event loop
 */
public class RequestProcessor {

    private static final Logger log = LoggerFactory.getLogger(RequestProcessor.class);
    private static final long SLOW_REQUEST_THRESHOLD_MS = 100;
    private final KvNode node;
    private final JsonCodec codec;
    private final NetMetrics metrics;

    enum Route {
        INSERT("POST", "/insert"),
        INFO("GET", "/info"),
        FETCH("GET", "/fetch");

        private final String method;
        private final String path;

        Route(String method, String path) {
            this.method = method;
            this.path = path;
        }

        static Route resolve(String method, String path) {
            for (Route route : values()) {
                if (route.method.equalsIgnoreCase(method) && route.path.equals(path)) return route;
            }
            return null;
        }
    }

    public RequestProcessor(KvNode node, JsonCodec codec, NetMetrics metrics) {
        this.node = Objects.requireNonNull(node, "node");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public NodeResponse process(NodeRequest request) {
        Objects.requireNonNull(request, "request");
        Instant start = Instant.now();
        metrics.incrementRequests();
        Route route = Route.resolve(request.method(), request.path());
        try {
            if (route == null) {
                metrics.incrementNotFound();
                log.debug("No route for {} {} (requestId={})", request.method(), request.path(), request.requestId());
                return NodeResponse.notFound(request.requestId());
            }
            return switch (route) {
                case INSERT -> handleInsert(request);
                case INFO -> handleInfo(request);
                case FETCH -> handleFetch(request);
            };
        } catch (SerializationException | InvalidRequestException e) {
            metrics.incrementClientErrors();
            log.warn("Rejected {} {} (requestId={}): {}", request.method(), request.path(), request.requestId(), e.getMessage());
            return NodeResponse.badRequest(request.requestId(), e.getMessage());
        } catch (StorageAccessException e) {
            metrics.incrementServerErrors();
            log.error("Storage unavailable for requestId={}: {}", request.requestId(), e.getMessage());
            return NodeResponse.internalError(request.requestId(), e.getMessage());
        } catch (Exception e) {
            metrics.incrementServerErrors();
            log.error("Unexpected error while processing requestId={}", request.requestId(), e);
            return NodeResponse.internalError(request.requestId(), "Internal server error");
        } finally {
            long durationMs = Duration.between(start, Instant.now()).toMillis();
            metrics.recordRequestDuration(durationMs);
            if (durationMs > SLOW_REQUEST_THRESHOLD_MS) {
                log.warn("Slow request [{} {}, requestId={}] took {} ms", request.method(), request.path(), request.requestId(), durationMs);
            } else {
                log.debug("Request [{} {}, requestId={}] processed in {} ms", request.method(), request.path(), request.requestId(), durationMs);
            }
        }
    }

    private NodeResponse handleInsert(NodeRequest request) {
        List<Modification> modifications = codec.decodeModifications(request.body());
        long head = node.append(modifications);
        log.trace("INSERT {} modifications -> head={}", modifications.size(), head);
        return NodeResponse.ok(request.requestId());
    }

    private NodeResponse handleInfo(NodeRequest request) {
        return NodeResponse.ok(request.requestId(), codec.encodeStatus(node.info()));
    }

    private NodeResponse handleFetch(NodeRequest request) {
        FetchRequest fetch = codec.decodeFetchRequest(request.body());
        FetchResult result = node.fetch(fetch.begin(), fetch.end(), fetch.head());
        return NodeResponse.ok(request.requestId(), codec.encodeFetchResult(result));
    }
}
