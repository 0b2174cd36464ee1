package com.iksanov.bootstrapkv.node.net;

import java.util.Objects;

/**
 * Transport-neutral view of an inbound HTTP request: method, path without query string, and raw body.
 */
public record NodeRequest(String requestId, String method, String path, byte[] body) {
    public NodeRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        body = body == null ? new byte[0] : body;
    }

    public static NodeRequest of(String method, String path, byte[] body) {
        return new NodeRequest(Long.toHexString(System.nanoTime()), method, path, body);
    }
}
