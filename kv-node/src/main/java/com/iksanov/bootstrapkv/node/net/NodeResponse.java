package com.iksanov.bootstrapkv.node.net;

import java.nio.charset.StandardCharsets;

/**
 * Result of processing a {@link NodeRequest}.
 * <p>
 * OK responses carry a JSON body (possibly empty); error responses carry a plain-text message.
 */
public record NodeResponse(String requestId, Status status, byte[] body, String contentType) {
    public enum Status {
        OK(200), BAD_REQUEST(400), NOT_FOUND(404), INTERNAL_ERROR(500);

        private final int code;

        Status(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }
    }

    private static final String JSON = "application/json";
    private static final String TEXT = "text/plain; charset=utf-8";

    public static NodeResponse ok(String id) {
        return new NodeResponse(id, Status.OK, new byte[0], JSON);
    }

    public static NodeResponse ok(String id, byte[] json) {
        return new NodeResponse(id, Status.OK, json, JSON);
    }

    public static NodeResponse badRequest(String id, String message) {
        return new NodeResponse(id, Status.BAD_REQUEST, message.getBytes(StandardCharsets.UTF_8), TEXT);
    }

    public static NodeResponse notFound(String id) {
        return new NodeResponse(id, Status.NOT_FOUND, new byte[0], TEXT);
    }

    public static NodeResponse internalError(String id, String message) {
        return new NodeResponse(id, Status.INTERNAL_ERROR, message.getBytes(StandardCharsets.UTF_8), TEXT);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
