package com.iksanov.bootstrapkv.common.exception;

/**
 * Raised when a remote node cannot be reached or the connection drops mid-request.
 * Treated by callers as a recoverable {@link BootstrapException}.
 */
public class NodeConnectionException extends BootstrapException {
    public NodeConnectionException(String message) {
        super(message);
    }
    public NodeConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
