package com.iksanov.bootstrapkv.common.exception;

public class KvException extends RuntimeException {
    public KvException(String message) {
        super(message);
    }
    public KvException(String message, Throwable cause) {
        super(message, cause);
    }
}
