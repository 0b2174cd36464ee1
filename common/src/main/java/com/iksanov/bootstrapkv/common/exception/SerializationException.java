package com.iksanov.bootstrapkv.common.exception;

public class SerializationException extends KvException {
    public SerializationException(String message) {
        super(message);
    }
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
