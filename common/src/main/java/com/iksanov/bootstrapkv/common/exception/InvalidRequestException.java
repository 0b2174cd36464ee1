package com.iksanov.bootstrapkv.common.exception;

public class InvalidRequestException extends KvException {
    public InvalidRequestException(String message) {
        super(message);
    }
    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
