package com.iksanov.bootstrapkv.common.exception;

public class StorageAccessException extends KvException {
    public StorageAccessException(String message) {
        super(message);
    }
    public StorageAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
