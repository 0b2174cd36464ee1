package com.iksanov.bootstrapkv.common.exception;

public class BootstrapException extends KvException {
    public BootstrapException(String message) {
        super(message);
    }
    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
