package com.iksanov.bootstrapkv.common.exception;

public class ConfigurationException extends KvException {
    public ConfigurationException(String message) {
        super(message);
    }
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
