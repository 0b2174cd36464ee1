package com.iksanov.bootstrapkv.node.config;

import com.iksanov.bootstrapkv.common.exception.ConfigurationException;

/**
 * Address of a remote node: {@code host:port}.
 */
public record PeerAddress(String host, int port) {

    public static final String DEFAULT_HOST = "127.0.0.1";

    public PeerAddress {
        if (host == null || host.isBlank()) throw new ConfigurationException("host cannot be null or blank");
        if (port <= 0 || port > 65535) throw new ConfigurationException("port out of range: " + port);
    }

    /**
     * Parses {@code "port"} (loopback host) or {@code "host:port"}.
     */
    public static PeerAddress parse(String value) {
        if (value == null || value.isBlank()) throw new ConfigurationException("Peer address cannot be blank");
        String trimmed = value.trim();
        int colon = trimmed.lastIndexOf(':');
        String host = colon < 0 ? DEFAULT_HOST : trimmed.substring(0, colon);
        String port = colon < 0 ? trimmed : trimmed.substring(colon + 1);
        try {
            return new PeerAddress(host, Integer.parseInt(port));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid port in peer address '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
