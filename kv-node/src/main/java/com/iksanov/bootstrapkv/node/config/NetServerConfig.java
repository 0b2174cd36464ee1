package com.iksanov.bootstrapkv.node.config;

/**
 * Configuration holder for NetServer.
 * Defines all tunable parameters for networking.
 */
public record NetServerConfig(String host, int port, int bossThreads, int workerThreads, int backlog,
                              int maxContentLength, int shutdownQuietPeriodSeconds, int shutdownTimeoutSeconds) {
}
