package com.iksanov.bootstrapkv.node.config;

import com.iksanov.bootstrapkv.common.exception.ConfigurationException;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Application configuration record for a key-value node.
 * <p>
 * The listen port and the optional bootstrap peer come from the command line
 * ({@code <listen_port> [bootstrap_peer]}); every other tunable can be overridden through
 * environment variables and falls back to the defaults below.
 * <p>
 * {@code KV_MAX_CHUNK_SIZE} both caps the pages this node serves and sets the stride of its own bootstrap, so it
 * must be the same on every peer. A bootstrap from a peer with a smaller value skips keys.
 */
public record NodeConfig(
        String host,
        int port,
        PeerAddress bootstrapPeer,
        int metricsPort,
        int maxChunkSize,
        int logCapacity,
        long fetchPeriodMillis,
        long requestTimeoutMillis,
        int bootstrapMaxRetries,
        long bootstrapRetryBackoffMillis,
        long lockTimeoutMillis,
        int maxContentLength
) {
    public static final String USAGE = "usage: kv-node <listen_port> [bootstrap_peer]   (bootstrap_peer: port or host:port)";

    public NodeConfig {
        if (host == null || host.isBlank()) throw new ConfigurationException("host cannot be null or blank");
        if (port <= 0 || port > 65535) throw new ConfigurationException("port out of range: " + port);
        if (metricsPort < 0 || metricsPort > 65535) throw new ConfigurationException("metricsPort out of range: " + metricsPort);
        if (maxChunkSize <= 0) throw new ConfigurationException("maxChunkSize must be > 0");
        if (logCapacity <= 0) throw new ConfigurationException("logCapacity must be > 0");
        if (fetchPeriodMillis < 0) throw new ConfigurationException("fetchPeriodMillis must be >= 0");
        if (requestTimeoutMillis <= 0) throw new ConfigurationException("requestTimeoutMillis must be > 0");
        if (bootstrapMaxRetries < 0) throw new ConfigurationException("bootstrapMaxRetries must be >= 0");
        if (bootstrapRetryBackoffMillis < 0) throw new ConfigurationException("bootstrapRetryBackoffMillis must be >= 0");
        if (lockTimeoutMillis <= 0) throw new ConfigurationException("lockTimeoutMillis must be > 0");
        if (maxContentLength <= 0) throw new ConfigurationException("maxContentLength must be > 0");
    }

    public static NodeConfig fromArgs(String[] args) {
        return fromArgs(args, System::getenv);
    }

    /**
     * @throws ConfigurationException on a wrong argument count or an invalid value; the message carries {@link #USAGE}
     */
    public static NodeConfig fromArgs(String[] args, Function<String, String> env) {
        if (args == null || args.length < 1 || args.length > 2) {
            throw new ConfigurationException("Expected 1 or 2 arguments\n" + USAGE);
        }
        int port;
        try {
            port = Integer.parseInt(args[0].trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid listen port '" + args[0] + "'\n" + USAGE, e);
        }
        PeerAddress peer = args.length == 2 ? PeerAddress.parse(args[1]) : null;

        return new NodeConfig(
                getEnv(env, "KV_NODE_HOST", "127.0.0.1"),
                port,
                peer,
                getEnvInt(env, "KV_METRICS_PORT", 0),
                getEnvInt(env, "KV_MAX_CHUNK_SIZE", 20),
                getEnvInt(env, "KV_LOG_CAPACITY", 1000),
                getEnvLong(env, "KV_BOOTSTRAP_FETCH_PERIOD_MS", 1000),
                getEnvLong(env, "KV_REQUEST_TIMEOUT_MS", 5000),
                getEnvInt(env, "KV_BOOTSTRAP_MAX_RETRIES", 3),
                getEnvLong(env, "KV_BOOTSTRAP_RETRY_BACKOFF_MS", 500),
                getEnvLong(env, "KV_LOCK_TIMEOUT_MS", 5000),
                getEnvInt(env, "KV_MAX_CONTENT_LENGTH", 10 * 1024 * 1024)
        );
    }

    public static NodeConfig defaults(int port) {
        return new NodeConfig("127.0.0.1", port, null, 0, 20, 1000, 1000, 5000, 3, 500, 5000, 10 * 1024 * 1024);
    }

    public Optional<PeerAddress> bootstrapPeerOptional() {
        return Optional.ofNullable(bootstrapPeer);
    }

    public NetServerConfig toNetServerConfig() {
        return new NetServerConfig(host, port, 1, 0, 128, maxContentLength, 2, 10);
    }

    public BootstrapConfig toBootstrapConfig() {
        return new BootstrapConfig(
                Duration.ofMillis(fetchPeriodMillis),
                maxChunkSize,
                Duration.ofMillis(requestTimeoutMillis),
                bootstrapMaxRetries,
                Duration.ofMillis(bootstrapRetryBackoffMillis));
    }

    public Duration lockTimeout() {
        return Duration.ofMillis(lockTimeoutMillis);
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    private static int getEnvInt(Function<String, String> env, String key, int defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static long getEnvLong(Function<String, String> env, String key, long defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + key + ": '" + value + "'", e);
        }
    }
}
