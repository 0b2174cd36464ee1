package com.iksanov.bootstrapkv.node.integration;

import com.iksanov.bootstrapkv.common.codec.JsonCodec;
import com.iksanov.bootstrapkv.common.dto.Modification;
import com.iksanov.bootstrapkv.node.app.KvNodeApplication;
import com.iksanov.bootstrapkv.node.bootstrap.BootstrapState;
import com.iksanov.bootstrapkv.node.bootstrap.HttpNodeClient;
import com.iksanov.bootstrapkv.node.config.NodeConfig;
import com.iksanov.bootstrapkv.node.config.PeerAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Full application lifecycle: start, bootstrap from a peer, shut down and dump.
 */
class KvNodeApplicationTest {

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    @Test
    @DisplayName("Second node copies the first and prints its contents on shutdown")
    void shouldBootstrapAndDumpOnShutdown() throws Exception {
        Map<String, String> env = Map.of("KV_BOOTSTRAP_FETCH_PERIOD_MS", "10");
        int sourcePort = freePort();
        NodeConfig sourceConfig = NodeConfig.fromArgs(new String[]{String.valueOf(sourcePort)}, env::get);
        ByteArrayOutputStream sourceDump = new ByteArrayOutputStream();
        KvNodeApplication source = new KvNodeApplication(sourceConfig, new PrintStream(sourceDump, true, StandardCharsets.UTF_8));
        source.start();

        KvNodeApplication copy = null;
        try (HttpNodeClient client = new HttpNodeClient(new PeerAddress("127.0.0.1", sourcePort), Duration.ofSeconds(2))) {
            client.insert(List.of(Modification.update("beta", "2"), Modification.update("alpha", "1")));

            NodeConfig copyConfig = NodeConfig.fromArgs(new String[]{String.valueOf(freePort()), String.valueOf(sourcePort)}, env::get);
            ByteArrayOutputStream copyDump = new ByteArrayOutputStream();
            copy = new KvNodeApplication(copyConfig, new PrintStream(copyDump, true, StandardCharsets.UTF_8));
            copy.start();

            assertThat(copy.bootstrapDriver().completion().get(10, TimeUnit.SECONDS)).isEqualTo(BootstrapState.CAUGHT_UP);
            copy.shutdown();
            copy.awaitShutdown();

            assertThat(copyDump.toString(StandardCharsets.UTF_8).lines()).containsExactly("alpha - 1", "beta - 2");
            assertThat(copy.netServer().isRunning()).isFalse();
        } finally {
            if (copy != null) copy.shutdown();
            source.shutdown();
        }
        assertThat(sourceDump.toString(StandardCharsets.UTF_8).lines()).containsExactly("alpha - 1", "beta - 2");
    }

    @Test
    @DisplayName("Standalone node has no bootstrap driver and dumps nothing when empty")
    void shouldRunStandalone() throws Exception {
        NodeConfig config = NodeConfig.fromArgs(new String[]{String.valueOf(freePort())}, key -> null);
        ByteArrayOutputStream dump = new ByteArrayOutputStream();
        KvNodeApplication app = new KvNodeApplication(config, new PrintStream(dump, true, StandardCharsets.UTF_8));

        app.start();
        assertThat(app.bootstrapDriver()).isNull();
        assertThat(app.netServer().isRunning()).isTrue();
        app.shutdown();
        app.shutdown();

        assertThat(dump.size()).isZero();
    }

    @Test
    @DisplayName("Startup banner example is a valid /insert body")
    void shouldPrintDecodableInsertExample() {
        String example = KvNodeApplication.insertExample();

        assertThat(example).isEqualTo("[{\"Update\":[\"key\",\"value\"]}]");
        assertThat(new JsonCodec().decodeModifications(example.getBytes(StandardCharsets.UTF_8)))
                .containsExactly(Modification.update("key", "value"));
    }
}
