package com.iksanov.bootstrapkv.node.bootstrap;

import com.iksanov.bootstrapkv.common.dto.FetchResult;
import com.iksanov.bootstrapkv.common.dto.Modification;
import com.iksanov.bootstrapkv.common.dto.NodeStatus;
import com.iksanov.bootstrapkv.common.exception.BootstrapException;
import com.iksanov.bootstrapkv.common.exception.KvException;
import com.iksanov.bootstrapkv.node.config.BootstrapConfig;
import com.iksanov.bootstrapkv.node.core.KvNode;
import com.iksanov.bootstrapkv.node.metrics.BootstrapMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * BootstrapDriver copies a remote node into the local {@link KvNode}, once.
 *
 * <p>State machine:
 * <ul>
 *   <li>INIT: remote info gives {@code (head, size)}; the cursor starts at 0 and the target is the remote size</li>
 *   <li>FETCHING: each round fetches {@code [index, min(index + chunk, target))} plus the diff since the tracked
 *       head, appends entries then diff as one local batch, moves the tracked head and advances the cursor by the
 *       chunk size, then waits one fetch period</li>
 *   <li>CAUGHT_UP: the cursor reached the target; no further synchronization happens</li>
 *   <li>CANCELLED: {@link #cancel()} was observed while waiting between rounds or between retries</li>
 *   <li>FAILED: a remote call kept failing after the retry budget, or the local append failed</li>
 * </ul>
 *
 * <p>The cursor advances by the chunk size even when the remote returned fewer entries, so keys removed on the
 * remote during the transfer can make later keys shift below the cursor and be skipped. The same happens when the
 * remote caps pages below {@link BootstrapConfig#maxChunkSize()}; every short page is logged at WARN and counted.
 *
 * <p>Every failure stays on the driver thread; the serving node is never affected.
 */
public class BootstrapDriver {

    private static final Logger log = LoggerFactory.getLogger(BootstrapDriver.class);
    private final NodeClient remote;
    private final KvNode local;
    private final BootstrapConfig config;
    private final BootstrapMetrics metrics;
    private final String name;
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final CompletableFuture<BootstrapState> completion = new CompletableFuture<>();
    private final AtomicReference<BootstrapState> state = new AtomicReference<>(BootstrapState.INIT);
    private volatile long index;
    private volatile long target;
    private volatile long trackedHead;
    private ExecutorService executor;

    public BootstrapDriver(String name, NodeClient remote, KvNode local, BootstrapConfig config, BootstrapMetrics metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.remote = Objects.requireNonNull(remote, "remote");
        this.local = Objects.requireNonNull(local, "local");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Runs the state machine on a dedicated daemon thread.
     *
     * @return a future completed with the terminal state
     */
    public synchronized CompletableFuture<BootstrapState> start() {
        if (executor != null) {
            log.warn("Bootstrap from {} already started", name);
            return completion;
        }
        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("bootstrap-" + name);
            thread.setDaemon(true);
            return thread;
        });
        executor.execute(this::run);
        log.info("Bootstrap from {} scheduled ({})", name, config);
        return completion;
    }

    /**
     * Runs the state machine on the calling thread until a terminal state is reached.
     */
    public BootstrapState run() {
        BootstrapState terminal;
        try {
            terminal = drive();
        } catch (Cancelled c) {
            terminal = BootstrapState.CANCELLED;
        } catch (BootstrapException e) {
            log.error("Bootstrap from {} abandoned at index {}/{}: {}", name, index, target, e.getMessage());
            terminal = BootstrapState.FAILED;
        } catch (KvException e) {
            log.error("Bootstrap from {} stopped, local node rejected a batch: {}", name, e.getMessage());
            terminal = BootstrapState.FAILED;
        } catch (RuntimeException e) {
            log.error("Bootstrap from {} stopped by unexpected error", name, e);
            terminal = BootstrapState.FAILED;
        }
        state.set(terminal);
        switch (terminal) {
            case CAUGHT_UP -> log.info("[SUCCESS] Bootstrap from {} caught up: {} entries targeted, head={}", name, target, trackedHead);
            case CANCELLED -> log.info("Bootstrap from {} cancelled at index {}/{}", name, index, target);
            default -> log.warn("Bootstrap from {} ended in state {}; node keeps serving standalone", name, terminal);
        }
        completion.complete(terminal);
        return terminal;
    }

    private BootstrapState drive() throws Cancelled {
        NodeStatus status = callWithRetry("info", remote::info);
        index = 0;
        target = status.size();
        trackedHead = status.head();
        metrics.updateProgress(index, target);
        log.info("Bootstrap from {} starting: remote head={}, size={}", name, trackedHead, target);
        state.set(BootstrapState.FETCHING);

        int chunk = config.maxChunkSize();
        while (index < target) {
            long begin = index;
            long end = Math.min(begin + chunk, target);
            long since = trackedHead;
            long roundStart = System.nanoTime();

            FetchResult result = callWithRetry("fetch", () -> remote.fetch(begin, end, since));
            trackedHead = result.head();
            List<Modification> batch = new ArrayList<>(result.entries().size() + result.diff().size());
            batch.addAll(result.entries());
            batch.addAll(result.diff());
            local.append(batch);
            index = begin + chunk;
            if (result.entries().size() < end - begin) {
                metrics.incrementShortPages();
                log.warn("Bootstrap from {} got a short page: {} of {} entries for [{}, {}); keys in the gap are not copied "
                                + "(peer chunk size smaller than {}, or keys removed on the peer)",
                        name, result.entries().size(), end - begin, begin, end, chunk);
            }

            metrics.recordRound(result.entries().size(), result.diff().size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - roundStart));
            metrics.updateProgress(index, target);
            log.info("Bootstrap from {} progress: {}/{} (entries={}, diff={}, head={})",
                    name, Math.min(index, target), target, result.entries().size(), result.diff().size(), trackedHead);

            if (index < target && awaitCancellation(config.fetchPeriod())) throw new Cancelled();
        }
        return BootstrapState.CAUGHT_UP;
    }

    private <T> T callWithRetry(String operation, Supplier<T> call) throws Cancelled {
        Duration backoff = config.retryBackoff();
        int attempt = 0;
        while (true) {
            try {
                return call.get();
            } catch (BootstrapException e) {
                metrics.incrementRemoteFailures();
                if (attempt >= config.maxRetries()) throw e;
                attempt++;
                metrics.incrementRetries();
                log.warn("Remote {} on {} failed ({}), retry {}/{} in {} ms",
                        operation, name, e.getMessage(), attempt, config.maxRetries(), backoff.toMillis());
                if (awaitCancellation(backoff)) throw new Cancelled();
                backoff = backoff.multipliedBy(2);
            }
        }
    }

    /**
     * @return true if cancellation was requested before {@code period} elapsed
     */
    private boolean awaitCancellation(Duration period) {
        try {
            return cancelSignal.await(period.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * Requests cancellation. Observed at the next wait between rounds; a fetch in flight completes first.
     */
    public void cancel() {
        cancelSignal.countDown();
    }

    /**
     * Cancels and waits for the driver thread to finish.
     */
    public synchronized void stop() {
        cancel();
        if (executor == null) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public BootstrapState state() {
        return state.get();
    }

    public long index() {
        return index;
    }

    public long target() {
        return target;
    }

    public long trackedHead() {
        return trackedHead;
    }

    public CompletableFuture<BootstrapState> completion() {
        return completion;
    }

    private static final class Cancelled extends Exception {
        Cancelled() {
            super(null, null, false, false);
        }
    }
}
