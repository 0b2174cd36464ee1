package com.iksanov.bootstrapkv.node.core;

import com.iksanov.bootstrapkv.common.dto.FetchResult;
import com.iksanov.bootstrapkv.common.dto.Heads;
import com.iksanov.bootstrapkv.common.dto.Modification;
import com.iksanov.bootstrapkv.common.dto.NodeStatus;
import com.iksanov.bootstrapkv.common.exception.InvalidRequestException;
import com.iksanov.bootstrapkv.common.exception.StorageAccessException;
import com.iksanov.bootstrapkv.node.metrics.StoreMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Single owner of a node's {@link KeyValueStore} and {@link ModificationLog}.
 * <p>
 * One exclusive lock guards both structures jointly and every public operation is exactly one
 * critical section, so a batch is either fully applied and recorded or not visible at all.
 * The store and the log never escape this class; callers only see copies.
 * <p>
 * Acquiring the lock is bounded by {@code lockTimeout}. An operation that cannot acquire it
 * fails with {@link StorageAccessException} without touching shared state.
 */
public class KvNode {

    private static final Logger log = LoggerFactory.getLogger(KvNode.class);
    public static final int DEFAULT_MAX_CHUNK_SIZE = 20;
    public static final int DEFAULT_LOG_CAPACITY = 1000;
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final KeyValueStore store;
    private final ModificationLog modificationLog;
    private final int maxChunkSize;
    private final long lockTimeoutNanos;
    private final ReentrantLock lock = new ReentrantLock();
    private final StoreMetrics metrics;

    public KvNode() {
        this(DEFAULT_MAX_CHUNK_SIZE, DEFAULT_LOG_CAPACITY, DEFAULT_LOCK_TIMEOUT, new StoreMetrics());
    }

    public KvNode(int maxChunkSize, int logCapacity, Duration lockTimeout, StoreMetrics metrics) {
        this(new SortedMapKeyValueStore(), new ModificationLog(logCapacity), maxChunkSize, lockTimeout, metrics);
    }

    KvNode(KeyValueStore store, ModificationLog modificationLog, int maxChunkSize, Duration lockTimeout, StoreMetrics metrics) {
        if (maxChunkSize <= 0) throw new IllegalArgumentException("maxChunkSize must be > 0");
        Objects.requireNonNull(lockTimeout, "lockTimeout");
        if (lockTimeout.isNegative()) throw new IllegalArgumentException("lockTimeout must not be negative");
        this.store = Objects.requireNonNull(store, "store");
        this.modificationLog = Objects.requireNonNull(modificationLog, "modificationLog");
        this.maxChunkSize = maxChunkSize;
        this.lockTimeoutNanos = lockTimeout.toNanos();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        log.info("KvNode initialized: maxChunkSize={}, logCapacity={}, lockTimeout={}ms",
                maxChunkSize, modificationLog.capacity(), lockTimeout.toMillis());
    }

    /**
     * Applies every modification of {@code batch} in order, then records the batch in the log.
     *
     * @return the head produced by this batch
     * @throws InvalidRequestException if the batch or one of its elements is null
     */
    public long append(List<Modification> batch) {
        List<Modification> modifications = validateBatch(batch);
        Timer.Sample sample = metrics.startTimer();
        long newHead = withLock("append", () -> {
            for (Modification m : modifications) {
                store.apply(m);
            }
            long head = modificationLog.record(modifications);
            metrics.recordAppend(modifications.size(), head, store.size(), modificationLog.size());
            return head;
        });
        metrics.stopAppendTimer(sample);
        log.trace("Appended batch head={} modifications={}", newHead, modifications.size());
        return newHead;
    }

    public NodeStatus info() {
        return withLock("info", () -> new NodeStatus(modificationLog.currentHead(), store.size()));
    }

    /**
     * Reads the snapshot page starting at {@code begin} (at most {@code min(maxChunkSize, end - begin)}
     * entries, as UPDATE modifications) together with the log diff since {@code head}.
     *
     * @throws InvalidRequestException if {@code begin < 0}, {@code end < begin} or {@code head} is not a valid head
     */
    public FetchResult fetch(long begin, long end, long head) {
        if (begin < 0) throw new InvalidRequestException("begin must be >= 0, got " + begin);
        if (end < begin) throw new InvalidRequestException("Invalid range: end (" + end + ") < begin (" + begin + ")");
        if (!Heads.isValid(head)) throw new InvalidRequestException("head out of range: " + head);
        int pageSize = (int) Math.min(maxChunkSize, end - begin);

        Timer.Sample sample = metrics.startTimer();
        FetchResult result = withLock("fetch", () -> {
            List<Map.Entry<String, String>> page = store.page(begin, pageSize);
            List<Modification> entries = new ArrayList<>(page.size());
            for (Map.Entry<String, String> e : page) {
                entries.add(Modification.update(e.getKey(), e.getValue()));
            }
            return new FetchResult(modificationLog.currentHead(), entries, modificationLog.diffSince(head));
        });
        metrics.stopFetchTimer(sample);
        metrics.recordFetch();
        log.debug("Fetch [{}, {}) since head={} -> entries={}, diff={}, head={}",
                begin, end, head, result.entries().size(), result.diff().size(), result.head());
        return result;
    }

    /**
     * Visits every live entry in key order while holding the lock. Diagnostics only.
     */
    public void dump(BiConsumer<String, String> action) {
        Objects.requireNonNull(action, "action");
        withLock("dump", () -> {
            store.forEach(action);
            return null;
        });
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    private List<Modification> validateBatch(List<Modification> batch) {
        if (batch == null) throw new InvalidRequestException("Batch must not be null");
        for (Modification m : batch) {
            if (m == null) throw new InvalidRequestException("Batch must not contain null modifications");
        }
        return List.copyOf(batch);
    }

    private <T> T withLock(String operation, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageAccessException("Interrupted while waiting for node lock during " + operation, e);
        }
        if (!acquired) {
            metrics.recordLockTimeout();
            log.error("Could not acquire node lock for {} within {} ms", operation, TimeUnit.NANOSECONDS.toMillis(lockTimeoutNanos));
            throw new StorageAccessException("Timed out waiting for node lock during " + operation);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
