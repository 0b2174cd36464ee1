package com.iksanov.bootstrapkv.node.core;

import com.iksanov.bootstrapkv.common.dto.Heads;
import com.iksanov.bootstrapkv.common.dto.Modification;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded log of the most recent modification batches, newest first.
 * <p>
 * Every {@link #record(List)} produces the next head (unsigned 32-bit, wrapping to 0)
 * and evicts the oldest batch once {@code capacity} is exceeded. The log only serves
 * catch-up diffs: eviction never affects the store the batches were applied to.
 * <p>
 * Not thread-safe; guarded by the owning {@link KvNode}.
 */
public class ModificationLog {

    private final Deque<Batch> batches = new ArrayDeque<>();
    private final int capacity;
    private long head;

    public ModificationLog(int capacity) {
        this(capacity, 0L);
    }

    ModificationLog(int capacity, long initialHead) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (!Heads.isValid(initialHead)) throw new IllegalArgumentException("initialHead out of range");
        this.capacity = capacity;
        this.head = initialHead;
    }

    public long record(List<Modification> modifications) {
        long newHead = Heads.next(head);
        batches.addFirst(new Batch(newHead, modifications));
        if (batches.size() > capacity) batches.removeLast();
        head = newHead;
        return newHead;
    }

    /**
     * @return head of the most recent batch, or 0 when nothing was recorded yet
     */
    public long currentHead() {
        return head;
    }

    /**
     * Collects the modifications of every retained batch newer than the batch tagged {@code since}.
     * <p>
     * When no retained batch carries that head (never recorded, or already evicted) the whole
     * retained log is returned, so callers must treat a non-empty answer as possibly incomplete.
     * The result is chronological: oldest batch first, each batch in its original order.
     */
    public List<Modification> diffSince(long since) {
        List<Batch> newer = new ArrayList<>();
        for (Batch batch : batches) {
            if (batch.head() == since) break;
            newer.add(batch);
        }
        List<Modification> diff = new ArrayList<>();
        for (int i = newer.size() - 1; i >= 0; i--) {
            diff.addAll(newer.get(i).modifications());
        }
        return diff;
    }

    /**
     * @return head of the oldest retained batch, or -1 when the log is empty
     */
    public long oldestHead() {
        Batch oldest = batches.peekLast();
        return oldest == null ? -1 : oldest.head();
    }

    public List<Batch> batches() {
        return new ArrayList<>(batches);
    }

    public int size() {
        return batches.size();
    }

    public int capacity() {
        return capacity;
    }
}
