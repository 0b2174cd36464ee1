package com.iksanov.bootstrapkv.node.core;

import com.iksanov.bootstrapkv.common.dto.Modification;

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Ordered key-value map holding the live state of a node.
 * Implementations are not required to be thread-safe: {@link KvNode} serializes every access.
 */
public interface KeyValueStore {
    void apply(Modification modification);

    /**
     * Returns up to {@code count} entries starting at the {@code offset}-th key in ascending key order.
     * Keys inserted or removed between two calls shift the positions of the following entries.
     */
    List<Map.Entry<String, String>> page(long offset, int count);

    int size();

    void forEach(BiConsumer<String, String> action);
}
