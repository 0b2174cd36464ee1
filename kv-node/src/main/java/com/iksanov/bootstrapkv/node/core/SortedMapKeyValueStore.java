package com.iksanov.bootstrapkv.node.core;

import com.iksanov.bootstrapkv.common.dto.Modification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * {@link KeyValueStore} backed by a {@link TreeMap}, so iteration follows natural key order.
 */
public class SortedMapKeyValueStore implements KeyValueStore {

    private final NavigableMap<String, String> data = new TreeMap<>();

    @Override
    public void apply(Modification modification) {
        switch (modification.type()) {
            case UPDATE -> data.put(modification.key(), modification.value());
            case DELETE -> data.remove(modification.key());
        }
    }

    @Override
    public List<Map.Entry<String, String>> page(long offset, int count) {
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
        if (count == 0 || offset >= data.size()) return Collections.emptyList();

        List<Map.Entry<String, String>> page = new ArrayList<>(Math.min(count, data.size()));
        Iterator<Map.Entry<String, String>> it = data.entrySet().iterator();
        for (long skipped = 0; skipped < offset; skipped++) {
            it.next();
        }
        while (it.hasNext() && page.size() < count) {
            Map.Entry<String, String> e = it.next();
            page.add(Map.entry(e.getKey(), e.getValue()));
        }
        return page;
    }

    @Override
    public int size() {
        return data.size();
    }

    @Override
    public void forEach(BiConsumer<String, String> action) {
        data.forEach(action);
    }
}
