package com.iksanov.bootstrapkv.common.dto;

import java.util.Objects;

/**
 * A single change to the key-value store: either an UPDATE of a key to a value
 * or a DELETE of a key. Applying the same modification twice yields the same state.
 */
public record Modification(Type type, String key, String value) {
    public enum Type {UPDATE, DELETE}

    public Modification {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "key");
        switch (type) {
            case UPDATE -> Objects.requireNonNull(value, "value must not be null for UPDATE");
            case DELETE -> {
                if (value != null) throw new IllegalArgumentException("DELETE must not carry a value");
            }
        }
    }

    public static Modification update(String key, String value) {
        return new Modification(Type.UPDATE, key, value);
    }

    public static Modification delete(String key) {
        return new Modification(Type.DELETE, key, null);
    }

    @Override
    public String toString() {
        return "Modification{" + type + " " + key + (value == null ? "" : "=" + value) + '}';
    }
}
