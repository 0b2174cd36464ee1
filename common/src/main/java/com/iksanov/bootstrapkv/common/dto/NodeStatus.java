package com.iksanov.bootstrapkv.common.dto;

/**
 * Answer of the info operation: the current head of the modification log and the number of live keys.
 */
public record NodeStatus(long head, long size) {
    public NodeStatus {
        if (head < 0 || head > Heads.MAX_HEAD) throw new IllegalArgumentException("head out of range: " + head);
        if (size < 0) throw new IllegalArgumentException("size must be >= 0");
    }
}
