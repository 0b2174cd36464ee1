package com.iksanov.bootstrapkv.common.dto;

/**
 * Arithmetic on batch heads. A head is an unsigned 32-bit counter carried in a {@code long}.
 */
public final class Heads {

    public static final long MAX_HEAD = 0xFFFF_FFFFL;

    private Heads() {
    }

    public static long next(long head) {
        return (head + 1) & MAX_HEAD;
    }

    public static boolean isValid(long head) {
        return head >= 0 && head <= MAX_HEAD;
    }
}
