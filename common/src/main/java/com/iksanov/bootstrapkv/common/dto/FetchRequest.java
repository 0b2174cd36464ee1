package com.iksanov.bootstrapkv.common.dto;

/**
 * Asks a node for the snapshot page {@code [begin, end)} together with every
 * modification recorded after {@code head}.
 */
public record FetchRequest(long begin, long end, long head) {
}
