package com.iksanov.bootstrapkv.common.dto;

import java.util.List;
import java.util.Objects;

/**
 * One round of a snapshot transfer.
 * <p>
 * {@code entries} is the requested page of the store expressed as UPDATE modifications,
 * {@code diff} holds the modifications recorded since the head given in the request and
 * {@code head} is the head of the serving node at the time of the call.
 */
public record FetchResult(long head, List<Modification> entries, List<Modification> diff) {
    public FetchResult {
        if (head < 0 || head > Heads.MAX_HEAD) throw new IllegalArgumentException("head out of range: " + head);
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        diff = List.copyOf(Objects.requireNonNull(diff, "diff"));
    }
}
