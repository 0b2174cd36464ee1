package com.iksanov.bootstrapkv.node.core;

import com.iksanov.bootstrapkv.common.dto.Modification;

import java.util.List;

/**
 * Modifications appended together in one call, tagged with the head they produced.
 */
public record Batch(long head, List<Modification> modifications) {
    public Batch {
        modifications = List.copyOf(modifications);
    }
}
