package com.iksanov.bootstrapkv.node.bootstrap;

import com.iksanov.bootstrapkv.common.dto.FetchResult;
import com.iksanov.bootstrapkv.common.dto.Modification;
import com.iksanov.bootstrapkv.common.dto.NodeStatus;
import com.iksanov.bootstrapkv.common.exception.BootstrapException;

import java.util.List;

/**
 * Client side of the node transport contract.
 * <p>
 * All calls are synchronous and bounded by the implementation's request timeout.
 * Any transport or decoding failure surfaces as {@link BootstrapException}.
 */
public interface NodeClient extends AutoCloseable {

    void insert(List<Modification> modifications);

    NodeStatus info();

    FetchResult fetch(long begin, long end, long head);

    @Override
    void close();
}
