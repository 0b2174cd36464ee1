package com.iksanov.bootstrapkv.node.bootstrap;

/**
 * Lifecycle of a {@link BootstrapDriver}. CAUGHT_UP, CANCELLED and FAILED are terminal.
 */
public enum BootstrapState {
    INIT,
    FETCHING,
    CAUGHT_UP,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == CAUGHT_UP || this == CANCELLED || this == FAILED;
    }
}
