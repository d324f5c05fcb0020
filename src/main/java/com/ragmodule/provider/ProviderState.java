package com.ragmodule.provider;

public enum ProviderState {
    UNINITIALIZED,
    INITIALIZING,
    READY
}
