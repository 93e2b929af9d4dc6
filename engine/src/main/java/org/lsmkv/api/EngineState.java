package org.lsmkv.api;

public enum EngineState {
    OPEN,
    CLOSING,
    CLOSED
}
