package com.ciro.jtemplatex.engine;

public enum PipelineState {
    IDLE,
    PREPARING,
    READY,
    FLUSHING,
    COMPLETED,
    ERROR;

    public boolean isBusy() {
        return this == PREPARING || this == READY || this == FLUSHING;
    }
}
