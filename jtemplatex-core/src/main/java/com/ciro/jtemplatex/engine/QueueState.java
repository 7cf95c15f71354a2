package com.ciro.jtemplatex.engine;

/** idle → preparing → ready → flushing → idle; cualquier error vuelve a idle. */
public enum QueueState {
    IDLE,
    PREPARING,
    READY,
    FLUSHING
}
