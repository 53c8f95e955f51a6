package com.example.ingestion.model;

/**
 * Worker生命周期状态：STOPPED → RUNNING → STOPPING → STOPPED
 */
public enum WorkerState {
    STOPPED,

    RUNNING,

    STOPPING
}
