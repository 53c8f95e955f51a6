package com.example.ingestion.model;

/**
 * 进度记录状态
 */
public enum ProgressStatus {
    PENDING,

    IN_PROGRESS,

    COMPLETED,

    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
