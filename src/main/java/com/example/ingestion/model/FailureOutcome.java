package com.example.ingestion.model;

/**
 * 一次失败上报后任务的去向
 * 
 * @param status 任务新状态，QUEUED表示已重新入队，FAILED表示终态失败
 * @param queuePosition 重新入队后的排队位置，终态时为null
 * @param retryCount 更新后的重试次数
 */
public record FailureOutcome(TaskStatus status, Integer queuePosition, int retryCount) {

    public boolean isRequeued() {
        return status == TaskStatus.QUEUED;
    }
}
