package com.example.ingestion.service;

/**
 * 任务入队事件，在入队事务提交后用于唤醒Worker
 */
public record TaskEnqueuedEvent(String taskId, String subjectId, int priority) {
}
