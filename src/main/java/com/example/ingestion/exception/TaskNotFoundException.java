package com.example.ingestion.exception;

/**
 * 任务未找到异常
 */
public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
    }
}
