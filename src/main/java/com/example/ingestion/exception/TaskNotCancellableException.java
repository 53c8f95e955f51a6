package com.example.ingestion.exception;

import com.example.ingestion.model.TaskStatus;

/**
 * 任务不可取消异常
 * 
 * <p>只有尚未被认领的QUEUED任务可以取消，正在处理的任务不支持中途取消。
 * </p>
 */
public class TaskNotCancellableException extends RuntimeException {

    public TaskNotCancellableException(String taskId, TaskStatus status) {
        super("Task " + taskId + " cannot be cancelled in status " + status);
    }
}
