package com.example.ingestion.dto;

import com.example.ingestion.model.TaskStatus;

/**
 * 取消任务的响应DTO
 */
public record CancelTaskResponse(String taskId, TaskStatus status) {
}
