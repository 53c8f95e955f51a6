package com.example.ingestion.dto;

/**
 * 提交摄取任务的响应DTO
 * 
 * @param taskId 生成的任务ID（UUID格式）
 * @param queuePosition 入队后的排队位置，1表示下一个被处理
 */
public record SubmitIngestionResponse(String taskId, Integer queuePosition) {
}
