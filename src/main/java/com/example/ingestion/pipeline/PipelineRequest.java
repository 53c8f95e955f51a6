package com.example.ingestion.pipeline;

import com.example.ingestion.model.IngestionPayload;

/**
 * 交给流水线执行的一次摄取请求
 * 
 * @param taskId 任务ID
 * @param subjectId 主体ID
 * @param resourceId 下游消费方ID
 * @param payload 文件列表与选项
 * @param attempt 第几次执行（从1开始）
 */
public record PipelineRequest(String taskId, String subjectId, String resourceId,
                              IngestionPayload payload, int attempt) {
}
