package com.example.ingestion.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * 提交摄取任务的请求DTO
 * 
 * @param subjectId 主体ID（知识库拥有者），同一主体同时只能有一个活动任务
 * @param resourceId 结果的下游消费方ID
 * @param selectedFiles 待处理的文件ID列表，允许为空列表
 * @param options 处理选项（可选）
 * @param priority 优先级（可选，默认0，越大越先处理）
 */
public record SubmitIngestionRequest(
        @NotBlank(message = "subjectId不能为空")
        @Size(max = 64, message = "subjectId长度不能超过64")
        String subjectId,
        @NotBlank(message = "resourceId不能为空")
        @Size(max = 128, message = "resourceId长度不能超过128")
        String resourceId,
        @NotNull(message = "文件列表不能为null")
        List<String> selectedFiles,
        Map<String, Object> options,
        Integer priority
) {
}
