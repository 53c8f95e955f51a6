package com.example.ingestion.pipeline;

import java.util.List;
import java.util.Map;

/**
 * 流水线执行结果
 * 
 * @param processedFiles 成功处理的文件数
 * @param failures 处理失败的文件及原因
 * @param metadata 附加的处理元数据，会合并进进度记录
 */
public record PipelineResult(int processedFiles, List<FileFailure> failures, Map<String, Object> metadata) {

    public PipelineResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static PipelineResult success(int processedFiles) {
        return new PipelineResult(processedFiles, List.of(), Map.of());
    }

    public int failedFiles() {
        return failures.size();
    }

    /**
     * 单个文件的失败信息
     */
    public record FileFailure(String file, String error) {
    }
}
