package com.example.ingestion.pipeline;

/**
 * 未提供流水线实现时使用的占位实现，每个任务都以不可重试错误失败
 */
public class UnconfiguredIngestionPipeline implements IngestionPipeline {

    static final String MESSAGE = "No ingestion pipeline configured";

    @Override
    public PipelineResult run(PipelineRequest request, ProgressListener listener) throws PipelineException {
        throw PipelineException.permanent(MESSAGE);
    }
}
