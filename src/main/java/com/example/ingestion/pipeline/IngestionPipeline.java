package com.example.ingestion.pipeline;

/**
 * 外部摄取流水线（文本抽取、分块、向量化、存储）的契约
 * 
 * <p>由Worker在自己的线程上同步调用，一次只执行一个任务。
 * 实现方可以长时间阻塞，但必须通过 {@link ProgressListener} 上报进度。
 * </p>
 */
public interface IngestionPipeline {

    /**
     * 执行一次摄取
     *
     * @param request 任务信息与载荷
     * @param listener 进度回调
     * @return 执行结果，包含逐文件的失败信息
     * @throws PipelineException 整体失败；是否可重试由异常决定
     */
    PipelineResult run(PipelineRequest request, ProgressListener listener) throws PipelineException;
}
