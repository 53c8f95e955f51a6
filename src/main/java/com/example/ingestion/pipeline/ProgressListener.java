package com.example.ingestion.pipeline;

import com.example.ingestion.model.ProgressUpdate;

/**
 * 流水线进度回调
 * 
 * <p>由Worker绑定到当前任务的主体后传入流水线。流水线可以在同一线程内同步、频繁地调用它
 * （至少每处理完一个批次调用一次），回调内部的异常不会传播回流水线。
 * </p>
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ProgressUpdate update);
}
