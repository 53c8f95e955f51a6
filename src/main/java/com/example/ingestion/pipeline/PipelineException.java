package com.example.ingestion.pipeline;

/**
 * 流水线执行失败
 * 
 * <p>{@code retryable} 为false表示永久性错误（不支持的输入、损坏的载荷），
 * 任务会直接进入FAILED，不消耗剩余的重试次数。
 * </p>
 */
public class PipelineException extends Exception {

    private final boolean retryable;

    public PipelineException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public PipelineException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static PipelineException transientError(String message, Throwable cause) {
        return new PipelineException(message, true, cause);
    }

    public static PipelineException permanent(String message) {
        return new PipelineException(message, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
