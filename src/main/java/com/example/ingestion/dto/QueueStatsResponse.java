package com.example.ingestion.dto;

/**
 * 队列统计
 * 
 * @param queued 排队中的任务数
 * @param processing 处理中的任务数
 * @param completed 已完成的任务数
 * @param failed 失败的任务数
 * @param cancelled 已取消的任务数
 * @param total 当前积压（queued + processing）
 */
public record QueueStatsResponse(long queued, long processing, long completed,
                                 long failed, long cancelled, long total) {
}
