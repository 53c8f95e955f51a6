package com.example.ingestion.dto;

import com.example.ingestion.model.WorkerState;

/**
 * Worker运行状态
 * 
 * @param state 生命周期状态
 * @param currentTaskId 正在处理的任务ID，空闲时为null
 * @param pollIntervalMs 轮询间隔（毫秒）
 * @param processedTasks 启动以来处理过的任务数
 */
public record WorkerStatusResponse(WorkerState state, String currentTaskId,
                                   long pollIntervalMs, long processedTasks) {
}
