package com.example.ingestion.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 队列任务状态枚举
 * 
 * <p>定义摄取任务的所有可能状态：
 * <ul>
 *   <li>QUEUED - 任务已入队，等待Worker认领</li>
 *   <li>PROCESSING - Worker正在处理任务</li>
 *   <li>COMPLETED - 任务成功完成</li>
 *   <li>FAILED - 任务失败且不再重试</li>
 *   <li>CANCELLED - 任务在认领前被取消</li>
 * </ul>
 * 终态（COMPLETED、FAILED、CANCELLED）一旦写入便不可再变更。
 * </p>
 */
public enum TaskStatus {
    QUEUED,

    PROCESSING,

    COMPLETED,

    FAILED,

    CANCELLED;

    /**
     * 非终态集合（同一主体同一时刻最多只能有一个处于这些状态的任务）
     */
    public static final Set<TaskStatus> ACTIVE = EnumSet.of(QUEUED, PROCESSING);

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }
}
