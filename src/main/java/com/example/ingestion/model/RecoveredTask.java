package com.example.ingestion.model;

/**
 * 一次崩溃恢复的结果
 * 
 * @param taskId 被恢复的任务ID
 * @param subjectId 任务所属主体
 * @param outcome 走完重试计数后的去向
 */
public record RecoveredTask(String taskId, String subjectId, FailureOutcome outcome) {
}
