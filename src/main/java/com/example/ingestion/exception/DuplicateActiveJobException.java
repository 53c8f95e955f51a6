package com.example.ingestion.exception;

/**
 * 重复活动任务异常
 * 
 * <p>当某个主体已经有一个QUEUED或PROCESSING状态的任务，又提交了新的摄取请求时抛出。
 * </p>
 */
public class DuplicateActiveJobException extends RuntimeException {

    private final String subjectId;
    private final String activeTaskId;

    public DuplicateActiveJobException(String subjectId, String activeTaskId) {
        super("Subject " + subjectId + " already has an active ingestion task"
                + (activeTaskId != null ? ": " + activeTaskId : ""));
        this.subjectId = subjectId;
        this.activeTaskId = activeTaskId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getActiveTaskId() {
        return activeTaskId;
    }
}
