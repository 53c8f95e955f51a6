package com.example.ingestion.exception;

/**
 * 进度记录未找到异常
 */
public class ProgressNotFoundException extends RuntimeException {

    public ProgressNotFoundException(String subjectId) {
        super("No ingestion progress for subject: " + subjectId);
    }
}
