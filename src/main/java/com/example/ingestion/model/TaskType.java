package com.example.ingestion.model;

/**
 * 任务类型
 */
public enum TaskType {
    /**
     * 文件摄取：文本抽取、分块、向量化并写入向量库
     */
    FILE_INGESTION
}
