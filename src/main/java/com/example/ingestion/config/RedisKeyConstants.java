package com.example.ingestion.config;

/**
 * Redis键常量定义
 */
public final class RedisKeyConstants {

    private RedisKeyConstants() {
        // 工具类，禁止实例化
    }

    /**
     * 进度快照键名前缀
     * 
     * <p>完整键名格式：ingestion:progress:{subjectId}
     * </p>
     */
    public static final String PROGRESS_SNAPSHOT_PREFIX = "ingestion:progress:";

    public static String buildProgressKey(String subjectId) {
        return PROGRESS_SNAPSHOT_PREFIX + subjectId;
    }
}
