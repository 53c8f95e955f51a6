package com.example.ingestion.config;

/**
 * Kafka主题常量定义
 */
public final class KafkaConstants {

    private KafkaConstants() {
        // 工具类，禁止实例化
    }

    /**
     * 任务入队通知主题
     * 
     * <p>只用于唤醒Worker，消息本身不承载任务，任务始终以数据库为准。
     * </p>
     */
    public static final String TASK_ENQUEUED_TOPIC = "ingestion-task-enqueued";

    /**
     * 监听器使用的主题占位符，未配置时回落到默认主题
     */
    public static final String TASK_ENQUEUED_TOPIC_PLACEHOLDER =
            "${ingestion.wakeup.kafka.topic:" + TASK_ENQUEUED_TOPIC + "}";

    /**
     * 每个进程使用独立的消费组，保证每个进程都能收到唤醒通知
     */
    public static final String WAKEUP_GROUP_PLACEHOLDER =
            "${ingestion.wakeup.kafka.group-prefix:ingestion-worker}-${random.uuid}";
}
