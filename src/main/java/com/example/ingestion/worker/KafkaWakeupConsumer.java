package com.example.ingestion.worker;

import com.example.ingestion.config.KafkaConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * 消费其他进程发出的入队通知，唤醒本地Worker
 */
@Component
@ConditionalOnProperty(prefix = "ingestion.wakeup.kafka", name = "enabled", havingValue = "true")
public class KafkaWakeupConsumer {

    private static final Logger logger = LoggerFactory.getLogger(KafkaWakeupConsumer.class);

    private final QueueWorker queueWorker;

    public KafkaWakeupConsumer(QueueWorker queueWorker) {
        this.queueWorker = queueWorker;
    }

    @KafkaListener(topics = KafkaConstants.TASK_ENQUEUED_TOPIC_PLACEHOLDER,
                   groupId = KafkaConstants.WAKEUP_GROUP_PLACEHOLDER)
    public void onTaskEnqueued(@Payload String message,
                               @Header(KafkaHeaders.RECEIVED_PARTITION) int partition) {
        logger.debug("Received wake-up from partition {}: {}", partition, message);
        queueWorker.wakeUp();
    }
}
