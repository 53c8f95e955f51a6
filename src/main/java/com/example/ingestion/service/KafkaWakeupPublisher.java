package com.example.ingestion.service;

import com.example.ingestion.config.WakeupConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 入队通知的Kafka发布者
 * 
 * <p>入队事务提交后把通知发送到Kafka主题，其他进程的Worker收到后立即轮询。
 * 发送失败只记录日志，任务仍会在下一个轮询周期被处理。
 * </p>
 */
@Component
@ConditionalOnProperty(prefix = "ingestion.wakeup.kafka", name = "enabled", havingValue = "true")
public class KafkaWakeupPublisher {

    private static final Logger logger = LoggerFactory.getLogger(KafkaWakeupPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final WakeupConfig wakeupConfig;

    public KafkaWakeupPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                ObjectMapper objectMapper,
                                WakeupConfig wakeupConfig) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.wakeupConfig = wakeupConfig;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTaskEnqueued(TaskEnqueuedEvent event) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("taskId", event.taskId());
        message.put("subjectId", event.subjectId());
        message.put("priority", event.priority());

        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize wake-up message for task {}", event.taskId(), e);
            return;
        }

        // 使用subjectId作为key，同一主体的通知落在同一分区
        kafkaTemplate.send(wakeupConfig.getTopic(), event.subjectId(), json)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        logger.warn("Failed to publish wake-up for task {}: {}", event.taskId(), ex.getMessage());
                    } else {
                        logger.debug("Wake-up published for task {}, offset {}",
                                event.taskId(), result.getRecordMetadata().offset());
                    }
                });
    }
}
