package com.example.ingestion.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka配置类
 * 
 * <p>仅在开启跨进程唤醒时生效，确保入队通知主题在启动时存在。
 * </p>
 */
@Configuration
@ConditionalOnProperty(prefix = "ingestion.wakeup.kafka", name = "enabled", havingValue = "true")
public class KafkaConfig {

    @Bean
    public NewTopic taskEnqueuedTopic(WakeupConfig wakeupConfig) {
        return TopicBuilder.name(wakeupConfig.getTopic())
                .partitions(wakeupConfig.getPartitions())
                .replicas(wakeupConfig.getReplicas())
                .build();
    }
}
