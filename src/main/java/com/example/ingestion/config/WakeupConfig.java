package com.example.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 跨进程唤醒配置
 * 
 * <p>开启后，每次入队都会向Kafka主题发送一条通知，消费到通知的进程立即唤醒本地Worker。
 * 未开启时只依赖进程内事件和定时轮询。
 * </p>
 */
@Configuration
@ConfigurationProperties(prefix = "ingestion.wakeup.kafka")
public class WakeupConfig {

    private boolean enabled = false;

    private String topic = KafkaConstants.TASK_ENQUEUED_TOPIC;

    private int partitions = 1;

    private short replicas = 1;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public int getPartitions() {
        return partitions;
    }

    public void setPartitions(int partitions) {
        this.partitions = partitions;
    }

    public short getReplicas() {
        return replicas;
    }

    public void setReplicas(short replicas) {
        this.replicas = replicas;
    }
}
