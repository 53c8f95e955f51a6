package com.example.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 摄取队列服务启动类
 */
@SpringBootApplication
@EnableScheduling
public class IngestionQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestionQueueApplication.class, args);
    }
}
