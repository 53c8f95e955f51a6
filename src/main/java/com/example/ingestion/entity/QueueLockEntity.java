package com.example.ingestion.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * 队列锁行
 * 
 * <p>表中只有一行。每个会重算排队位置的事务都先对这一行加写锁，
 * 保证位置重算读到的是前一个事务提交后的完整队列。
 * </p>
 */
@Entity
@Table(name = "ingestion_queue_lock")
public class QueueLockEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public QueueLockEntity() {
    }

    public QueueLockEntity(String id, LocalDateTime createdAt) {
        this.id = id;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
