package com.example.ingestion.repository;

import com.example.ingestion.entity.QueueLockEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 队列锁行的数据访问层
 */
@Repository
public interface QueueLockRepository extends JpaRepository<QueueLockEntity, String> {

    /**
     * SELECT ... FOR UPDATE，锁一直持有到调用方事务结束，必须在事务内调用
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from QueueLockEntity l where l.id = :id")
    Optional<QueueLockEntity> lockById(@Param("id") String id);
}
