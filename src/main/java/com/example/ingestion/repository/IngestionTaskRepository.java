package com.example.ingestion.repository;

import com.example.ingestion.entity.IngestionTaskEntity;
import com.example.ingestion.model.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 摄取任务数据访问层
 * 
 * <p>除了基本的CRUD外，这里定义了任务的全部状态迁移。每个迁移都是一条带
 * {@code status} 条件的单行UPDATE，返回值为受影响行数：
 * <ul>
 *   <li>1 - 迁移成功</li>
 *   <li>0 - 任务已不处于期望状态（被其他调用方抢先或已进入终态）</li>
 * </ul>
 * </p>
 */
@Repository
public interface IngestionTaskRepository extends JpaRepository<IngestionTaskEntity, String> {

    /**
     * 按服务顺序（优先级降序、入队时间升序、ID升序）查询可认领的候选任务ID
     */
    @Query("select t.id from IngestionTaskEntity t " +
           "where t.status = com.example.ingestion.model.TaskStatus.QUEUED " +
           "and t.availableAt <= :now " +
           "order by t.priority desc, t.queuedAt asc, t.id asc")
    List<String> findClaimCandidates(@Param("now") LocalDateTime now, Pageable pageable);

    /**
     * 按服务顺序查询某状态下的全部任务，用于重算排队位置和列出队列
     */
    List<IngestionTaskEntity> findByStatusOrderByPriorityDescQueuedAtAscIdAsc(TaskStatus status);

    long countByStatus(TaskStatus status);

    Optional<IngestionTaskEntity> findByActiveSubjectId(String activeSubjectId);

    List<IngestionTaskEntity> findByStatusAndStartedAtBefore(TaskStatus status, LocalDateTime threshold);

    /**
     * QUEUED -> PROCESSING，认领操作的唯一串行化点
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update IngestionTaskEntity t set " +
           "t.status = com.example.ingestion.model.TaskStatus.PROCESSING, " +
           "t.startedAt = :now, t.queuePosition = null, t.updatedAt = :now " +
           "where t.id = :id and t.status = com.example.ingestion.model.TaskStatus.QUEUED")
    int claim(@Param("id") String id, @Param("now") LocalDateTime now);

    /**
     * PROCESSING -> COMPLETED
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update IngestionTaskEntity t set " +
           "t.status = com.example.ingestion.model.TaskStatus.COMPLETED, " +
           "t.completedAt = :now, t.updatedAt = :now, t.activeSubjectId = null, t.queuePosition = null " +
           "where t.id = :id and t.status = com.example.ingestion.model.TaskStatus.PROCESSING")
    int complete(@Param("id") String id, @Param("now") LocalDateTime now);

    /**
     * PROCESSING -> QUEUED（重试或崩溃恢复），刷新排序键使其排到同优先级队尾
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update IngestionTaskEntity t set " +
           "t.status = com.example.ingestion.model.TaskStatus.QUEUED, " +
           "t.retryCount = :retryCount, t.errorMessage = :error, " +
           "t.queuedAt = :now, t.availableAt = :availableAt, t.startedAt = null, t.updatedAt = :now " +
           "where t.id = :id and t.status = com.example.ingestion.model.TaskStatus.PROCESSING")
    int requeue(@Param("id") String id,
                @Param("retryCount") int retryCount,
                @Param("error") String error,
                @Param("now") LocalDateTime now,
                @Param("availableAt") LocalDateTime availableAt);

    /**
     * PROCESSING -> FAILED
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update IngestionTaskEntity t set " +
           "t.status = com.example.ingestion.model.TaskStatus.FAILED, " +
           "t.retryCount = :retryCount, t.errorMessage = :error, " +
           "t.completedAt = :now, t.updatedAt = :now, t.activeSubjectId = null, t.queuePosition = null " +
           "where t.id = :id and t.status = com.example.ingestion.model.TaskStatus.PROCESSING")
    int failTerminal(@Param("id") String id,
                     @Param("retryCount") int retryCount,
                     @Param("error") String error,
                     @Param("now") LocalDateTime now);

    /**
     * QUEUED -> CANCELLED
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update IngestionTaskEntity t set " +
           "t.status = com.example.ingestion.model.TaskStatus.CANCELLED, " +
           "t.completedAt = :now, t.updatedAt = :now, t.activeSubjectId = null, t.queuePosition = null " +
           "where t.id = :id and t.status = com.example.ingestion.model.TaskStatus.QUEUED")
    int cancel(@Param("id") String id, @Param("now") LocalDateTime now);

    /**
     * 写入排队位置，仅对仍处于QUEUED的任务生效
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("update IngestionTaskEntity t set t.queuePosition = :position " +
           "where t.id = :id and t.status = com.example.ingestion.model.TaskStatus.QUEUED")
    int updateQueuePosition(@Param("id") String id, @Param("position") int position);
}
