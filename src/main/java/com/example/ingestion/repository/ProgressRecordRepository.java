package com.example.ingestion.repository;

import com.example.ingestion.entity.ProgressRecordEntity;
import com.example.ingestion.model.ProgressStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 摄取进度数据访问层
 */
@Repository
public interface ProgressRecordRepository extends JpaRepository<ProgressRecordEntity, String> {

    Optional<ProgressRecordEntity> findBySubjectId(String subjectId);

    List<ProgressRecordEntity> findByStatusInOrderByUpdatedAtDesc(Collection<ProgressStatus> statuses);
}
