package com.browseflow.browseflow_backend.repository;

import com.browseflow.browseflow_backend.model.context.BatchStatus;
import com.browseflow.browseflow_backend.model.domain.BatchRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface BatchRecordRepository extends JpaRepository<BatchRecord, String> {

    List<BatchRecord> findAllByOrderByCreatedAtDesc();

    List<BatchRecord> findByStatusOrderByCreatedAtDesc(BatchStatus status);

    // Retention cleanup
    List<BatchRecord> findByCompletedAtBefore(Instant cutoff);
}
