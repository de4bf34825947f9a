package com.browseflow.browseflow_backend.repository;

import com.browseflow.browseflow_backend.model.context.ExecutionStatus;
import com.browseflow.browseflow_backend.model.domain.ExecutionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, String> {

    List<ExecutionRecord> findByBatchIdOrderByCreatedAtAsc(String batchId);

    List<ExecutionRecord> findByBatchIdAndStatusIn(String batchId, Collection<ExecutionStatus> statuses);

    long deleteByBatchId(String batchId);
}
