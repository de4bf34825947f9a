package com.browseflow.browseflow_backend.controller;

import com.browseflow.browseflow_backend.model.context.BatchStatus;
import com.browseflow.browseflow_backend.model.domain.BatchSourceType;
import com.browseflow.browseflow_backend.model.dto.BatchRunRequest;
import com.browseflow.browseflow_backend.model.dto.BatchStatusView;
import com.browseflow.browseflow_backend.model.dto.ExecutionStatusView;
import com.browseflow.browseflow_backend.model.dto.StopAllResult;
import com.browseflow.browseflow_backend.model.dto.StopBatchResult;
import com.browseflow.browseflow_backend.service.ExecutionManager;
import com.browseflow.browseflow_backend.service.WorkflowEntry;
import com.browseflow.browseflow_backend.service.WorkflowLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
public class BatchController {

    private final ExecutionManager executionManager;
    private final WorkflowLoader   workflowLoader;

    // POST /api/batches: one source per request: folderPath, filePaths or workflows
    @PostMapping
    public ResponseEntity<BatchStatusView> start(@RequestBody BatchRunRequest request) {
        BatchSourceType sourceType;
        String sourcePath = null;
        List<WorkflowEntry> entries;

        if (request.folderPath() != null && !request.folderPath().isBlank()) {
            sourceType = BatchSourceType.FOLDER;
            sourcePath = request.folderPath();
            entries = workflowLoader.loadFolder(request.folderPath());
        } else if (request.filePaths() != null && !request.filePaths().isEmpty()) {
            sourceType = BatchSourceType.FILES;
            entries = workflowLoader.loadFiles(request.filePaths());
        } else if (request.workflows() != null && !request.workflows().isEmpty()) {
            sourceType = BatchSourceType.WORKFLOWS;
            entries = workflowLoader.fromWorkflows(request.workflows());
        } else {
            throw new IllegalArgumentException("One of folderPath, filePaths or workflows is required");
        }

        String batchId = executionManager.startBatch(entries, request, sourceType, sourcePath);
        log.info("Batch {} submitted from {} ({} workflows)", batchId, sourceType, entries.size());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(executionManager.getBatchStatus(batchId));
    }

    // GET /api/batches?status=RUNNING: live batches first, then history
    @GetMapping
    public List<BatchStatusView> list(@RequestParam(required = false) BatchStatus status) {
        return executionManager.listBatches(status);
    }

    @GetMapping("/active")
    public List<BatchStatusView> listActive() {
        return executionManager.getActiveBatches();
    }

    @GetMapping("/{id}")
    public BatchStatusView getStatus(@PathVariable String id) {
        return executionManager.getBatchStatus(id);
    }

    @GetMapping("/{id}/executions")
    public List<ExecutionStatusView> getExecutions(@PathVariable String id) {
        return executionManager.getBatchExecutions(id);
    }

    @PostMapping("/{id}/stop")
    public StopBatchResult stop(@PathVariable String id) {
        return executionManager.stopBatch(id);
    }

    @PostMapping("/stop-all")
    public StopAllResult stopAll() {
        return executionManager.stopAll();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id) {
        executionManager.deleteBatch(id);
        return ResponseEntity.ok(Map.<String, Object>of("batchId", id, "deleted", true));
    }
}
