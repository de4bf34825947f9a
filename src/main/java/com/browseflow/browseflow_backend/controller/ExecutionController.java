package com.browseflow.browseflow_backend.controller;

import com.browseflow.browseflow_backend.model.dto.ExecutionStatusView;
import com.browseflow.browseflow_backend.model.dto.SingleRunRequest;
import com.browseflow.browseflow_backend.model.dto.StopExecutionResult;
import com.browseflow.browseflow_backend.service.ExecutionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final ExecutionManager executionManager;

    // POST /api/executions: start one workflow now, outside the batch queue
    @PostMapping
    public ResponseEntity<Map<String, String>> start(@RequestBody SingleRunRequest request) {
        String executionId = executionManager.startSingle(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("executionId", executionId));
    }

    // GET /api/executions: queued and running executions
    @GetMapping
    public List<ExecutionStatusView> listActive() {
        return executionManager.getActiveExecutions();
    }

    // GET /api/executions/latest: id of the most recently started execution
    @GetMapping("/latest")
    public ResponseEntity<Map<String, String>> latest() {
        return executionManager.getMostRecentExecutionId()
                .map(id -> ResponseEntity.ok(Map.of("executionId", id)))
                .orElse(ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}")
    public ExecutionStatusView getStatus(@PathVariable String id) {
        return executionManager.getExecutionStatus(id);
    }

    @PostMapping("/{id}/stop")
    public StopExecutionResult stop(@PathVariable String id) {
        return executionManager.stop(id);
    }

    // The resume calls answer 409 when the execution is not paused
    @PostMapping("/{id}/continue")
    public ResponseEntity<Map<String, Object>> resume(@PathVariable String id) {
        return released(id, executionManager.continueExecution(id));
    }

    @PostMapping("/{id}/skip")
    public ResponseEntity<Map<String, Object>> skip(@PathVariable String id) {
        return released(id, executionManager.skipNode(id));
    }

    @PostMapping("/{id}/continue-without-breakpoint")
    public ResponseEntity<Map<String, Object>> resumeWithoutBreakpoints(@PathVariable String id) {
        return released(id, executionManager.continueWithoutBreakpoint(id));
    }

    private static ResponseEntity<Map<String, Object>> released(String executionId, boolean released) {
        Map<String, Object> body = Map.of("executionId", executionId, "resumed", released);
        return released ? ResponseEntity.ok(body) : ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }
}
