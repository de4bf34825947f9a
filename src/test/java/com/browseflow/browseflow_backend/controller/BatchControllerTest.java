package com.browseflow.browseflow_backend.controller;

import com.browseflow.browseflow_backend.model.context.BatchStatus;
import com.browseflow.browseflow_backend.model.domain.BatchSourceType;
import com.browseflow.browseflow_backend.model.dto.BatchStatusView;
import com.browseflow.browseflow_backend.model.dto.StopBatchResult;
import com.browseflow.browseflow_backend.service.BatchNotFoundException;
import com.browseflow.browseflow_backend.service.ExecutionManager;
import com.browseflow.browseflow_backend.service.WorkflowEntry;
import com.browseflow.browseflow_backend.service.WorkflowLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class BatchControllerTest {

    private final ExecutionManager executionManager = mock(ExecutionManager.class);
    private final WorkflowLoader workflowLoader = mock(WorkflowLoader.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BatchController(executionManager, workflowLoader))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldStartBatchFromFolder() throws Exception {
        List<WorkflowEntry> entries = List.of(WorkflowEntry.invalid("x.json", "/flows/x.json", "broken"));
        when(workflowLoader.loadFolder("/flows")).thenReturn(entries);
        when(executionManager.startBatch(eq(entries), any(), eq(BatchSourceType.FOLDER), eq("/flows")))
                .thenReturn("batch-1");
        when(executionManager.getBatchStatus("batch-1")).thenReturn(view("batch-1"));

        mockMvc.perform(post("/api/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"folderPath\": \"/flows\", \"workers\": 2, \"priority\": 1}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.batchId").value("batch-1"))
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void shouldRequireASource() throws Exception {
        mockMvc.perform(post("/api/batches").contentType(MediaType.APPLICATION_JSON).content("{\"workers\": 2}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldMapUnknownBatchToNotFound() throws Exception {
        when(executionManager.stopBatch("ghost")).thenThrow(new BatchNotFoundException("ghost"));

        mockMvc.perform(post("/api/batches/ghost/stop"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldReturnStopCounts() throws Exception {
        when(executionManager.stopBatch("batch-1")).thenReturn(new StopBatchResult("batch-1", 5, 2, 3));

        mockMvc.perform(post("/api/batches/batch-1/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runningStopped").value(2))
                .andExpect(jsonPath("$.queuedCancelled").value(3));
    }

    @Test
    void shouldListBatchesAndRefuseDeletingRunningOne() throws Exception {
        when(executionManager.listBatches(isNull())).thenReturn(List.of(view("batch-1")));
        doThrow(new IllegalStateException("Batch batch-1 is still running; stop it first"))
                .when(executionManager).deleteBatch("batch-1");

        mockMvc.perform(get("/api/batches"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].batchId").value("batch-1"));
        mockMvc.perform(delete("/api/batches/batch-1"))
                .andExpect(status().isConflict());
        verify(executionManager).deleteBatch("batch-1");
    }

    private static BatchStatusView view(String batchId) {
        return new BatchStatusView(batchId, BatchStatus.RUNNING, BatchSourceType.FOLDER, "/flows",
                1, 0, 1, 0, 0, 0, 0, 0, 2, 1, "./output", null, null, null, List.of(), true);
    }
}
