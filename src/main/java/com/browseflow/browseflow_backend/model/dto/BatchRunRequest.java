package com.browseflow.browseflow_backend.model.dto;

import com.browseflow.browseflow_backend.model.domain.Workflow;

import java.util.List;

/**
 * Exactly one source is expected: a folder of workflow files, an explicit file list,
 * or workflows sent inline.
 */
public record BatchRunRequest(
        String         folderPath,
        List<String>   filePaths,
        List<Workflow> workflows,
        Integer        workers,
        Integer        priority,
        String         outputPath,
        Long           slowMo
) {}
