package com.browseflow.browseflow_backend.service;

import com.browseflow.browseflow_backend.model.domain.FlowEdge;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import com.browseflow.browseflow_backend.model.domain.Workflow;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads workflow JSON into batch entries. Unreadable or structurally broken workflows
 * become invalid entries, not errors, so they never take a worker slot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowLoader {

    private final ObjectMapper objectMapper;

    public List<WorkflowEntry> loadFolder(String folderPath) {
        Path folder = Paths.get(folderPath);
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("Folder not found: " + folderPath);
        }
        try (Stream<Path> files = Files.list(folder)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".json"))
                    .sorted()
                    .map(this::loadFile)
                    .toList();
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read folder " + folderPath + ": " + e.getMessage(), e);
        }
    }

    public List<WorkflowEntry> loadFiles(List<String> filePaths) {
        return filePaths.stream().map(Paths::get).map(this::loadFile).toList();
    }

    public List<WorkflowEntry> fromWorkflows(List<Workflow> workflows) {
        List<WorkflowEntry> entries = new ArrayList<>();
        for (int i = 0; i < workflows.size(); i++) {
            String name = "workflow-" + (i + 1);
            Workflow workflow = workflows.get(i);
            List<String> errors = structuralErrors(workflow);
            entries.add(errors.isEmpty()
                    ? WorkflowEntry.valid(name, null, workflow)
                    : WorkflowEntry.invalid(name, null, String.join("; ", errors)));
        }
        return entries;
    }

    WorkflowEntry loadFile(Path file) {
        String name = file.getFileName().toString();
        if (!Files.isRegularFile(file)) {
            return WorkflowEntry.invalid(name, file.toString(), "File not found");
        }
        try {
            JsonNode tree = objectMapper.readTree(file.toFile());
            // A missing array would otherwise deserialize to the model's empty default
            if (tree == null || !tree.path("nodes").isArray()) {
                return WorkflowEntry.invalid(name, file.toString(), "Workflow must have a \"nodes\" array");
            }
            if (!tree.path("edges").isArray()) {
                return WorkflowEntry.invalid(name, file.toString(), "Workflow must have an \"edges\" array");
            }
            Workflow workflow = objectMapper.treeToValue(tree, Workflow.class);
            List<String> errors = structuralErrors(workflow);
            if (!errors.isEmpty()) {
                log.warn("Skipping invalid workflow file {}: {}", file, errors);
                return WorkflowEntry.invalid(name, file.toString(), String.join("; ", errors));
            }
            return WorkflowEntry.valid(name, file.toString(), workflow);
        } catch (IOException e) {
            log.warn("Skipping unreadable workflow file {}: {}", file, e.getMessage());
            return WorkflowEntry.invalid(name, file.toString(), "Invalid workflow JSON: " + e.getMessage());
        }
    }

    static List<String> structuralErrors(Workflow workflow) {
        List<String> errors = new ArrayList<>();
        if (workflow == null) {
            errors.add("Workflow is empty");
            return errors;
        }
        if (workflow.getNodes() == null) errors.add("Workflow must have a \"nodes\" array");
        if (workflow.getEdges() == null) errors.add("Workflow must have an \"edges\" array");
        if (!errors.isEmpty()) return errors;
        if (workflow.getNodes().isEmpty()) {
            errors.add("Workflow has no nodes");
            return errors;
        }

        if (workflow.getNodes().stream().noneMatch(node -> NodeTypes.START.equals(node.getType()))) {
            errors.add("Workflow must contain a start node");
        }
        List<String> nodeIds = workflow.getNodes().stream()
                .map(FlowNode::getId)
                .filter(Objects::nonNull)
                .toList();
        Set<String> ids = new HashSet<>(nodeIds);
        if (ids.size() != nodeIds.size()) errors.add("Workflow contains duplicate node ids");
        for (FlowEdge edge : workflow.getEdges()) {
            if (edge.getSource() != null && !ids.contains(edge.getSource())) {
                errors.add("Edge references missing source node " + edge.getSource());
            }
            if (edge.getTarget() != null && !ids.contains(edge.getTarget())) {
                errors.add("Edge references missing target node " + edge.getTarget());
            }
        }
        return errors;
    }
}
