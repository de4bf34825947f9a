package com.browseflow.browseflow_backend.service;

import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.Workflow;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowLoaderTest {

    private static final String VALID = """
            {
              "nodes": [
                {"id": "start", "type": "start", "position": {"x": 0, "y": 0}, "data": {}},
                {"id": "nav", "type": "navigation", "data": {"url": "https://example.test"}}
              ],
              "edges": [
                {"id": "e1", "source": "start", "target": "nav", "sourceHandle": "output", "targetHandle": "input"}
              ],
              "editorVersion": 3
            }
            """;

    private final WorkflowLoader loader = new WorkflowLoader(new ObjectMapper());

    @TempDir
    Path dir;

    @Test
    void shouldLoadJsonFilesOfAFolderInNameOrder() throws IOException {
        Files.writeString(dir.resolve("b-checkout.json"), VALID);
        Files.writeString(dir.resolve("a-login.json"), VALID);
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        List<WorkflowEntry> entries = loader.loadFolder(dir.toString());

        assertThat(entries).extracting(WorkflowEntry::name).containsExactly("a-login.json", "b-checkout.json");
        assertThat(entries).allMatch(WorkflowEntry::isValid);
        assertThat(entries.get(0).workflow().getNodes()).extracting(FlowNode::getId).containsExactly("start", "nav");
    }

    @Test
    void shouldTurnBrokenFilesIntoInvalidEntries() throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.json"), "{ not json");
        Path empty = Files.writeString(dir.resolve("empty.json"), "{\"nodes\": [], \"edges\": []}");
        Path missing = dir.resolve("missing.json");

        List<WorkflowEntry> entries = loader.loadFiles(List.of(broken.toString(), empty.toString(), missing.toString()));

        assertThat(entries).noneMatch(WorkflowEntry::isValid);
        assertThat(entries.get(0).error()).startsWith("Invalid workflow JSON");
        assertThat(entries.get(1).error()).isEqualTo("Workflow has no nodes");
        assertThat(entries.get(2).error()).isEqualTo("File not found");
    }

    @Test
    void shouldMarkStructurallyBrokenWorkflowsInvalid() throws IOException {
        Files.writeString(dir.resolve("a-nostart.json"), """
                {"nodes": [{"id": "nav", "type": "navigation", "data": {}}], "edges": []}
                """);
        Files.writeString(dir.resolve("b-nulledges.json"), """
                {"nodes": [{"id": "start", "type": "start", "data": {}}], "edges": null}
                """);
        Files.writeString(dir.resolve("c-dupids.json"), """
                {"nodes": [{"id": "start", "type": "start", "data": {}}, {"id": "start", "type": "action", "data": {}}],
                 "edges": []}
                """);
        Files.writeString(dir.resolve("d-dangling.json"), """
                {"nodes": [{"id": "start", "type": "start", "data": {}}],
                 "edges": [{"id": "e1", "source": "start", "target": "ghost"}]}
                """);
        Files.writeString(dir.resolve("e-nonodes.json"), "{\"edges\": []}");
        Files.writeString(dir.resolve("f-valid.json"), VALID);

        List<WorkflowEntry> entries = loader.loadFolder(dir.toString());

        assertThat(entries).extracting(WorkflowEntry::isValid)
                .containsExactly(false, false, false, false, false, true);
        assertThat(entries.get(0).error()).isEqualTo("Workflow must contain a start node");
        assertThat(entries.get(1).error()).contains("edges");
        assertThat(entries.get(2).error()).isEqualTo("Workflow contains duplicate node ids");
        assertThat(entries.get(3).error()).isEqualTo("Edge references missing target node ghost");
        assertThat(entries.get(4).error()).contains("nodes");
    }

    @Test
    void shouldValidateInlineWorkflowsLikeFiles() throws IOException {
        Workflow valid = new ObjectMapper().readValue(VALID, Workflow.class);
        Workflow noStart = new ObjectMapper().readValue(
                "{\"nodes\": [{\"id\": \"nav\", \"type\": \"navigation\"}], \"edges\": []}", Workflow.class);

        List<WorkflowEntry> entries = loader.fromWorkflows(List.of(valid, noStart));

        assertThat(entries.get(0).isValid()).isTrue();
        assertThat(entries.get(1).isValid()).isFalse();
        assertThat(entries.get(1).error()).isEqualTo("Workflow must contain a start node");
    }

    @Test
    void shouldRejectMissingFolder() {
        assertThatThrownBy(() -> loader.loadFolder(dir.resolve("nope").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Folder not found");
    }

    @Test
    void shouldNameInlineWorkflowsByPosition() throws IOException {
        Workflow workflow = new ObjectMapper().readValue(VALID, Workflow.class);
        List<Workflow> inline = new ArrayList<>(Arrays.asList(workflow, null));

        List<WorkflowEntry> entries = loader.fromWorkflows(inline);

        assertThat(entries).extracting(WorkflowEntry::name).containsExactly("workflow-1", "workflow-2");
        assertThat(entries.get(0).isValid()).isTrue();
        assertThat(entries.get(1).isValid()).isFalse();
    }
}
