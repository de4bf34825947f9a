package com.browseflow.browseflow_backend.engine;

import com.browseflow.browseflow_backend.model.domain.FlowEdge;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import com.browseflow.browseflow_backend.model.domain.Workflow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

/** Turns a workflow graph into the order its nodes run in. Only driver edges count. */
@Slf4j
@Component
public class WorkflowParser {

    public void validate(Workflow workflow) {
        if (workflow == null || workflow.getNodes() == null || workflow.getNodes().isEmpty()) {
            throw new WorkflowValidationException("Workflow has no nodes");
        }
        if (workflow.getEdges() == null) {
            throw new WorkflowValidationException("Workflow must have an \"edges\" array");
        }
        long starts = workflow.getNodes().stream().filter(n -> NodeTypes.START.equals(n.getType())).count();
        if (starts == 0) {
            throw new WorkflowValidationException("Workflow must contain a start node");
        }
        if (starts > 1) {
            throw new WorkflowValidationException("Workflow must contain exactly one start node, found " + starts);
        }
        Set<String> ids = workflow.getNodes().stream().map(FlowNode::getId).collect(Collectors.toSet());
        for (FlowEdge edge : workflow.getEdges()) {
            if (!ids.contains(edge.getSource()) || !ids.contains(edge.getTarget())) {
                log.warn("Edge {} references a missing node ({} -> {}), ignoring it",
                        edge.getId(), edge.getSource(), edge.getTarget());
            }
        }
    }

    /** Nodes reachable from the start node, in topological order. */
    public List<FlowNode> executionOrder(Workflow workflow) {
        validate(workflow);
        FlowNode start = workflow.getNodes().stream()
                .filter(n -> NodeTypes.START.equals(n.getType()))
                .findFirst()
                .orElseThrow();

        Set<String> known = workflow.getNodes().stream().map(FlowNode::getId).collect(Collectors.toSet());
        Set<String> reachable = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(start.getId());
        reachable.add(start.getId());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (FlowEdge edge : workflow.driverEdgesFrom(current)) {
                if (known.contains(edge.getTarget()) && reachable.add(edge.getTarget())) queue.add(edge.getTarget());
            }
        }
        return topologicalOrder(workflow, reachable);
    }

    /** Every node of a (start-less) sub-workflow, in topological order. */
    public List<FlowNode> subWorkflowOrder(Workflow subWorkflow) {
        Set<String> all = subWorkflow.getNodes().stream()
                .map(FlowNode::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return topologicalOrder(subWorkflow, all);
    }

    private List<FlowNode> topologicalOrder(Workflow workflow, Set<String> included) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        included.forEach(id -> inDegree.put(id, 0));

        for (FlowEdge edge : workflow.getEdges()) {
            if (!edge.isDriverEdge()) continue;
            if (!included.contains(edge.getSource()) || !included.contains(edge.getTarget())) continue;
            successors.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
            inDegree.merge(edge.getTarget(), 1, Integer::sum);
        }

        // Seed in declaration order so ties resolve the way the editor lists nodes
        Queue<String> ready = new ArrayDeque<>();
        workflow.getNodes().stream()
                .map(FlowNode::getId)
                .filter(id -> included.contains(id) && inDegree.get(id) == 0)
                .forEach(ready::add);

        Map<String, FlowNode> byId = workflow.getNodes().stream()
                .collect(Collectors.toMap(FlowNode::getId, n -> n, (a, b) -> a));
        List<FlowNode> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            ordered.add(byId.get(id));
            for (String next : successors.getOrDefault(id, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) ready.add(next);
            }
        }

        if (ordered.size() < included.size()) {
            List<String> cyclic = included.stream()
                    .filter(id -> inDegree.getOrDefault(id, 0) > 0)
                    .toList();
            throw new WorkflowValidationException("Circular dependency detected involving nodes: " + cyclic);
        }
        return ordered;
    }
}
