package com.browseflow.browseflow_backend.engine;

import com.browseflow.browseflow_backend.model.domain.FlowEdge;
import com.browseflow.browseflow_backend.model.domain.FlowNode;
import com.browseflow.browseflow_backend.model.domain.NodeTypes;
import com.browseflow.browseflow_backend.model.domain.Workflow;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds the nodes that belong to a reusable sub-flow.
 *
 * <p>A scope starts after a {@code reusable.reusable} entry node and runs along driver edges up
 * to the matching {@code reusable.end}. Nested entries open inner scopes; an end node met while
 * inside an inner scope closes that inner scope and traversal continues past it.
 */
@Component
public class ReusableScopeExtractor {

    public Optional<FlowNode> findEntryByContext(Workflow workflow, String contextName) {
        if (contextName == null) return Optional.empty();
        return workflow.getNodes().stream()
                .filter(n -> NodeTypes.REUSABLE_ENTRY.equals(n.getType()))
                .filter(n -> contextName.equals(n.getString("contextName")))
                .findFirst();
    }

    public Set<String> getScope(Workflow workflow, String entryNodeId) {
        Map<String, FlowNode> nodesById = index(workflow);
        Set<String> scope = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        visited.add(entryNodeId);

        // Each frame carries the nesting depth of the path that reached it
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(entryNodeId, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            for (FlowEdge edge : workflow.driverEdgesFrom(frame.nodeId())) {
                String targetId = edge.getTarget();
                FlowNode target = nodesById.get(targetId);
                if (target == null || !visited.add(targetId)) continue;

                scope.add(targetId);
                String type = target.getType();
                if (NodeTypes.REUSABLE_ENTRY.equals(type)) {
                    stack.push(new Frame(targetId, frame.depth() + 1));
                } else if (NodeTypes.REUSABLE_END.equals(type)) {
                    if (frame.depth() > 0) {
                        stack.push(new Frame(targetId, frame.depth() - 1));
                    }
                    // depth 0: this end closes our scope, stop here
                } else {
                    stack.push(new Frame(targetId, frame.depth()));
                }
            }
        }
        scope.remove(entryNodeId);
        return scope;
    }

    /**
     * Builds the sub-workflow for one scope. Every edge whose target lies in the scope is kept,
     * including property inputs wired in from outside it.
     */
    public Workflow extract(Workflow workflow, String entryNodeId) {
        Set<String> scope = getScope(workflow, entryNodeId);
        if (scope.isEmpty()) return Workflow.empty();

        List<FlowNode> nodes = workflow.getNodes().stream()
                .filter(n -> scope.contains(n.getId()))
                .collect(Collectors.toList());
        List<FlowEdge> edges = workflow.getEdges().stream()
                .filter(e -> scope.contains(e.getTarget()))
                .collect(Collectors.toList());
        return Workflow.builder().nodes(nodes).edges(edges).build();
    }

    /** Entry node id to its scope, for every reusable entry in the workflow. */
    public Map<String, Set<String>> getAllScopes(Workflow workflow) {
        Map<String, Set<String>> scopes = new LinkedHashMap<>();
        workflow.getNodes().stream()
                .filter(n -> NodeTypes.REUSABLE_ENTRY.equals(n.getType()))
                .forEach(entry -> scopes.put(entry.getId(), getScope(workflow, entry.getId())));
        return scopes;
    }

    public Set<String> nodesInAnyScope(Workflow workflow) {
        Set<String> all = new HashSet<>();
        getAllScopes(workflow).values().forEach(all::addAll);
        return all;
    }

    private static Map<String, FlowNode> index(Workflow workflow) {
        return workflow.getNodes().stream()
                .filter(n -> Objects.nonNull(n.getId()))
                .collect(Collectors.toMap(FlowNode::getId, Function.identity(), (a, b) -> a));
    }

    private record Frame(String nodeId, int depth) {}
}
