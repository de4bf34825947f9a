package com.browseflow.browseflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Workflow {

    @Builder.Default
    private List<FlowNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<FlowEdge> edges = new ArrayList<>();

    public static Workflow empty() {
        return new Workflow(new ArrayList<>(), new ArrayList<>());
    }

    @JsonIgnore
    public Optional<FlowNode> findNode(String nodeId) {
        return nodes.stream().filter(n -> n.getId().equals(nodeId)).findFirst();
    }

    @JsonIgnore
    public List<FlowEdge> driverEdgesFrom(String nodeId) {
        return edges.stream()
                .filter(e -> nodeId.equals(e.getSource()) && e.isDriverEdge())
                .toList();
    }

    @JsonIgnore
    public List<FlowEdge> propertyInputsTo(String nodeId) {
        return edges.stream()
                .filter(e -> nodeId.equals(e.getTarget()) && e.isPropertyInput())
                .toList();
    }
}
