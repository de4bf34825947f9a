package com.browseflow.browseflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowNode {

    private String id;

    // Type tag, e.g. "navigation", "action", "reusable.reusable"
    private String type;

    // Canvas position
    private NodePosition position;

    // All node-specific configuration as written by the editor
    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    public record NodePosition(double x, double y) {}

    @JsonIgnore
    public Object get(String key) {
        return data != null ? data.get(key) : null;
    }

    @JsonIgnore
    public String getString(String key) {
        Object value = get(key);
        return value != null ? value.toString() : null;
    }

    @JsonIgnore
    public boolean getBoolean(String key) {
        Object value = get(key);
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }

    @JsonIgnore
    public long getLong(String key, long defaultValue) {
        Object value = get(key);
        if (value instanceof Number n) return n.longValue();
        if (value == null || value.toString().isBlank()) return defaultValue;
        try {
            return (long) Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @JsonIgnore
    public boolean isBypassed() {
        return getBoolean("bypass");
    }

    @JsonIgnore
    public boolean isBreakpointMarked() {
        return getBoolean("breakpoint");
    }
}
