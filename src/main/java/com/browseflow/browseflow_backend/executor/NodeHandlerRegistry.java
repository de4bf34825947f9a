package com.browseflow.browseflow_backend.executor;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class NodeHandlerRegistry {

    private final List<NodeHandler> handlers;
    private final Map<String, NodeHandler> registry = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        handlers.forEach(this::register);
        log.info("Registered node handlers: {}", supportedTypes());
    }

    /** Adds or replaces the handler for its type. Plugin node types come in through here. */
    public void register(NodeHandler handler) {
        NodeHandler previous = registry.put(handler.supportedType(), handler);
        if (previous != null && previous != handler) {
            log.warn("Handler for node type {} replaced: {} -> {}", handler.supportedType(),
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        }
    }

    public NodeHandler get(String type) {
        NodeHandler handler = type != null ? registry.get(type) : null;
        if (handler == null) {
            throw new UnsupportedOperationException("No handler registered for node type: " + type);
        }
        return handler;
    }

    public boolean isSupported(String type) {
        return type != null && registry.containsKey(type);
    }

    public Set<String> supportedTypes() {
        return new TreeSet<>(registry.keySet());
    }
}
