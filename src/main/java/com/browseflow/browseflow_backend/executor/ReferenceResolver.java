package com.browseflow.browseflow_backend.executor;

import com.browseflow.browseflow_backend.model.context.ExecutionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class ReferenceResolver {

    // Matches ${data.key.field} or ${variables.name.field}
    private static final Pattern REF_PATTERN = Pattern.compile("\\$\\{([^}]+)}");

    /**
     * Replaces every ${data.*} and ${variables.*} reference with its value from the context.
     * References that do not resolve are left in place so the problem stays visible.
     */
    public String resolve(String template, ExecutionContext context) {
        if (template == null || !template.contains("${") || context == null) return template;

        Matcher matcher = REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String path = matcher.group(1).trim();
            Object value = resolvePath(path, context);
            if (value == null) {
                log.debug("Reference ${{}} did not resolve in execution {}", path, context.getExecutionId());
                matcher.appendReplacement(result, Matcher.quoteReplacement(matcher.group()));
            } else {
                matcher.appendReplacement(result, Matcher.quoteReplacement(value.toString()));
            }
        }
        matcher.appendTail(result);
        return result.toString();
    }

    // A value that is exactly one reference keeps its original type (number, map, list)
    public Map<String, Object> resolveMap(Map<String, Object> data, ExecutionContext context) {
        if (data == null) return new HashMap<>();

        Map<String, Object> resolved = new HashMap<>();
        data.forEach((key, value) -> {
            if (value instanceof String s) {
                String trimmed = s.trim();
                Matcher whole = REF_PATTERN.matcher(trimmed);
                if (whole.matches()) {
                    Object obj = resolvePath(whole.group(1).trim(), context);
                    resolved.put(key, obj != null ? obj : s);
                } else {
                    resolved.put(key, resolve(s, context));
                }
            } else {
                resolved.put(key, value);
            }
        });
        return resolved;
    }

    private Object resolvePath(String path, ExecutionContext context) {
        int dot = path.indexOf('.');
        if (dot <= 0 || dot == path.length() - 1) return null;
        String scope = path.substring(0, dot);
        String remainder = path.substring(dot + 1);
        String rootKey = remainder.contains(".") ? remainder.substring(0, remainder.indexOf('.')) : remainder;
        String nested = remainder.contains(".") ? remainder.substring(remainder.indexOf('.') + 1) : null;

        Object root = switch (scope) {
            case "data"      -> context.getData(rootKey);
            case "variables" -> context.getVariable(rootKey);
            default          -> null;
        };
        return nested == null ? root : resolveNestedPath(root, nested);
    }

    /** Walk a map/list tree by dot path (e.g. "user.items.0.id"). Returns null if any step is missing. */
    @SuppressWarnings("unchecked")
    private Object resolveNestedPath(Object root, String path) {
        Object current = root;
        for (String raw : path.split("\\.")) {
            if (current == null) return null;
            String seg = raw.trim();
            if (seg.isEmpty()) return null;
            if (current instanceof Map<?, ?> map) {
                current = ((Map<String, Object>) map).get(seg);
            } else if (current instanceof List<?> list && seg.matches("\\d+")) {
                int idx = Integer.parseInt(seg);
                if (idx >= list.size()) return null;
                current = list.get(idx);
            } else {
                return null;
            }
        }
        return current;
    }
}
