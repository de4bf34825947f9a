package com.browseflow.browseflow_backend.model.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetryCondition {

    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    private Kind type;

    // Selector, URL pattern or javascript predicate depending on type
    private String value;

    private String selectorType;

    @Builder.Default
    private long timeout = DEFAULT_TIMEOUT_MS;

    public enum Kind {
        @JsonProperty("selector") SELECTOR,
        @JsonProperty("url") URL,
        @JsonProperty("javascript") JAVASCRIPT
    }
}
