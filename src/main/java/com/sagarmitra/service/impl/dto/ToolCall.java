package com.sagarmitra.service.impl.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured tool invocation requested by the model.
 */
public record ToolCall(String id, String name, Map<String, Object> arguments) {

    public ToolCall {
        // model-supplied JSON may carry null values
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
